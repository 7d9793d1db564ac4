package com.verdict.backend.model;

import java.time.LocalDateTime;

/**
 * @param sentiment per-article score in [-1, 1] assigned upstream
 */
public record NewsItem(String title, LocalDateTime publishedAt, double sentiment) {}
