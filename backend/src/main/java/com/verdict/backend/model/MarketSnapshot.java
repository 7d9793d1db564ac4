package com.verdict.backend.model;

public record MarketSnapshot(double marketCap, String sector) {}
