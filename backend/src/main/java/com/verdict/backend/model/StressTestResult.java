package com.verdict.backend.model;

/**
 * @param portfolioImpact NaN when the portfolio has no value
 */
public record StressTestResult(double potentialLoss, double portfolioImpact) {}
