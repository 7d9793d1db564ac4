package com.verdict.backend.model;

/**
 * @param marketRiskScore score from price statistics only, before debate uncertainty is added
 * @param riskScore       final capped score
 */
public record RiskMetrics(
        double volatility,
        double volatilityPercentile,
        double var95,
        double maxDrawdown,
        int marketRiskScore,
        int riskScore
) {}
