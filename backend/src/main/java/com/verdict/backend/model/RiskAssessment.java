package com.verdict.backend.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

public record RiskAssessment(
        int riskScore,
        double maxPositionValue,
        TradingAction tradingAction,
        RiskMetrics metrics,
        Map<String, StressTestResult> stressResults,
        String reasoning
) {

    public RiskAssessment {
        stressResults = stressResults == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(stressResults));
    }
}
