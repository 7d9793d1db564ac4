package com.verdict.backend.model;

/**
 * The four analytical methods feeding a run, in the order they are reported.
 */
public enum SignalSource {
    VALUATION("valuation_analysis", "Valuation"),
    FUNDAMENTALS("fundamental_analysis", "Fundamental"),
    TECHNICAL("technical_analysis", "Technical"),
    SENTIMENT("sentiment_analysis", "Sentiment");

    private final String agentName;
    private final String displayName;

    SignalSource(String agentName, String displayName) {
        this.agentName = agentName;
        this.displayName = displayName;
    }

    public String agentName() {
        return agentName;
    }

    public String displayName() {
        return displayName;
    }
}
