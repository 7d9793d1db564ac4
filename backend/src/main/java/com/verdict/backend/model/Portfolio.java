package com.verdict.backend.model;

/**
 * Caller-owned holdings. Read-only for the duration of a run.
 */
public record Portfolio(double cash, long shares) {

    public Portfolio {
        if (Double.isNaN(cash) || cash < 0) {
            throw new IllegalArgumentException("cash must be >= 0");
        }
        if (shares < 0) {
            throw new IllegalArgumentException("shares must be >= 0");
        }
    }

    public double positionValue(double price) {
        return shares * price;
    }

    public double totalValue(double price) {
        return cash + positionValue(price);
    }
}
