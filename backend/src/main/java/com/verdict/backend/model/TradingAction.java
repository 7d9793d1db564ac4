package com.verdict.backend.model;

import java.util.Locale;

/**
 * Action recommended by the risk stage.
 */
public enum TradingAction {
    BUY,
    SELL,
    HOLD,
    REDUCE;

    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }
}
