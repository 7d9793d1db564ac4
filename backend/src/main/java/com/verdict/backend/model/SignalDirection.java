package com.verdict.backend.model;

import java.util.Locale;
import java.util.Optional;

public enum SignalDirection {
    BULLISH,
    BEARISH,
    NEUTRAL;

    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static Optional<SignalDirection> fromText(String text) {
        if (text == null) {
            return Optional.empty();
        }
        String normalized = text.trim().toUpperCase(Locale.ROOT);
        for (SignalDirection direction : values()) {
            if (direction.name().equals(normalized)) {
                return Optional.of(direction);
            }
        }
        return Optional.empty();
    }
}
