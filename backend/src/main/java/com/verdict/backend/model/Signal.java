package com.verdict.backend.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Normalized output of one signal producer.
 *
 * @param direction  net direction of the method
 * @param confidence strength of the direction in [0, 1]
 * @param rationale  sub-signal name to human readable explanation, insertion ordered
 */
public record Signal(SignalDirection direction, double confidence, Map<String, String> rationale) {

    public Signal {
        Objects.requireNonNull(direction, "direction");
        if (Double.isNaN(confidence) || confidence < 0.0 || confidence > 1.0) {
            throw new IllegalArgumentException("confidence must be within [0, 1]: " + confidence);
        }
        rationale = rationale == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(rationale));
    }

    public static Signal of(SignalDirection direction, double confidence) {
        return new Signal(direction, confidence, Map.of());
    }
}
