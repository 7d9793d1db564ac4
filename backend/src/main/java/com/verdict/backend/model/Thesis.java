package com.verdict.backend.model;

import java.util.List;

/**
 * One-sided argument built from all four signals.
 *
 * @param stance     {@link SignalDirection#BULLISH} or {@link SignalDirection#BEARISH}
 * @param confidence mean of the four per-signal contributions
 * @param points     one point per signal, in {@link SignalSource} order
 */
public record Thesis(SignalDirection stance, double confidence, List<String> points, String reasoning) {

    public Thesis {
        points = points == null ? List.of() : List.copyOf(points);
    }
}
