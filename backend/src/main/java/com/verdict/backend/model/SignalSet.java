package com.verdict.backend.model;

import com.verdict.backend.exception.MissingPreconditionException;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * The four signals of one run. Any of them may be absent until {@link #requireComplete()} is called.
 */
public record SignalSet(Signal valuation, Signal fundamentals, Signal technical, Signal sentiment) {

    public Signal get(SignalSource source) {
        return switch (source) {
            case VALUATION -> valuation;
            case FUNDAMENTALS -> fundamentals;
            case TECHNICAL -> technical;
            case SENTIMENT -> sentiment;
        };
    }

    public SignalSet requireComplete() {
        List<String> missing = new ArrayList<>();
        for (SignalSource source : SignalSource.values()) {
            if (get(source) == null) {
                missing.add(source.agentName());
            }
        }
        if (!missing.isEmpty()) {
            throw new MissingPreconditionException("Missing signals: " + String.join(", ", missing));
        }
        return this;
    }

    public static SignalSet fromMap(Map<SignalSource, Signal> signals) {
        return new SignalSet(
                signals.get(SignalSource.VALUATION),
                signals.get(SignalSource.FUNDAMENTALS),
                signals.get(SignalSource.TECHNICAL),
                signals.get(SignalSource.SENTIMENT)
        );
    }
}
