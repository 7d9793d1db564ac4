package com.verdict.backend.model;

import java.util.List;

/**
 * Terminal artifact of one run.
 *
 * @param perSignalBreakdown local signals with their advisory weights
 * @param reportedSignals    signals as restated by the completion service, empty on fallback
 * @param fallbackCause      set only when the conservative default was used
 * @param constraintNotes    one entry per hard constraint that changed the requested order
 */
public record Decision(
        DecisionAction action,
        long quantity,
        double confidence,
        List<AgentSignal> perSignalBreakdown,
        List<AgentSignal> reportedSignals,
        String reasoning,
        String fallbackCause,
        List<String> constraintNotes
) {

    public Decision {
        perSignalBreakdown = perSignalBreakdown == null ? List.of() : List.copyOf(perSignalBreakdown);
        reportedSignals = reportedSignals == null ? List.of() : List.copyOf(reportedSignals);
        constraintNotes = constraintNotes == null ? List.of() : List.copyOf(constraintNotes);
    }

    public boolean isFallback() {
        return fallbackCause != null;
    }

    public enum DecisionAction {
        BUY,
        SELL,
        HOLD
    }
}
