package com.verdict.backend.model;

import java.util.List;

/**
 * Reconciled view of the bull and bear theses plus the external opinion.
 * {@code mixedConfidenceDiff = (1 - w) * confidenceDiff + w * llmScore} with {@code w} the configured opinion weight.
 */
public record DebateResult(
        SignalDirection signal,
        double confidence,
        double bullConfidence,
        double bearConfidence,
        double confidenceDiff,
        double llmScore,
        double mixedConfidenceDiff,
        String reasoning,
        List<String> debateSummary,
        String llmAnalysis,
        String llmReasoning,
        CompletionOutcome llmOutcome
) {

    public DebateResult {
        debateSummary = debateSummary == null ? List.of() : List.copyOf(debateSummary);
    }
}
