package com.verdict.backend.trading.pipeline;

/**
 * Stages in execution order. Each stage needs the complete output of every earlier one.
 */
public enum PipelineStage {
    BULL_THESIS,
    BEAR_THESIS,
    DEBATE,
    RISK,
    DECISION
}
