package com.verdict.backend.model;

/**
 * One row of a decision's per-signal breakdown.
 *
 * @param weight advisory weight, null for rows reported by the completion service
 */
public record AgentSignal(String agentName, SignalDirection signal, double confidence, Double weight) {}
