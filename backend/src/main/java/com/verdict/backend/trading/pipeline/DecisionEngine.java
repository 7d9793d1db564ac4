package com.verdict.backend.trading.pipeline;

import com.verdict.backend.model.Decision;
import com.verdict.backend.model.Portfolio;
import com.verdict.backend.model.RiskAssessment;
import com.verdict.backend.model.SignalSet;

public interface DecisionEngine {
    Decision decide(String ticker, SignalSet signals, RiskAssessment risk, Portfolio portfolio, double lastPrice);
}
