package com.verdict.backend.trading.pipeline;

import com.verdict.backend.model.Candle;
import com.verdict.backend.model.DebateResult;
import com.verdict.backend.model.Decision;
import com.verdict.backend.model.Portfolio;
import com.verdict.backend.model.RiskAssessment;
import com.verdict.backend.model.SignalSet;
import com.verdict.backend.model.Thesis;

import java.time.LocalDate;
import java.util.List;

/**
 * Accumulated state of one run. Every stage returns a new context with its own result filled in.
 */
public record RunContext(
        String ticker,
        LocalDate startDate,
        LocalDate endDate,
        Portfolio portfolio,
        SignalSet signals,
        List<Candle> candles,
        Thesis bullThesis,
        Thesis bearThesis,
        DebateResult debate,
        RiskAssessment risk,
        Decision decision
) {

    public RunContext {
        candles = candles == null ? List.of() : List.copyOf(candles);
    }

    public static RunContext start(String ticker, LocalDate startDate, LocalDate endDate, Portfolio portfolio,
                                   SignalSet signals, List<Candle> candles) {
        return new RunContext(ticker, startDate, endDate, portfolio, signals, candles, null, null, null, null, null);
    }

    public double lastPrice() {
        return candles.get(candles.size() - 1).getClose();
    }

    public RunContext withBullThesis(Thesis thesis) {
        return new RunContext(ticker, startDate, endDate, portfolio, signals, candles, thesis, bearThesis, debate, risk, decision);
    }

    public RunContext withBearThesis(Thesis thesis) {
        return new RunContext(ticker, startDate, endDate, portfolio, signals, candles, bullThesis, thesis, debate, risk, decision);
    }

    public RunContext withDebate(DebateResult result) {
        return new RunContext(ticker, startDate, endDate, portfolio, signals, candles, bullThesis, bearThesis, result, risk, decision);
    }

    public RunContext withRisk(RiskAssessment assessment) {
        return new RunContext(ticker, startDate, endDate, portfolio, signals, candles, bullThesis, bearThesis, debate, assessment, decision);
    }

    public RunContext withDecision(Decision result) {
        return new RunContext(ticker, startDate, endDate, portfolio, signals, candles, bullThesis, bearThesis, debate, risk, result);
    }
}
