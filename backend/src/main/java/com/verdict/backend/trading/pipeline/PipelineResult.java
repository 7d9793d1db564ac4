package com.verdict.backend.trading.pipeline;

import com.verdict.backend.model.DebateResult;
import com.verdict.backend.model.Decision;
import com.verdict.backend.model.Portfolio;
import com.verdict.backend.model.RiskAssessment;
import com.verdict.backend.model.SignalSet;
import com.verdict.backend.model.Thesis;

import java.time.LocalDate;

/**
 * Every artifact of a completed run, for audit alongside the terminal decision.
 */
public record PipelineResult(
        String ticker,
        LocalDate startDate,
        LocalDate endDate,
        double lastPrice,
        Portfolio portfolio,
        SignalSet signals,
        Thesis bullThesis,
        Thesis bearThesis,
        DebateResult debate,
        RiskAssessment risk,
        Decision decision
) {

    static PipelineResult from(RunContext context) {
        return new PipelineResult(context.ticker(), context.startDate(), context.endDate(), context.lastPrice(),
                context.portfolio(), context.signals(), context.bullThesis(), context.bearThesis(), context.debate(),
                context.risk(), context.decision());
    }
}
