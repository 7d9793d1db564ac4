package com.verdict.backend.trading.pipeline;

import com.verdict.backend.model.Candle;
import com.verdict.backend.model.DebateResult;
import com.verdict.backend.model.Portfolio;
import com.verdict.backend.model.RiskAssessment;

import java.util.List;

public interface RiskEngine {
    RiskAssessment evaluate(List<Candle> candles, DebateResult debate, Portfolio portfolio);
}
