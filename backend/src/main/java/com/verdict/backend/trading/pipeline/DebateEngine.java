package com.verdict.backend.trading.pipeline;

import com.verdict.backend.model.DebateResult;
import com.verdict.backend.model.Thesis;

public interface DebateEngine {
    DebateResult debate(String ticker, Thesis bullThesis, Thesis bearThesis);
}
