package com.verdict.backend.service.indicator;

import com.verdict.backend.model.Candle;

final class TrueRange {

    private TrueRange() {}

    static double of(Candle current, Candle previous) {
        return Math.max(current.getHigh() - current.getLow(),
                Math.max(Math.abs(current.getHigh() - previous.getClose()),
                        Math.abs(current.getLow() - previous.getClose())));
    }
}
