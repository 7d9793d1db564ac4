package com.verdict.backend.service.indicator;

import com.verdict.backend.config.AgentProperties;
import com.verdict.backend.model.Candle;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Wilder-smoothed relative strength index. Returns 50 when history is shorter than the period.
 */
@Service
@RequiredArgsConstructor
public class RsiService {

    private final AgentProperties agentProperties;

    public RsiResult calculate(List<Candle> candles) {
        int period = agentProperties.getTechnical().getRsiPeriod();
        if (candles == null || candles.size() < period + 1) {
            return new RsiResult(50.0, false);
        }

        double avgGain = 0.0;
        double avgLoss = 0.0;
        for (int i = 1; i <= period; i++) {
            double change = candles.get(i).getClose() - candles.get(i - 1).getClose();
            if (change > 0) {
                avgGain += change;
            } else {
                avgLoss += Math.abs(change);
            }
        }
        avgGain /= period;
        avgLoss /= period;

        for (int i = period + 1; i < candles.size(); i++) {
            double change = candles.get(i).getClose() - candles.get(i - 1).getClose();
            avgGain = ((avgGain * (period - 1)) + Math.max(change, 0.0)) / period;
            avgLoss = ((avgLoss * (period - 1)) + Math.max(-change, 0.0)) / period;
        }

        if (avgLoss == 0) {
            return new RsiResult(avgGain == 0 ? 50.0 : 100.0, true);
        }
        double rs = avgGain / avgLoss;
        return new RsiResult(100.0 - (100.0 / (1.0 + rs)), true);
    }

    public record RsiResult(double rsi, boolean available) {

        public boolean overbought() {
            return available && rsi > 70.0;
        }

        public boolean oversold() {
            return available && rsi < 30.0;
        }
    }
}
