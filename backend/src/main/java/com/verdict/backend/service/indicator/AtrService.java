package com.verdict.backend.service.indicator;

import com.verdict.backend.config.AgentProperties;
import com.verdict.backend.model.Candle;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.util.List;

@Service
@RequiredArgsConstructor
public class AtrService {

    private final AgentProperties agentProperties;

    /**
     * Latest Wilder ATR and the ATR as a percentage of the last close.
     */
    public AtrResult calculate(List<Candle> candles) {
        int period = agentProperties.getTechnical().getAtrPeriod();
        if (candles == null || candles.size() < period + 1) {
            return new AtrResult(0, 0, 0);
        }
        double atr = 0.0;
        for (int i = 1; i <= period; i++) {
            atr += TrueRange.of(candles.get(i), candles.get(i - 1));
        }
        atr /= period;
        double atrSum = atr;
        int samples = 1;
        for (int i = period + 1; i < candles.size(); i++) {
            atr = ((atr * (period - 1)) + TrueRange.of(candles.get(i), candles.get(i - 1))) / period;
            atrSum += atr;
            samples++;
        }
        double lastClose = candles.get(candles.size() - 1).getClose();
        double atrPercent = lastClose <= 0 ? 0 : (atr / lastClose) * 100.0;
        return new AtrResult(atr, atrPercent, atrSum / samples);
    }

    /**
     * @param averageAtr mean of every smoothed ATR value over the history, used as the regime baseline
     */
    public record AtrResult(double atr, double atrPercent, double averageAtr) {

        public double ratio() {
            return averageAtr == 0 ? 1.0 : atr / averageAtr;
        }
    }
}
