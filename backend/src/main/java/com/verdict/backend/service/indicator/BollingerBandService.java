package com.verdict.backend.service.indicator;

import com.verdict.backend.config.AgentProperties;
import com.verdict.backend.model.Candle;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.util.List;

@Service
@RequiredArgsConstructor
public class BollingerBandService {

    private final AgentProperties agentProperties;

    public BollingerBands calculate(List<Candle> candles) {
        AgentProperties.Technical config = agentProperties.getTechnical();
        int period = config.getBollingerPeriod();
        if (candles == null || candles.size() < period) {
            return new BollingerBands(0, 0, 0, 0.5);
        }
        List<Candle> window = candles.subList(candles.size() - period, candles.size());
        double mean = window.stream().mapToDouble(Candle::getClose).average().orElse(0.0);
        double variance = window.stream()
                .mapToDouble(candle -> {
                    double diff = candle.getClose() - mean;
                    return diff * diff;
                })
                .average()
                .orElse(0.0);
        double deviation = Math.sqrt(variance) * config.getBollingerDeviation();
        double upper = mean + deviation;
        double lower = mean - deviation;
        double lastClose = candles.get(candles.size() - 1).getClose();
        double position = upper == lower ? 0.5 : (lastClose - lower) / (upper - lower);
        return new BollingerBands(upper, mean, lower, position);
    }

    /**
     * @param position where the last close sits between the bands, 0 at the lower band and 1 at the upper
     */
    public record BollingerBands(double upper, double middle, double lower, double position) {}
}
