package com.verdict.backend.service.indicator;

import com.verdict.backend.config.AgentProperties;
import com.verdict.backend.model.Candle;
import com.verdict.backend.util.SeriesMath;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

@Service
@RequiredArgsConstructor
public class MacdService {

    private final AgentProperties agentProperties;

    public MacdResult calculate(List<Candle> candles) {
        if (candles == null || candles.isEmpty()) {
            return MacdResult.EMPTY;
        }
        AgentProperties.Technical config = agentProperties.getTechnical();
        List<Double> closes = candles.stream().map(Candle::getClose).toList();
        List<Double> fastSeries = SeriesMath.emaSeries(closes, config.getMacdFastPeriod());
        List<Double> slowSeries = SeriesMath.emaSeries(closes, config.getMacdSlowPeriod());

        List<Double> macdSeries = new ArrayList<>();
        for (int i = 0; i < closes.size(); i++) {
            Double fastVal = fastSeries.get(i);
            Double slowVal = slowSeries.get(i);
            if (fastVal != null && slowVal != null) {
                macdSeries.add(fastVal - slowVal);
            }
        }
        if (macdSeries.size() < config.getMacdSignalPeriod()) {
            return MacdResult.EMPTY;
        }

        List<Double> signalSeries = SeriesMath.emaSeries(macdSeries, config.getMacdSignalPeriod());
        double macdLine = macdSeries.get(macdSeries.size() - 1);
        double signalLine = signalSeries.get(signalSeries.size() - 1);
        return new MacdResult(macdLine, signalLine, macdLine - signalLine, true);
    }

    public record MacdResult(double macdLine, double signalLine, double histogram, boolean available) {
        static final MacdResult EMPTY = new MacdResult(0, 0, 0, false);
    }
}
