package com.verdict.backend.service.indicator;

import com.verdict.backend.config.AgentProperties;
import com.verdict.backend.model.Candle;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Average directional index with Wilder smoothing of true range and directional movement.
 */
@Service
@RequiredArgsConstructor
public class AdxService {

    private final AgentProperties agentProperties;

    public AdxResult calculate(List<Candle> candles) {
        int period = agentProperties.getTechnical().getAdxPeriod();
        if (candles == null || candles.size() < period + 1) {
            return new AdxResult(0, 0, 0);
        }

        List<Double> tr = new ArrayList<>();
        List<Double> dmPlus = new ArrayList<>();
        List<Double> dmMinus = new ArrayList<>();
        for (int i = 1; i < candles.size(); i++) {
            Candle curr = candles.get(i);
            Candle prev = candles.get(i - 1);
            double upMove = curr.getHigh() - prev.getHigh();
            double downMove = prev.getLow() - curr.getLow();
            tr.add(TrueRange.of(curr, prev));
            dmPlus.add((upMove > downMove && upMove > 0) ? upMove : 0.0);
            dmMinus.add((downMove > upMove && downMove > 0) ? downMove : 0.0);
        }

        double smoothTr = sum(tr, period);
        double smoothPlus = sum(dmPlus, period);
        double smoothMinus = sum(dmMinus, period);
        List<Double> dxValues = new ArrayList<>();
        double plusDi = 0.0;
        double minusDi = 0.0;
        for (int i = period - 1; i < tr.size(); i++) {
            if (i > period - 1) {
                smoothTr = smoothTr - (smoothTr / period) + tr.get(i);
                smoothPlus = smoothPlus - (smoothPlus / period) + dmPlus.get(i);
                smoothMinus = smoothMinus - (smoothMinus / period) + dmMinus.get(i);
            }
            if (smoothTr == 0) {
                continue;
            }
            plusDi = 100.0 * (smoothPlus / smoothTr);
            minusDi = 100.0 * (smoothMinus / smoothTr);
            double diSum = plusDi + minusDi;
            dxValues.add(diSum == 0 ? 0.0 : (Math.abs(plusDi - minusDi) / diSum) * 100.0);
        }

        if (dxValues.size() < period) {
            return new AdxResult(0, plusDi, minusDi);
        }
        double adx = dxValues.subList(0, period).stream().mapToDouble(Double::doubleValue).average().orElse(0.0);
        for (int i = period; i < dxValues.size(); i++) {
            adx = ((adx * (period - 1)) + dxValues.get(i)) / period;
        }
        return new AdxResult(adx, plusDi, minusDi);
    }

    private static double sum(List<Double> values, int count) {
        return values.subList(0, count).stream().mapToDouble(Double::doubleValue).sum();
    }

    public record AdxResult(double adx, double plusDi, double minusDi) {}
}
