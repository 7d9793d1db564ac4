package com.verdict.backend.service.risk;

import com.verdict.backend.config.AgentProperties;
import com.verdict.backend.exception.MissingPreconditionException;
import com.verdict.backend.model.Candle;
import com.verdict.backend.util.SeriesMath;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Historical risk statistics over a daily close series.
 * Statistics whose window exceeds the history fall back to 0 so they add nothing to the risk score.
 */
@Service
@RequiredArgsConstructor
public class PriceStatisticsService {

    private static final double VAR_QUANTILE = 0.05;

    private final AgentProperties agentProperties;

    public PriceStatistics compute(List<Candle> candles) {
        double[] closes = requireValidCloses(candles);
        AgentProperties.Risk config = agentProperties.getRisk();
        double annualization = Math.sqrt(config.getTradingDaysPerYear());

        double[] returns = SeriesMath.returns(closes);
        double volatility = orZero(SeriesMath.sampleStdDev(returns) * annualization);
        double percentile = volatilityPercentile(returns, volatility, config.getVolatilityWindow(), annualization);
        double var95 = orZero(SeriesMath.quantile(returns, VAR_QUANTILE));
        double maxDrawdown = maxDrawdown(closes, config.getDrawdownWindow());
        return new PriceStatistics(volatility, percentile, var95, maxDrawdown, closes[closes.length - 1]);
    }

    /**
     * Z-score of the full-history volatility against the distribution of rolling annualized volatilities.
     */
    double volatilityPercentile(double[] returns, double volatility, int window, double annualization) {
        double[] rolling = SeriesMath.rollingStdDev(returns, window);
        if (rolling.length < 2) {
            return 0.0;
        }
        for (int i = 0; i < rolling.length; i++) {
            rolling[i] *= annualization;
        }
        double std = SeriesMath.sampleStdDev(rolling);
        if (!(std > 0)) {
            return 0.0;
        }
        return orZero((volatility - SeriesMath.mean(rolling)) / std);
    }

    /**
     * Worst close relative to its trailing {@code window}-day high, counting only full windows.
     */
    double maxDrawdown(double[] closes, int window) {
        if (closes.length < window) {
            return 0.0;
        }
        double worst = 0.0;
        for (int end = window; end <= closes.length; end++) {
            double peak = Double.NEGATIVE_INFINITY;
            for (int i = end - window; i < end; i++) {
                peak = Math.max(peak, closes[i]);
            }
            worst = Math.min(worst, closes[end - 1] / peak - 1.0);
        }
        return worst;
    }

    /**
     * Closing prices of the series, rejected unless there are at least two and every one is finite and positive.
     */
    public static double[] requireValidCloses(List<Candle> candles) {
        if (candles == null || candles.size() < 2) {
            throw new MissingPreconditionException("At least two closing prices are required for risk assessment");
        }
        double[] closes = SeriesMath.closes(candles);
        for (int i = 0; i < closes.length; i++) {
            if (!Double.isFinite(closes[i]) || closes[i] <= 0) {
                throw new MissingPreconditionException("Invalid closing price at index " + i + ": " + closes[i]);
            }
        }
        return closes;
    }

    private static double orZero(double value) {
        return Double.isFinite(value) ? value : 0.0;
    }

    public record PriceStatistics(double volatility, double volatilityPercentile, double var95,
                                  double maxDrawdown, double lastClose) {}
}
