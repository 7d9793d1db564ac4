package com.verdict.backend.service.signal;

import com.verdict.backend.config.AgentProperties;
import com.verdict.backend.exception.MissingPreconditionException;
import com.verdict.backend.model.Candle;
import com.verdict.backend.model.Signal;
import com.verdict.backend.model.SignalDirection;
import com.verdict.backend.service.indicator.AdxService;
import com.verdict.backend.service.indicator.AtrService;
import com.verdict.backend.service.indicator.BollingerBandService;
import com.verdict.backend.service.indicator.MacdService;
import com.verdict.backend.service.indicator.RsiService;
import com.verdict.backend.util.SeriesMath;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Weighted vote of trend, mean reversion, momentum, volatility regime and oscillator readings.
 * Each vote is in [-1, 1] and is neutral when its lookback is longer than the available history.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class TechnicalSignalProducer {

    private static final int VOLUME_WINDOW = 21;
    private static final int VOLATILITY_WINDOW = 21;
    private static final int[] MOMENTUM_HORIZONS = {21, 63, 126};
    private static final double[] MOMENTUM_WEIGHTS = {0.4, 0.3, 0.3};

    private final AgentProperties agentProperties;
    private final RsiService rsiService;
    private final MacdService macdService;
    private final AdxService adxService;
    private final AtrService atrService;
    private final BollingerBandService bollingerBandService;

    public Signal produce(List<Candle> candles) {
        if (candles == null || candles.size() < 2) {
            throw new MissingPreconditionException("At least two candles are required for technical analysis");
        }
        AgentProperties.Technical config = agentProperties.getTechnical();
        double[] closes = SeriesMath.closes(candles);
        Map<String, String> rationale = new LinkedHashMap<>();

        double trend = trendVote(candles, config, rationale);
        double meanReversion = meanReversionVote(candles, closes, config, rationale);
        double momentum = momentumVote(candles, closes, rationale);
        double volatility = volatilityVote(candles, closes, rationale);
        double oscillators = oscillatorVote(candles, rationale);

        double totalWeight = config.getTrendWeight() + config.getMeanReversionWeight() + config.getMomentumWeight()
                + config.getVolatilityWeight() + config.getOscillatorWeight();
        double score = (trend * config.getTrendWeight()
                + meanReversion * config.getMeanReversionWeight()
                + momentum * config.getMomentumWeight()
                + volatility * config.getVolatilityWeight()
                + oscillators * config.getOscillatorWeight()) / totalWeight;

        SignalDirection direction = score > config.getDirectionThreshold()
                ? SignalDirection.BULLISH
                : score < -config.getDirectionThreshold() ? SignalDirection.BEARISH : SignalDirection.NEUTRAL;
        log.debug("Technical score {} -> {}", score, direction);
        return new Signal(direction, SeriesMath.clamp(Math.abs(score), 0.0, 1.0), rationale);
    }

    private double trendVote(List<Candle> candles, AgentProperties.Technical config, Map<String, String> rationale) {
        List<Double> closeList = candles.stream().map(Candle::getClose).toList();
        Double shortEma = last(SeriesMath.emaSeries(closeList, config.getEmaShortPeriod()));
        Double longEma = last(SeriesMath.emaSeries(closeList, config.getEmaLongPeriod()));
        if (shortEma == null || longEma == null || shortEma.equals(longEma)) {
            rationale.put("trend_following", "neutral: insufficient or flat trend");
            return 0.0;
        }
        double adx = adxService.calculate(candles).adx();
        double strength = adx > config.getStrongTrendAdx() ? 1.0 : 0.5;
        double vote = shortEma > longEma ? strength : -strength;
        rationale.put("trend_following", String.format(Locale.ROOT, "%s: EMA%d %.2f vs EMA%d %.2f, ADX %.1f",
                label(vote), config.getEmaShortPeriod(), shortEma, config.getEmaLongPeriod(), longEma, adx));
        return vote;
    }

    private double meanReversionVote(List<Candle> candles, double[] closes, AgentProperties.Technical config,
                                     Map<String, String> rationale) {
        int window = config.getMeanReversionWindow();
        if (closes.length < window) {
            rationale.put("mean_reversion", "neutral: insufficient history");
            return 0.0;
        }
        double mean = SeriesMath.mean(closes, closes.length - window, closes.length);
        double std = SeriesMath.sampleStdDev(closes, closes.length - window, closes.length);
        double zScore = std == 0 || Double.isNaN(std) ? 0.0 : (closes[closes.length - 1] - mean) / std;
        double bandPosition = bollingerBandService.calculate(candles).position();
        double vote = 0.0;
        if (zScore < -2 && bandPosition < 0.2) {
            vote = 1.0;
        } else if (zScore > 2 && bandPosition > 0.8) {
            vote = -1.0;
        }
        rationale.put("mean_reversion", String.format(Locale.ROOT, "%s: z-score %.2f, band position %.2f",
                label(vote), zScore, bandPosition));
        return vote;
    }

    private double momentumVote(List<Candle> candles, double[] closes, Map<String, String> rationale) {
        if (closes.length <= VOLUME_WINDOW) {
            rationale.put("momentum", "neutral: insufficient history");
            return 0.0;
        }
        double momentum = 0.0;
        for (int i = 0; i < MOMENTUM_HORIZONS.length; i++) {
            int horizon = MOMENTUM_HORIZONS[i];
            if (closes.length > horizon) {
                momentum += MOMENTUM_WEIGHTS[i] * (closes[closes.length - 1] / closes[closes.length - 1 - horizon] - 1);
            }
        }
        double averageVolume = candles.subList(candles.size() - VOLUME_WINDOW, candles.size()).stream()
                .mapToLong(Candle::getVolume)
                .average()
                .orElse(0.0);
        boolean volumeConfirms = candles.get(candles.size() - 1).getVolume() >= averageVolume;
        double vote = 0.0;
        if (volumeConfirms && momentum > 0.05) {
            vote = 1.0;
        } else if (volumeConfirms && momentum < -0.05) {
            vote = -1.0;
        }
        rationale.put("momentum", String.format(Locale.ROOT, "%s: blended momentum %.2f%%, volume %s",
                label(vote), momentum * 100, volumeConfirms ? "confirms" : "does not confirm"));
        return vote;
    }

    private double volatilityVote(List<Candle> candles, double[] closes, Map<String, String> rationale) {
        double[] rolling = SeriesMath.rollingStdDev(SeriesMath.returns(closes), VOLATILITY_WINDOW);
        if (rolling.length < 2) {
            rationale.put("volatility", "neutral: insufficient history");
            return 0.0;
        }
        double current = rolling[rolling.length - 1];
        double std = SeriesMath.sampleStdDev(rolling);
        double volZ = std == 0 || Double.isNaN(std) ? 0.0 : (current - SeriesMath.mean(rolling)) / std;
        double atrRatio = atrService.calculate(candles).ratio();
        double vote = 0.0;
        if (volZ < -1 && atrRatio < 1) {
            vote = 1.0;
        } else if (volZ > 1 && atrRatio > 1) {
            vote = -1.0;
        }
        rationale.put("volatility", String.format(Locale.ROOT, "%s: volatility z-score %.2f, ATR ratio %.2f",
                label(vote), volZ, atrRatio));
        return vote;
    }

    private double oscillatorVote(List<Candle> candles, Map<String, String> rationale) {
        RsiService.RsiResult rsi = rsiService.calculate(candles);
        MacdService.MacdResult macd = macdService.calculate(candles);
        double vote;
        if (rsi.oversold()) {
            vote = 1.0;
        } else if (rsi.overbought()) {
            vote = -1.0;
        } else if (macd.available() && macd.histogram() != 0) {
            vote = Math.signum(macd.histogram()) * 0.5;
        } else {
            vote = 0.0;
        }
        rationale.put("oscillators", String.format(Locale.ROOT, "%s: RSI %.1f, MACD histogram %.4f",
                label(vote), rsi.rsi(), macd.histogram()));
        return vote;
    }

    private static Double last(List<Double> series) {
        return series.isEmpty() ? null : series.get(series.size() - 1);
    }

    private static String label(double vote) {
        if (vote > 0) {
            return SignalDirection.BULLISH.label();
        }
        return vote < 0 ? SignalDirection.BEARISH.label() : SignalDirection.NEUTRAL.label();
    }
}
