package com.verdict.backend.service.indicator;

import com.verdict.backend.config.AgentProperties;
import com.verdict.backend.model.Candle;
import com.verdict.backend.util.TestCandleFactory;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class IndicatorServicesTest {

    private final AgentProperties properties = new AgentProperties();

    @Test
    void rsiIsNeutralWithoutEnoughHistory() {
        RsiService service = new RsiService(properties);

        RsiService.RsiResult result = service.calculate(TestCandleFactory.trendingCandles(10, 100, 1.0));

        assertThat(result.rsi()).isEqualTo(50.0);
        assertThat(result.available()).isFalse();
        assertThat(result.overbought()).isFalse();
    }

    @Test
    void rsiSaturatesOnOneWayMoves() {
        RsiService service = new RsiService(properties);

        assertThat(service.calculate(TestCandleFactory.trendingCandles(40, 100, 1.0)).overbought()).isTrue();
        assertThat(service.calculate(TestCandleFactory.trendingCandles(40, 200, -1.0)).oversold()).isTrue();
    }

    @Test
    void adxHigherInTrendThanRange() {
        AdxService service = new AdxService(properties);
        List<Candle> trending = TestCandleFactory.trendingCandles(80, 100, 1.0);
        List<Candle> range = TestCandleFactory.oscillatingCandles(80, 100, 2.0);

        assertThat(service.calculate(trending).adx()).isGreaterThan(service.calculate(range).adx());
        assertThat(service.calculate(trending).adx()).isGreaterThan(25.0);
    }

    @Test
    void macdHistogramPositiveInUptrend() {
        MacdService service = new MacdService(properties);

        MacdService.MacdResult result = service.calculate(TestCandleFactory.trendingCandles(80, 100, 1.0));

        assertThat(result.available()).isTrue();
        assertThat(result.macdLine()).isPositive();
    }

    @Test
    void bollingerPositionNearUpperBandAtEndOfUptrend() {
        BollingerBandService service = new BollingerBandService(properties);

        BollingerBandService.BollingerBands bands = service.calculate(TestCandleFactory.trendingCandles(40, 100, 1.0));

        assertThat(bands.upper()).isGreaterThan(bands.lower());
        assertThat(bands.position()).isGreaterThan(0.8);
    }

    @Test
    void atrRatioIsOneForConstantRange() {
        AtrService service = new AtrService(properties);

        AtrService.AtrResult result = service.calculate(TestCandleFactory.trendingCandles(60, 100, 1.0));

        assertThat(result.atr()).isGreaterThan(0.0);
        assertThat(result.ratio()).isBetween(0.99, 1.01);
    }
}
