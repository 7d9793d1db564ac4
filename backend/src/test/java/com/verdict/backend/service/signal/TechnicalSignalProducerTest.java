package com.verdict.backend.service.signal;

import com.verdict.backend.config.AgentProperties;
import com.verdict.backend.exception.MissingPreconditionException;
import com.verdict.backend.model.Signal;
import com.verdict.backend.model.SignalDirection;
import com.verdict.backend.service.indicator.AdxService;
import com.verdict.backend.service.indicator.AtrService;
import com.verdict.backend.service.indicator.BollingerBandService;
import com.verdict.backend.service.indicator.MacdService;
import com.verdict.backend.service.indicator.RsiService;
import com.verdict.backend.util.TestCandleFactory;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TechnicalSignalProducerTest {

    private final AgentProperties properties = new AgentProperties();
    private final TechnicalSignalProducer producer = new TechnicalSignalProducer(
            properties,
            new RsiService(properties),
            new MacdService(properties),
            new AdxService(properties),
            new AtrService(properties),
            new BollingerBandService(properties));

    @Test
    void steadyUptrendIsBullish() {
        Signal signal = producer.produce(TestCandleFactory.trendingCandles(200, 100, 1.0));

        assertThat(signal.direction()).isEqualTo(SignalDirection.BULLISH);
        assertThat(signal.confidence()).isBetween(0.2, 1.0);
        assertThat(signal.rationale())
                .containsKeys("trend_following", "mean_reversion", "momentum", "volatility", "oscillators");
    }

    @Test
    void steadyDowntrendIsBearish() {
        Signal signal = producer.produce(TestCandleFactory.trendingCandles(200, 300, -1.0));

        assertThat(signal.direction()).isEqualTo(SignalDirection.BEARISH);
    }

    @Test
    void shortHistoryDegradesToNeutral() {
        Signal signal = producer.produce(TestCandleFactory.trendingCandles(10, 100, 1.0));

        assertThat(signal.direction()).isEqualTo(SignalDirection.NEUTRAL);
        assertThat(signal.confidence()).isZero();
    }

    @Test
    void singleCandleIsAPreconditionFailure() {
        assertThatThrownBy(() -> producer.produce(TestCandleFactory.flatCandles(1, 100)))
                .isInstanceOf(MissingPreconditionException.class);
    }
}
