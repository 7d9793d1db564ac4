package com.verdict.backend.service.signal;

import com.verdict.backend.config.AgentProperties;
import com.verdict.backend.exception.MissingPreconditionException;
import com.verdict.backend.model.FinancialLineItem;
import com.verdict.backend.model.FinancialMetrics;
import com.verdict.backend.model.MarketSnapshot;
import com.verdict.backend.model.Signal;
import com.verdict.backend.model.SignalDirection;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ValuationSignalProducerTest {

    private final AgentProperties properties = new AgentProperties();
    private final ValuationSignalProducer producer =
            new ValuationSignalProducer(new IntrinsicValueCalculator(properties), properties);

    private final FinancialMetrics metrics = FinancialMetrics.builder().earningsGrowth(0.0).build();
    private final FinancialLineItem current = FinancialLineItem.builder()
            .netIncome(100.0)
            .depreciationAndAmortization(20.0)
            .capitalExpenditure(30.0)
            .workingCapital(60.0)
            .freeCashFlow(100.0)
            .build();
    private final FinancialLineItem previous = FinancialLineItem.builder().workingCapital(50.0).build();

    @Test
    void cheapMarketCapIsBullish() {
        Signal signal = producer.produce(metrics, current, previous, new MarketSnapshot(200.0, "Tech"));

        assertThat(signal.direction()).isEqualTo(SignalDirection.BULLISH);
        assertThat(signal.confidence()).isEqualTo(1.0);
        assertThat(signal.rationale()).containsKeys("dcf_analysis", "owner_earnings_analysis");
    }

    @Test
    void expensiveMarketCapIsBearish() {
        Signal signal = producer.produce(metrics, current, previous, new MarketSnapshot(10_000.0, "Tech"));

        assertThat(signal.direction()).isEqualTo(SignalDirection.BEARISH);
        assertThat(signal.confidence()).isBetween(0.0, 1.0);
    }

    @Test
    void zeroMarketCapIsAPreconditionFailure() {
        assertThatThrownBy(() -> producer.produce(metrics, current, previous, new MarketSnapshot(0.0, "Tech")))
                .isInstanceOf(MissingPreconditionException.class);
        assertThatThrownBy(() -> producer.produce(metrics, current, previous, null))
                .isInstanceOf(MissingPreconditionException.class);
    }
}
