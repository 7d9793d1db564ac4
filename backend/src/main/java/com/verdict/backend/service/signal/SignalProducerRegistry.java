package com.verdict.backend.service.signal;

import com.verdict.backend.model.Candle;
import com.verdict.backend.model.FinancialLineItem;
import com.verdict.backend.model.FinancialMetrics;
import com.verdict.backend.model.MarketSnapshot;
import com.verdict.backend.model.NewsItem;
import com.verdict.backend.model.Signal;
import com.verdict.backend.model.SignalSet;
import com.verdict.backend.model.SignalSource;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * Maps each {@link SignalSource} to the producer function that computes it from raw market inputs.
 */
@Slf4j
@Service
public class SignalProducerRegistry {

    private final Map<SignalSource, Function<MarketInputs, Signal>> producers;

    public SignalProducerRegistry(TechnicalSignalProducer technical,
                                  FundamentalSignalProducer fundamental,
                                  SentimentSignalProducer sentiment,
                                  ValuationSignalProducer valuation) {
        Map<SignalSource, Function<MarketInputs, Signal>> map = new EnumMap<>(SignalSource.class);
        map.put(SignalSource.TECHNICAL, inputs -> technical.produce(inputs.candles()));
        map.put(SignalSource.FUNDAMENTALS, inputs -> fundamental.produce(inputs.metrics()));
        map.put(SignalSource.SENTIMENT, inputs -> sentiment.produce(inputs.news(), inputs.asOfDate()));
        map.put(SignalSource.VALUATION, inputs -> valuation.produce(
                inputs.metrics(), inputs.currentLineItem(), inputs.previousLineItem(), inputs.market()));
        this.producers = Collections.unmodifiableMap(map);
    }

    public SignalSet produceAll(MarketInputs inputs) {
        Map<SignalSource, Signal> signals = new EnumMap<>(SignalSource.class);
        for (SignalSource source : SignalSource.values()) {
            Signal signal = producers.get(source).apply(inputs);
            log.info("{} signal: {} ({})", source.displayName(), signal.direction().label(), signal.confidence());
            signals.put(source, signal);
        }
        return SignalSet.fromMap(signals);
    }

    /**
     * Raw upstream data for one ticker as of one date.
     */
    public record MarketInputs(
            List<Candle> candles,
            FinancialMetrics metrics,
            FinancialLineItem currentLineItem,
            FinancialLineItem previousLineItem,
            MarketSnapshot market,
            List<NewsItem> news,
            LocalDate asOfDate
    ) {}
}
