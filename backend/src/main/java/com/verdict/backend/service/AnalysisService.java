package com.verdict.backend.service;

import com.verdict.backend.dto.AnalysisRawRequest;
import com.verdict.backend.dto.AnalysisRunRequest;
import com.verdict.backend.dto.SignalRequest;
import com.verdict.backend.model.Candle;
import com.verdict.backend.model.Signal;
import com.verdict.backend.model.SignalSet;
import com.verdict.backend.model.SignalSource;
import com.verdict.backend.service.signal.SignalProducerRegistry;
import com.verdict.backend.service.signal.SignalProducerRegistry.MarketInputs;
import com.verdict.backend.trading.pipeline.PipelineResult;
import com.verdict.backend.trading.pipeline.TradeDecisionPipelineService;
import com.verdict.backend.trading.pipeline.TradeDecisionPipelineService.DateRange;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

@Slf4j
@Service
@RequiredArgsConstructor
public class AnalysisService {

    private final TradeDecisionPipelineService pipelineService;
    private final SignalProducerRegistry signalProducerRegistry;

    public PipelineResult run(AnalysisRunRequest request) {
        Map<SignalSource, Signal> signals = new EnumMap<>(SignalSource.class);
        if (request.getSignals() != null) {
            for (Map.Entry<SignalSource, SignalRequest> entry : request.getSignals().entrySet()) {
                if (entry.getKey() != null && entry.getValue() != null) {
                    signals.put(entry.getKey(), entry.getValue().toSignal());
                }
            }
        }
        return pipelineService.run(request.getTicker(), request.getStartDate(), request.getEndDate(),
                request.getPortfolio().toPortfolio(), SignalSet.fromMap(signals), request.getCandles());
    }

    public PipelineResult analyze(AnalysisRawRequest request) {
        DateRange range = pipelineService.resolveRange(request.getStartDate(), request.getEndDate());
        List<Candle> candles = request.getCandles() == null ? List.of() : request.getCandles().stream()
                .filter(candle -> candle.getDate() == null
                        || (!candle.getDate().isBefore(range.start()) && !candle.getDate().isAfter(range.end())))
                .toList();
        log.info("Producing signals for {} as of {}", request.getTicker(), range.end());
        SignalSet signals = signalProducerRegistry.produceAll(new MarketInputs(
                candles,
                request.getMetrics(),
                request.getCurrentLineItem(),
                request.getPreviousLineItem(),
                request.getMarket(),
                request.getNews(),
                range.end()));
        return pipelineService.run(request.getTicker(), range.start(), range.end(),
                request.getPortfolio().toPortfolio(), signals, candles);
    }
}
