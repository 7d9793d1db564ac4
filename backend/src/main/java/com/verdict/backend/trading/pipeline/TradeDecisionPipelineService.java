package com.verdict.backend.trading.pipeline;

import com.verdict.backend.exception.MissingPreconditionException;
import com.verdict.backend.model.Candle;
import com.verdict.backend.model.Portfolio;
import com.verdict.backend.model.SignalSet;
import com.verdict.backend.service.risk.PriceStatisticsService;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDate;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.function.UnaryOperator;

/**
 * Runs thesis, debate, risk and decision strictly in sequence over an immutable {@link RunContext}.
 * A missing input aborts the run before any stage executes; no partial decision is ever returned.
 */
@Slf4j
@Service
public class TradeDecisionPipelineService {

    private final Map<PipelineStage, UnaryOperator<RunContext>> stages;
    private final MeterRegistry meterRegistry;
    private final Clock clock;

    @Autowired
    public TradeDecisionPipelineService(ThesisBuilder thesisBuilder,
                                        DebateEngine debateEngine,
                                        RiskEngine riskEngine,
                                        DecisionEngine decisionEngine,
                                        MeterRegistry meterRegistry) {
        this(thesisBuilder, debateEngine, riskEngine, decisionEngine, meterRegistry, Clock.systemDefaultZone());
    }

    TradeDecisionPipelineService(ThesisBuilder thesisBuilder,
                                 DebateEngine debateEngine,
                                 RiskEngine riskEngine,
                                 DecisionEngine decisionEngine,
                                 MeterRegistry meterRegistry,
                                 Clock clock) {
        Map<PipelineStage, UnaryOperator<RunContext>> map = new EnumMap<>(PipelineStage.class);
        map.put(PipelineStage.BULL_THESIS, ctx -> ctx.withBullThesis(thesisBuilder.bull(ctx.signals())));
        map.put(PipelineStage.BEAR_THESIS, ctx -> ctx.withBearThesis(thesisBuilder.bear(ctx.signals())));
        map.put(PipelineStage.DEBATE, ctx -> ctx.withDebate(
                debateEngine.debate(ctx.ticker(), ctx.bullThesis(), ctx.bearThesis())));
        map.put(PipelineStage.RISK, ctx -> ctx.withRisk(
                riskEngine.evaluate(ctx.candles(), ctx.debate(), ctx.portfolio())));
        map.put(PipelineStage.DECISION, ctx -> ctx.withDecision(
                decisionEngine.decide(ctx.ticker(), ctx.signals(), ctx.risk(), ctx.portfolio(), ctx.lastPrice())));
        this.stages = Collections.unmodifiableMap(map);
        this.meterRegistry = meterRegistry;
        this.clock = clock;
    }

    public PipelineResult run(String ticker, LocalDate startDate, LocalDate endDate, Portfolio portfolio,
                              SignalSet signals, List<Candle> candles) {
        Timer.Sample sample = Timer.start(meterRegistry);
        String outcome = "error";
        try {
            DateRange range = resolveRange(startDate, endDate);
            RunContext context = RunContext.start(ticker, range.start(), range.end(),
                    portfolio, signals, candlesInRange(candles, range));
            validate(context);
            log.info("Running pipeline for {} from {} to {} with {} candles", ticker, range.start(), range.end(),
                    context.candles().size());
            for (PipelineStage stage : PipelineStage.values()) {
                context = stages.get(stage).apply(context);
                log.debug("Stage {} complete for {}", stage, ticker);
            }
            outcome = "success";
            return PipelineResult.from(context);
        } catch (MissingPreconditionException e) {
            outcome = "precondition_failed";
            log.warn("Pipeline aborted for {}: {}", ticker, e.getMessage());
            throw e;
        } finally {
            sample.stop(Timer.builder("pipeline_run_latency")
                    .tag("outcome", outcome)
                    .register(meterRegistry));
        }
    }

    /**
     * End defaults to yesterday and may not be later than yesterday; start defaults to one year before the end.
     */
    public DateRange resolveRange(LocalDate startDate, LocalDate endDate) {
        LocalDate yesterday = LocalDate.now(clock).minusDays(1);
        LocalDate end = endDate == null || endDate.isAfter(yesterday) ? yesterday : endDate;
        LocalDate start = startDate == null ? end.minusYears(1) : startDate;
        if (start.isAfter(end)) {
            throw new MissingPreconditionException("Start date " + start + " is after end date " + end);
        }
        return new DateRange(start, end);
    }

    private List<Candle> candlesInRange(List<Candle> candles, DateRange range) {
        if (candles == null) {
            return List.of();
        }
        return candles.stream()
                .filter(candle -> candle.getDate() == null
                        || (!candle.getDate().isBefore(range.start()) && !candle.getDate().isAfter(range.end())))
                .toList();
    }

    private void validate(RunContext context) {
        if (context.ticker() == null || context.ticker().isBlank()) {
            throw new MissingPreconditionException("Ticker is required");
        }
        if (context.portfolio() == null) {
            throw new MissingPreconditionException("Portfolio is required");
        }
        if (context.signals() == null) {
            throw new MissingPreconditionException("Signals are required");
        }
        context.signals().requireComplete();
        if (context.candles().isEmpty()) {
            throw new MissingPreconditionException("No price history for " + context.ticker() + " in the requested range");
        }
        PriceStatisticsService.requireValidCloses(context.candles());
    }

    public record DateRange(LocalDate start, LocalDate end) {}
}
