package com.verdict.backend.trading.pipeline;

import com.verdict.backend.config.AgentProperties;
import com.verdict.backend.model.Signal;
import com.verdict.backend.model.SignalDirection;
import com.verdict.backend.model.SignalSet;
import com.verdict.backend.model.SignalSource;
import com.verdict.backend.model.Thesis;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Builds the one-sided bull or bear argument from all four signals.
 * A signal that disagrees with the stance contributes a hedging point at the fixed fallback confidence.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ThesisBuilder {

    private static final List<SignalSource> ORDER = List.of(
            SignalSource.TECHNICAL, SignalSource.FUNDAMENTALS, SignalSource.SENTIMENT, SignalSource.VALUATION);

    private final AgentProperties agentProperties;

    public Thesis bull(SignalSet signals) {
        return build(SignalDirection.BULLISH, signals);
    }

    public Thesis bear(SignalSet signals) {
        return build(SignalDirection.BEARISH, signals);
    }

    public Thesis build(SignalDirection stance, SignalSet signals) {
        if (stance == SignalDirection.NEUTRAL) {
            throw new IllegalArgumentException("A thesis must take a side");
        }
        signals.requireComplete();
        double fallback = agentProperties.getThesis().getFallbackConfidence();
        List<String> points = new ArrayList<>();
        double total = 0.0;
        for (SignalSource source : ORDER) {
            Signal signal = signals.get(source);
            if (signal.direction() == stance) {
                points.add(supportingPoint(stance, source, signal.confidence()));
                total += signal.confidence();
            } else {
                points.add(hedgingPoint(stance, source));
                total += fallback;
            }
        }
        double confidence = total / ORDER.size();
        String side = stance == SignalDirection.BULLISH ? "Bullish" : "Bearish";
        log.debug("{} thesis confidence {}", side, confidence);
        return new Thesis(stance, confidence, points,
                side + " thesis based on comprehensive analysis of technical, fundamental, sentiment, and valuation factors");
    }

    private static String supportingPoint(SignalDirection stance, SignalSource source, double confidence) {
        boolean bull = stance == SignalDirection.BULLISH;
        String text = switch (source) {
            case TECHNICAL -> bull ? "Technical indicators show bullish momentum" : "Technical indicators show bearish momentum";
            case FUNDAMENTALS -> bull ? "Strong fundamentals" : "Concerning fundamentals";
            case SENTIMENT -> bull ? "Positive market sentiment" : "Negative market sentiment";
            case VALUATION -> bull ? "Stock appears undervalued" : "Stock appears overvalued";
        };
        return String.format(Locale.ROOT, "%s with %.2f confidence", text, confidence);
    }

    private static String hedgingPoint(SignalDirection stance, SignalSource source) {
        boolean bull = stance == SignalDirection.BULLISH;
        return switch (source) {
            case TECHNICAL -> bull
                    ? "Technical indicators may be conservative, presenting buying opportunities"
                    : "Technical rally may be temporary, suggesting potential reversal";
            case FUNDAMENTALS -> bull
                    ? "Company fundamentals show potential for improvement"
                    : "Current fundamental strength may not be sustainable";
            case SENTIMENT -> bull
                    ? "Market sentiment may be overly pessimistic, creating value opportunities"
                    : "Market sentiment may be overly optimistic, indicating potential risks";
            case VALUATION -> bull
                    ? "Current valuation may not fully reflect growth potential"
                    : "Current valuation may not fully reflect downside risks";
        };
    }
}
