package com.verdict.backend.service.signal;

import com.verdict.backend.config.AgentProperties;
import com.verdict.backend.model.NewsItem;
import com.verdict.backend.model.Signal;
import com.verdict.backend.model.SignalDirection;
import com.verdict.backend.util.SeriesMath;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Averages pre-scored news sentiment over the lookback window ending at the as-of date.
 */
@Service
@RequiredArgsConstructor
public class SentimentSignalProducer {

    private final AgentProperties agentProperties;

    public Signal produce(List<NewsItem> news, LocalDate asOfDate) {
        AgentProperties.Sentiment config = agentProperties.getSentiment();
        LocalDate from = asOfDate.minusDays(config.getLookbackDays());
        List<NewsItem> recent = news == null ? List.of() : news.stream()
                .filter(item -> item.publishedAt() != null && Double.isFinite(item.sentiment()))
                .filter(item -> {
                    LocalDate day = item.publishedAt().toLocalDate();
                    return day.isAfter(from) && !day.isAfter(asOfDate);
                })
                .toList();

        double score = recent.isEmpty()
                ? 0.0
                : SeriesMath.clamp(recent.stream().mapToDouble(NewsItem::sentiment).average().orElse(0.0), -1.0, 1.0);

        SignalDirection direction;
        double confidence;
        if (score >= config.getBullishThreshold()) {
            direction = SignalDirection.BULLISH;
            confidence = Math.abs(score);
        } else if (score <= config.getBearishThreshold()) {
            direction = SignalDirection.BEARISH;
            confidence = Math.abs(score);
        } else {
            direction = SignalDirection.NEUTRAL;
            confidence = 1 - Math.abs(score);
        }

        Map<String, String> rationale = new LinkedHashMap<>();
        rationale.put("news_sentiment", String.format(Locale.ROOT,
                "Based on %d recent news articles, sentiment score: %.2f", recent.size(), score));
        return new Signal(direction, confidence, rationale);
    }
}
