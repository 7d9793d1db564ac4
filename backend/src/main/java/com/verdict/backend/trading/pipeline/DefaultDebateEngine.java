package com.verdict.backend.trading.pipeline;

import com.fasterxml.jackson.databind.JsonNode;
import com.verdict.backend.config.AgentProperties;
import com.verdict.backend.model.CompletionOutcome;
import com.verdict.backend.model.DebateResult;
import com.verdict.backend.model.SignalDirection;
import com.verdict.backend.model.Thesis;
import com.verdict.backend.service.completion.ChatMessage;
import com.verdict.backend.service.completion.CompletionClient;
import com.verdict.backend.service.completion.CompletionReply;
import com.verdict.backend.service.completion.CompletionResponseParser;
import com.verdict.backend.util.SeriesMath;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

@Slf4j
@Service
@RequiredArgsConstructor
public class DefaultDebateEngine implements DebateEngine {

    private static final String SYSTEM_PROMPT = """
            You are a professional financial analyst. Please provide your analysis in English only, not in Chinese \
            or any other language. Weigh the bullish and bearish arguments objectively and grade which side is \
            more convincing.""";

    private final CompletionClient completionClient;
    private final CompletionResponseParser completionResponseParser;
    private final AgentProperties agentProperties;

    @Override
    public DebateResult debate(String ticker, Thesis bullThesis, Thesis bearThesis) {
        double bullConfidence = bullThesis.confidence();
        double bearConfidence = bearThesis.confidence();
        List<String> summary = summarize(bullThesis, bearThesis);

        Opinion opinion = askOpinion(ticker, bullThesis, bearThesis);

        AgentProperties.Debate config = agentProperties.getDebate();
        double confidenceDiff = bullConfidence - bearConfidence;
        double mixed = (1 - config.getLlmWeight()) * confidenceDiff + config.getLlmWeight() * opinion.score();

        SignalDirection signal;
        double confidence;
        String reasoning;
        if (Math.abs(mixed) < config.getNeutralThreshold()) {
            signal = SignalDirection.NEUTRAL;
            confidence = Math.max(bullConfidence, bearConfidence);
            reasoning = "Balanced debate with strong arguments on both sides";
        } else if (mixed > 0) {
            signal = SignalDirection.BULLISH;
            confidence = bullConfidence;
            reasoning = "Bullish arguments more convincing";
        } else {
            signal = SignalDirection.BEARISH;
            confidence = bearConfidence;
            reasoning = "Bearish arguments more convincing";
        }
        log.info("Debate for {}: signal={} confidence={} diff={} llmScore={} mixedDiff={}",
                ticker, signal.label(), confidence, confidenceDiff, opinion.score(), mixed);
        return new DebateResult(signal, confidence, bullConfidence, bearConfidence, confidenceDiff,
                opinion.score(), mixed, reasoning, summary, opinion.analysis(), opinion.reasoning(), opinion.outcome());
    }

    private Opinion askOpinion(String ticker, Thesis bullThesis, Thesis bearThesis) {
        List<ChatMessage> messages = List.of(
                ChatMessage.system(SYSTEM_PROMPT),
                ChatMessage.user(buildPrompt(ticker, bullThesis, bearThesis)));
        CompletionReply reply = completionResponseParser.request(completionClient, "debate", messages);
        if (!reply.isOk()) {
            log.warn("Debate opinion for {} unavailable, using neutral score: {}", ticker, reply.describeFailure());
            return Opinion.neutral(reply.outcome(), reply.describeFailure());
        }
        JsonNode payload = reply.payload();
        JsonNode score = payload.get("score");
        if (score == null || !score.isNumber() || !Double.isFinite(score.asDouble())) {
            log.warn("Debate opinion for {} has no numeric score, using neutral score", ticker);
            return Opinion.neutral(CompletionOutcome.PARSE_FAILED, "PARSE_FAILED: missing numeric score");
        }
        return new Opinion(
                SeriesMath.clamp(score.asDouble(), -1.0, 1.0),
                payload.path("analysis").asText(""),
                payload.path("reasoning").asText(""),
                CompletionOutcome.OK);
    }

    private String buildPrompt(String ticker, Thesis bullThesis, Thesis bearThesis) {
        StringBuilder prompt = new StringBuilder();
        prompt.append("As a professional financial analyst, please analyze the following investment research perspectives for ")
                .append(ticker)
                .append(" and provide your third-party analysis:\n\n");
        prompt.append(String.format(Locale.ROOT, "BULLISH VIEW (Confidence: %.2f):%n", bullThesis.confidence()));
        bullThesis.points().forEach(point -> prompt.append("+ ").append(point).append('\n'));
        prompt.append(String.format(Locale.ROOT, "%nBEARISH VIEW (Confidence: %.2f):%n", bearThesis.confidence()));
        bearThesis.points().forEach(point -> prompt.append("- ").append(point).append('\n'));
        prompt.append("""

                Please provide your analysis in the following JSON format:
                {
                    "analysis": "Your detailed analysis evaluating the strengths and weaknesses of each perspective",
                    "score": 0.5,
                    "reasoning": "Your reasoning for the given score"
                }

                The score must be a number between -1.0 (extremely bearish) and 1.0 (extremely bullish), \
                where 0 represents neutral.""");
        return prompt.toString();
    }

    private static List<String> summarize(Thesis bullThesis, Thesis bearThesis) {
        List<String> summary = new ArrayList<>();
        summary.add("Bullish Arguments:");
        bullThesis.points().forEach(point -> summary.add("+ " + point));
        summary.add("Bearish Arguments:");
        bearThesis.points().forEach(point -> summary.add("- " + point));
        return summary;
    }

    private record Opinion(double score, String analysis, String reasoning, CompletionOutcome outcome) {

        static Opinion neutral(CompletionOutcome outcome, String cause) {
            return new Opinion(0.0, null, cause, outcome);
        }
    }
}
