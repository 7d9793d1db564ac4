package com.verdict.backend.trading.pipeline;

import com.fasterxml.jackson.databind.JsonNode;
import com.verdict.backend.config.AgentProperties;
import com.verdict.backend.model.AgentSignal;
import com.verdict.backend.model.Decision;
import com.verdict.backend.model.Decision.DecisionAction;
import com.verdict.backend.model.Portfolio;
import com.verdict.backend.model.RiskAssessment;
import com.verdict.backend.model.Signal;
import com.verdict.backend.model.SignalDirection;
import com.verdict.backend.model.SignalSet;
import com.verdict.backend.model.SignalSource;
import com.verdict.backend.service.completion.ChatMessage;
import com.verdict.backend.service.completion.CompletionClient;
import com.verdict.backend.service.completion.CompletionReply;
import com.verdict.backend.service.completion.CompletionResponseParser;
import com.verdict.backend.trading.pipeline.OrderConstraintEnforcer.ConstrainedOrder;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Asks the completion service for a weighted decision, then enforces the order constraints locally.
 * Any service or parse failure yields the conservative hold decision.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class DefaultDecisionEngine implements DecisionEngine {

    private final CompletionClient completionClient;
    private final CompletionResponseParser completionResponseParser;
    private final OrderConstraintEnforcer orderConstraintEnforcer;
    private final AgentProperties agentProperties;

    @Override
    public Decision decide(String ticker, SignalSet signals, RiskAssessment risk, Portfolio portfolio, double lastPrice) {
        List<AgentSignal> breakdown = breakdown(signals);
        List<ChatMessage> messages = List.of(
                ChatMessage.system(systemPrompt()),
                ChatMessage.user(userPrompt(ticker, signals, risk, portfolio, lastPrice)));

        CompletionReply reply = completionResponseParser.request(completionClient, "decision", messages);
        if (!reply.isOk()) {
            log.warn("Decision for {} falls back to hold: {}", ticker, reply.describeFailure());
            return fallback(breakdown, reply.describeFailure());
        }
        Optional<ProposedOrder> proposed = readProposal(reply.payload());
        if (proposed.isEmpty()) {
            log.warn("Decision for {} falls back to hold: reply lacks action, quantity or confidence", ticker);
            return fallback(breakdown, "PARSE_FAILED: reply lacks action, quantity or confidence");
        }

        ProposedOrder order = proposed.get();
        ConstrainedOrder constrained = orderConstraintEnforcer.enforce(
                order.action(), order.quantity(), order.confidence(), risk, portfolio, lastPrice);
        constrained.notes().forEach(note -> log.info("Decision constraint for {}: {}", ticker, note));
        log.info("Decision for {}: {} qty={} confidence={}", ticker, constrained.action(),
                constrained.quantity(), constrained.confidence());
        return new Decision(constrained.action(), constrained.quantity(), constrained.confidence(), breakdown,
                order.reportedSignals(), order.reasoning(), null, constrained.notes());
    }

    private Decision fallback(List<AgentSignal> breakdown, String cause) {
        return new Decision(DecisionAction.HOLD, 0L, agentProperties.getDecision().getFallbackConfidence(), breakdown,
                List.of(), "Completion service returned nothing usable; holding current position", cause, List.of());
    }

    private Optional<ProposedOrder> readProposal(JsonNode payload) {
        Optional<DecisionAction> action = parseAction(payload.path("action").asText(null));
        JsonNode quantity = payload.get("quantity");
        JsonNode confidence = payload.get("confidence");
        if (action.isEmpty() || quantity == null || !quantity.isNumber()
                || confidence == null || !confidence.isNumber()) {
            return Optional.empty();
        }
        List<AgentSignal> reported = new ArrayList<>();
        for (JsonNode node : payload.path("agent_signals")) {
            Optional<SignalDirection> direction = SignalDirection.fromText(node.path("signal").asText(null));
            if (direction.isPresent()) {
                reported.add(new AgentSignal(node.path("agent_name").asText("unknown"), direction.get(),
                        node.path("confidence").asDouble(0.0), null));
            }
        }
        return Optional.of(new ProposedOrder(action.get(), (long) Math.floor(quantity.asDouble()),
                confidence.asDouble(), payload.path("reasoning").asText(""), reported));
    }

    private static Optional<DecisionAction> parseAction(String text) {
        if (text == null) {
            return Optional.empty();
        }
        String normalized = text.trim().toUpperCase(Locale.ROOT);
        for (DecisionAction action : DecisionAction.values()) {
            if (action.name().equals(normalized)) {
                return Optional.of(action);
            }
        }
        return Optional.empty();
    }

    private List<AgentSignal> breakdown(SignalSet signals) {
        List<AgentSignal> rows = new ArrayList<>();
        for (SignalSource source : SignalSource.values()) {
            Signal signal = signals.get(source);
            rows.add(new AgentSignal(source.agentName(), signal.direction(), signal.confidence(),
                    agentProperties.getDecision().weightOf(source)));
        }
        return rows;
    }

    private String systemPrompt() {
        AgentProperties.Decision config = agentProperties.getDecision();
        return String.format(Locale.ROOT, """
                You are a portfolio manager making final trading decisions.
                Your job is to make a trading decision based on the team's analysis while strictly adhering
                to risk management constraints.

                RISK MANAGEMENT CONSTRAINTS:
                - You MUST NOT exceed the max_position_size specified by the risk manager
                - You MUST follow the trading_action (buy/sell/hold) recommended by risk management
                - These are hard constraints that cannot be overridden by other signals

                When weighing the different signals for direction and timing:
                1. Valuation Analysis (%.0f%% weight): primary driver of fair value assessment
                2. Fundamental Analysis (%.0f%% weight): business quality and growth assessment
                3. Technical Analysis (%.0f%% weight): secondary confirmation for entry and exit timing
                4. Sentiment Analysis (%.0f%% weight): final consideration within risk limits

                Provide the following in your output:
                - "action": "buy" | "sell" | "hold"
                - "quantity": <positive integer, a multiple of %d shares>
                - "confidence": <float between 0 and 1>
                - "agent_signals": <list of objects with agent_name, signal (bullish | bearish | neutral) and confidence>
                - "reasoning": <concise explanation of the decision including how you weighted the signals>

                Trading Rules:
                - Never exceed risk management position limits
                - Only buy if you have available cash
                - Only sell if you have shares to sell
                - Quantity must be <= current position for sells""",
                config.getValuationWeight() * 100, config.getFundamentalsWeight() * 100,
                config.getTechnicalWeight() * 100, config.getSentimentWeight() * 100, config.getLotSize());
    }

    private String userPrompt(String ticker, SignalSet signals, RiskAssessment risk, Portfolio portfolio,
                              double lastPrice) {
        StringBuilder prompt = new StringBuilder();
        prompt.append("Based on the team's analysis below, make your trading decision for ").append(ticker).append(".\n\n");
        for (SignalSource source : List.of(SignalSource.TECHNICAL, SignalSource.FUNDAMENTALS,
                SignalSource.SENTIMENT, SignalSource.VALUATION)) {
            Signal signal = signals.get(source);
            prompt.append(String.format(Locale.ROOT, "%s Analysis Trading Signal: %s (confidence %.2f) %s%n",
                    source.displayName(), signal.direction().label(), signal.confidence(), signal.rationale()));
        }
        prompt.append(String.format(Locale.ROOT,
                "Risk Management Trading Signal: max_position_size=%.2f, risk_score=%d, trading_action=%s%n%n",
                risk.maxPositionValue(), risk.riskScore(), risk.tradingAction().label()));
        prompt.append(String.format(Locale.ROOT, "Portfolio:%nCash: %.2f%nCurrent Position: %d shares%nLast Price: %.2f%n%n",
                portfolio.cash(), portfolio.shares(), lastPrice));
        prompt.append("Only include the action, quantity, reasoning, confidence, and agent_signals in your output as JSON. ")
                .append("Do not include any JSON markdown.\n")
                .append("Remember, the action must be either buy, sell, or hold. ")
                .append("You can only buy if you have available cash. ")
                .append("You can only sell if you have shares in the portfolio to sell.");
        return prompt.toString();
    }

    private record ProposedOrder(DecisionAction action, long quantity, double confidence, String reasoning,
                                 List<AgentSignal> reportedSignals) {}
}
