package com.verdict.backend.trading.pipeline;

import com.verdict.backend.config.AgentProperties;
import com.verdict.backend.model.Decision.DecisionAction;
import com.verdict.backend.model.Portfolio;
import com.verdict.backend.model.RiskAssessment;
import com.verdict.backend.model.TradingAction;
import com.verdict.backend.util.SeriesMath;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Applies the hard order constraints: lot quantization, the risk position ceiling, available cash and held shares.
 * The result is always a non-negative multiple of the lot size.
 */
@Component
@RequiredArgsConstructor
public class OrderConstraintEnforcer {

    private final AgentProperties agentProperties;

    public ConstrainedOrder enforce(DecisionAction requestedAction, long requestedQuantity, double requestedConfidence,
                                    RiskAssessment risk, Portfolio portfolio, double lastPrice) {
        AgentProperties.Decision config = agentProperties.getDecision();
        int lot = config.getLotSize();
        List<String> notes = new ArrayList<>();
        double confidence = Double.isNaN(requestedConfidence) ? 0.0 : SeriesMath.clamp(requestedConfidence, 0.0, 1.0);
        if (confidence != requestedConfidence) {
            notes.add("Confidence " + requestedConfidence + " clamped to " + confidence);
        }

        DecisionAction action = requestedAction;
        if (action == DecisionAction.BUY && config.isEnforceRiskAction()
                && (risk.tradingAction() == TradingAction.HOLD || risk.tradingAction() == TradingAction.REDUCE)) {
            notes.add("Buy blocked: risk action is " + risk.tradingAction().label());
            action = DecisionAction.HOLD;
        }

        long quantity = switch (action) {
            case BUY -> buyQuantity(requestedQuantity, risk, portfolio, lastPrice, lot, config.isPromoteSubLotBuys(), notes);
            case SELL -> sellQuantity(requestedQuantity, portfolio, lot, notes);
            case HOLD -> 0L;
        };

        if (action != DecisionAction.HOLD && quantity == 0) {
            notes.add(action.name().toLowerCase(Locale.ROOT) + " quantity clipped to 0, holding");
            action = DecisionAction.HOLD;
        }
        return new ConstrainedOrder(action, quantity, confidence, notes);
    }

    public long maxShares(double maxPositionValue, double lastPrice) {
        return floorToLot(maxPositionValue / lastPrice);
    }

    public long affordableShares(double cash, double lastPrice) {
        return floorToLot(cash / lastPrice);
    }

    private long buyQuantity(long requested, RiskAssessment risk, Portfolio portfolio, double lastPrice, int lot,
                             boolean promoteSubLot, List<String> notes) {
        if (requested <= 0) {
            return 0L;
        }
        long ceiling = Math.min(maxShares(risk.maxPositionValue(), lastPrice), affordableShares(portfolio.cash(), lastPrice));
        long quantized = (requested / lot) * lot;
        if (quantized == 0 && promoteSubLot) {
            notes.add("Requested " + requested + " shares is below one lot, promoted to " + lot);
            quantized = lot;
        } else if (quantized != requested) {
            notes.add("Requested " + requested + " shares rounded down to " + quantized);
        }
        if (quantized > ceiling) {
            notes.add("Buy quantity " + quantized + " capped at " + ceiling + " by position ceiling and cash");
            return ceiling;
        }
        return quantized;
    }

    private long sellQuantity(long requested, Portfolio portfolio, int lot, List<String> notes) {
        if (requested <= 0) {
            return 0L;
        }
        long quantity = requested;
        if (quantity > portfolio.shares()) {
            notes.add("Sell quantity " + requested + " capped at held shares " + portfolio.shares());
            quantity = portfolio.shares();
        }
        long quantized = (quantity / lot) * lot;
        if (quantized != quantity) {
            notes.add("Sell quantity " + quantity + " rounded down to " + quantized);
        }
        return quantized;
    }

    private long floorToLot(double shares) {
        if (!(shares > 0) || Double.isInfinite(shares)) {
            return 0L;
        }
        int lot = agentProperties.getDecision().getLotSize();
        return (long) Math.floor(shares / lot) * lot;
    }

    public record ConstrainedOrder(DecisionAction action, long quantity, double confidence, List<String> notes) {}
}
