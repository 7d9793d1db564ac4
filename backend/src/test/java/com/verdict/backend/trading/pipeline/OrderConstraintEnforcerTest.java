package com.verdict.backend.trading.pipeline;

import com.verdict.backend.config.AgentProperties;
import com.verdict.backend.model.Decision.DecisionAction;
import com.verdict.backend.model.Portfolio;
import com.verdict.backend.model.RiskAssessment;
import com.verdict.backend.model.TradingAction;
import com.verdict.backend.trading.pipeline.OrderConstraintEnforcer.ConstrainedOrder;
import org.junit.jupiter.api.Test;

import java.util.Map;
import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;

class OrderConstraintEnforcerTest {

    private final AgentProperties properties = new AgentProperties();
    private final OrderConstraintEnforcer enforcer = new OrderConstraintEnforcer(properties);

    @Test
    void buyIsCappedByRiskCeilingInWholeLots() {
        ConstrainedOrder order = enforcer.enforce(DecisionAction.BUY, 1_000, 0.8,
                risk(TradingAction.BUY, 25_000), new Portfolio(100_000, 0), 100.0);

        assertThat(order.action()).isEqualTo(DecisionAction.BUY);
        assertThat(order.quantity()).isEqualTo(200);
        assertThat(order.notes()).isNotEmpty();
    }

    @Test
    void buyIsCappedByCash() {
        ConstrainedOrder order = enforcer.enforce(DecisionAction.BUY, 1_000, 0.8,
                risk(TradingAction.BUY, 1_000_000), new Portfolio(35_000, 0), 100.0);

        assertThat(order.quantity()).isEqualTo(300);
    }

    @Test
    void noCashMeansNoBuyRegardlessOfRequest() {
        ConstrainedOrder order = enforcer.enforce(DecisionAction.BUY, 500, 0.9,
                risk(TradingAction.BUY, 1_000_000), new Portfolio(0, 0), 10.0);

        assertThat(order.quantity()).isZero();
        assertThat(order.action()).isEqualTo(DecisionAction.HOLD);
    }

    @Test
    void subLotBuyIsPromotedToOneLot() {
        ConstrainedOrder order = enforcer.enforce(DecisionAction.BUY, 40, 0.6,
                risk(TradingAction.BUY, 50_000), new Portfolio(50_000, 0), 10.0);

        assertThat(order.quantity()).isEqualTo(100);
        assertThat(order.action()).isEqualTo(DecisionAction.BUY);
    }

    @Test
    void promotedLotStillRespectsCeiling() {
        ConstrainedOrder order = enforcer.enforce(DecisionAction.BUY, 40, 0.6,
                risk(TradingAction.BUY, 500), new Portfolio(50_000, 0), 10.0);

        assertThat(order.quantity()).isZero();
        assertThat(order.action()).isEqualTo(DecisionAction.HOLD);
    }

    @Test
    void promotionCanBeDisabled() {
        AgentProperties noPromotion = new AgentProperties();
        noPromotion.getDecision().setPromoteSubLotBuys(false);

        ConstrainedOrder order = new OrderConstraintEnforcer(noPromotion).enforce(DecisionAction.BUY, 40, 0.6,
                risk(TradingAction.BUY, 50_000), new Portfolio(50_000, 0), 10.0);

        assertThat(order.quantity()).isZero();
    }

    @Test
    void sellIsClippedToHoldingsThenRoundedDown() {
        ConstrainedOrder order = enforcer.enforce(DecisionAction.SELL, 1_000, 0.7,
                risk(TradingAction.SELL, 0), new Portfolio(0, 350), 10.0);

        assertThat(order.action()).isEqualTo(DecisionAction.SELL);
        assertThat(order.quantity()).isEqualTo(300);
    }

    @Test
    void sellingLessThanOneLotBecomesHold() {
        ConstrainedOrder order = enforcer.enforce(DecisionAction.SELL, 50, 0.7,
                risk(TradingAction.SELL, 0), new Portfolio(0, 50), 10.0);

        assertThat(order.action()).isEqualTo(DecisionAction.HOLD);
        assertThat(order.quantity()).isZero();
    }

    @Test
    void reduceRiskActionBlocksBuys() {
        ConstrainedOrder order = enforcer.enforce(DecisionAction.BUY, 100, 0.7,
                risk(TradingAction.REDUCE, 50_000), new Portfolio(50_000, 0), 10.0);

        assertThat(order.action()).isEqualTo(DecisionAction.HOLD);
        assertThat(order.notes()).anyMatch(note -> note.contains("reduce"));
    }

    @Test
    void confidenceIsClamped() {
        ConstrainedOrder order = enforcer.enforce(DecisionAction.HOLD, 0, 1.7,
                risk(TradingAction.HOLD, 0), new Portfolio(0, 0), 10.0);

        assertThat(order.confidence()).isEqualTo(1.0);
    }

    @Test
    void quantitiesAreAlwaysWholeLotsWithinLimits() {
        Random random = new Random(42);
        for (int i = 0; i < 500; i++) {
            DecisionAction action = DecisionAction.values()[random.nextInt(3)];
            long requested = random.nextInt(5_000) - 100;
            double price = 1 + random.nextDouble() * 200;
            double cash = random.nextDouble() * 200_000;
            long shares = random.nextInt(3_000);
            double ceiling = random.nextDouble() * 150_000;

            ConstrainedOrder order = enforcer.enforce(action, requested, random.nextDouble(),
                    risk(TradingAction.BUY, ceiling), new Portfolio(cash, shares), price);

            assertThat(order.quantity() % 100).isZero();
            assertThat(order.quantity()).isNotNegative();
            if (order.action() == DecisionAction.BUY) {
                assertThat(order.quantity()).isLessThanOrEqualTo(enforcer.maxShares(ceiling, price));
                assertThat(order.quantity()).isLessThanOrEqualTo(enforcer.affordableShares(cash, price));
            }
            if (order.action() == DecisionAction.SELL) {
                assertThat(order.quantity()).isLessThanOrEqualTo(shares);
            }
            if (order.action() == DecisionAction.HOLD) {
                assertThat(order.quantity()).isZero();
            }
        }
    }

    private static RiskAssessment risk(TradingAction action, double maxPositionValue) {
        return new RiskAssessment(0, maxPositionValue, action, null, Map.of(), "test");
    }
}
