package com.verdict.backend.trading.pipeline;

import com.verdict.backend.config.AgentProperties;
import com.verdict.backend.model.Candle;
import com.verdict.backend.model.DebateResult;
import com.verdict.backend.model.Portfolio;
import com.verdict.backend.model.RiskAssessment;
import com.verdict.backend.model.RiskMetrics;
import com.verdict.backend.model.SignalDirection;
import com.verdict.backend.model.StressTestResult;
import com.verdict.backend.model.TradingAction;
import com.verdict.backend.service.risk.PriceStatisticsService;
import com.verdict.backend.service.risk.PriceStatisticsService.PriceStatistics;
import com.verdict.backend.service.risk.StressTestService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Locale;
import java.util.Map;

@Slf4j
@Service
@RequiredArgsConstructor
public class DefaultRiskEngine implements RiskEngine {

    private final PriceStatisticsService priceStatisticsService;
    private final StressTestService stressTestService;
    private final AgentProperties agentProperties;

    @Override
    public RiskAssessment evaluate(List<Candle> candles, DebateResult debate, Portfolio portfolio) {
        AgentProperties.Risk config = agentProperties.getRisk();
        PriceStatistics stats = priceStatisticsService.compute(candles);

        int marketRiskScore = marketRiskScore(stats, config);
        int riskScore = Math.min(marketRiskScore + debateUncertainty(debate, config), config.getMaxScore());

        double lastPrice = stats.lastClose();
        double basePosition = portfolio.totalValue(lastPrice) * config.getBasePositionFraction();
        int sizingScore = config.isSizingUsesAdjustedScore() ? riskScore : marketRiskScore;
        double maxPositionValue = basePosition * positionMultiplier(sizingScore, config);

        TradingAction action = tradingAction(riskScore, debate, config);
        Map<String, StressTestResult> stress = stressTestService.run(portfolio, lastPrice);
        RiskMetrics metrics = new RiskMetrics(stats.volatility(), stats.volatilityPercentile(), stats.var95(),
                stats.maxDrawdown(), marketRiskScore, riskScore);

        String reasoning = String.format(Locale.ROOT,
                "Risk Score %d/10: Market Risk=%d, Volatility=%.2f%%, VaR=%.2f%%, Max Drawdown=%.2f%%, Debate Signal=%s",
                riskScore, marketRiskScore, stats.volatility() * 100, stats.var95() * 100,
                stats.maxDrawdown() * 100, debate.signal().label());
        log.info("Risk score {}/10 (market {}) action={} maxPosition={}", riskScore, marketRiskScore,
                action.label(), maxPositionValue);
        return new RiskAssessment(riskScore, maxPositionValue, action, metrics, stress, reasoning);
    }

    int marketRiskScore(PriceStatistics stats, AgentProperties.Risk config) {
        int score = 0;
        if (stats.volatilityPercentile() > config.getVolatilityPercentileHigh()) {
            score += 2;
        } else if (stats.volatilityPercentile() > config.getVolatilityPercentileElevated()) {
            score += 1;
        }
        if (stats.var95() < config.getVarSevere()) {
            score += 2;
        } else if (stats.var95() < config.getVarElevated()) {
            score += 1;
        }
        if (stats.maxDrawdown() < config.getDrawdownSevere()) {
            score += 2;
        } else if (stats.maxDrawdown() < config.getDrawdownElevated()) {
            score += 1;
        }
        return score;
    }

    int debateUncertainty(DebateResult debate, AgentProperties.Risk config) {
        int score = 0;
        if (Math.abs(debate.bullConfidence() - debate.bearConfidence()) < config.getDebateDisagreementThreshold()) {
            score += 1;
        }
        if (debate.confidence() < config.getLowDebateConfidence()) {
            score += 1;
        }
        return score;
    }

    private double positionMultiplier(int score, AgentProperties.Risk config) {
        if (score >= config.getHighRiskScore()) {
            return config.getHighRiskMultiplier();
        }
        if (score >= config.getMediumRiskScore()) {
            return config.getMediumRiskMultiplier();
        }
        return 1.0;
    }

    private TradingAction tradingAction(int riskScore, DebateResult debate, AgentProperties.Risk config) {
        if (riskScore >= config.getHoldScore()) {
            return TradingAction.HOLD;
        }
        if (riskScore >= config.getReduceScore()) {
            return TradingAction.REDUCE;
        }
        if (debate.confidence() > config.getActionConfidence()) {
            if (debate.signal() == SignalDirection.BULLISH) {
                return TradingAction.BUY;
            }
            if (debate.signal() == SignalDirection.BEARISH) {
                return TradingAction.SELL;
            }
        }
        return TradingAction.HOLD;
    }
}
