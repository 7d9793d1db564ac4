package com.verdict.backend.config;

import com.verdict.backend.model.SignalSource;
import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.Positive;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Tunable constants of the signal, debate, risk and decision stages.
 */
@Configuration
@ConfigurationProperties(prefix = "agent")
@Data
@Validated
public class AgentProperties {

    @Valid
    private Technical technical = new Technical();
    @Valid
    private Sentiment sentiment = new Sentiment();
    @Valid
    private Valuation valuation = new Valuation();
    @Valid
    private Thesis thesis = new Thesis();
    @Valid
    private Debate debate = new Debate();
    @Valid
    private Risk risk = new Risk();
    @Valid
    private Decision decision = new Decision();

    @Data
    public static class Technical {
        @Min(2)
        private int rsiPeriod = 14;
        @Min(2)
        private int macdFastPeriod = 12;
        @Min(2)
        private int macdSlowPeriod = 26;
        @Min(2)
        private int macdSignalPeriod = 9;
        @Min(2)
        private int adxPeriod = 14;
        @Min(2)
        private int atrPeriod = 14;
        @Min(2)
        private int bollingerPeriod = 20;
        @Positive
        private double bollingerDeviation = 2.0;
        @Min(2)
        private int emaShortPeriod = 8;
        @Min(2)
        private int emaLongPeriod = 21;
        @Min(2)
        private int meanReversionWindow = 50;
        @Positive
        private double strongTrendAdx = 25.0;
        @Positive
        private double directionThreshold = 0.2;
        private double trendWeight = 0.25;
        private double meanReversionWeight = 0.20;
        private double momentumWeight = 0.25;
        private double volatilityWeight = 0.15;
        private double oscillatorWeight = 0.15;
    }

    @Data
    public static class Sentiment {
        @Min(1)
        private int lookbackDays = 7;
        private double bullishThreshold = 0.5;
        private double bearishThreshold = -0.5;
    }

    @Data
    public static class Valuation {
        @Positive
        private double ownerEarningsRequiredReturn = 0.15;
        @Positive
        private double dcfDiscountRate = 0.10;
        @Min(1)
        private int projectionYears = 5;
        @DecimalMin("0.0")
        @DecimalMax("1.0")
        private double marginOfSafety = 0.25;
        @DecimalMin("0.0")
        private double maxGrowthRate = 0.25;
        @DecimalMin("0.0")
        private double terminalGrowthFactor = 0.4;
        @DecimalMin("0.0")
        private double terminalGrowthCap = 0.03;
        private double bullishGap = 0.10;
        private double bearishGap = -0.20;
    }

    @Data
    public static class Thesis {
        @DecimalMin("0.0")
        @DecimalMax("1.0")
        private double fallbackConfidence = 0.3;
    }

    @Data
    public static class Debate {
        /**
         * Weight of the external opinion in the mixed confidence difference.
         */
        @DecimalMin("0.0")
        @DecimalMax("1.0")
        private double llmWeight = 0.3;
        @DecimalMin("0.0")
        private double neutralThreshold = 0.1;
    }

    @Data
    public static class Risk {
        @Min(2)
        private int volatilityWindow = 120;
        @Min(2)
        private int drawdownWindow = 60;
        @Positive
        private int tradingDaysPerYear = 252;
        @DecimalMin("0.0")
        @DecimalMax("1.0")
        private double basePositionFraction = 0.25;
        private double volatilityPercentileHigh = 1.5;
        private double volatilityPercentileElevated = 1.0;
        private double varSevere = -0.03;
        private double varElevated = -0.02;
        private double drawdownSevere = -0.20;
        private double drawdownElevated = -0.10;
        private int highRiskScore = 4;
        private int mediumRiskScore = 2;
        private double highRiskMultiplier = 0.5;
        private double mediumRiskMultiplier = 0.75;
        private double debateDisagreementThreshold = 0.1;
        private double lowDebateConfidence = 0.3;
        private int holdScore = 9;
        private int reduceScore = 7;
        private double actionConfidence = 0.5;
        @Min(1)
        private int maxScore = 10;
        /**
         * When false the position ceiling is tiered on the price-only score, before debate uncertainty is added.
         */
        private boolean sizingUsesAdjustedScore = false;
        @NotEmpty
        private Map<String, Double> stressScenarios = defaultScenarios();

        private static Map<String, Double> defaultScenarios() {
            Map<String, Double> scenarios = new LinkedHashMap<>();
            scenarios.put("market_crash", -0.20);
            scenarios.put("moderate_decline", -0.10);
            scenarios.put("slight_decline", -0.05);
            return scenarios;
        }
    }

    @Data
    public static class Decision {
        @Min(1)
        private int lotSize = 100;
        /**
         * A positive buy request smaller than one lot becomes exactly one lot, still bounded by the ceilings.
         */
        private boolean promoteSubLotBuys = true;
        @DecimalMin("0.0")
        @DecimalMax("1.0")
        private double fallbackConfidence = 0.7;
        private boolean enforceRiskAction = true;
        private double valuationWeight = 0.35;
        private double fundamentalsWeight = 0.30;
        private double technicalWeight = 0.25;
        private double sentimentWeight = 0.10;

        public double weightOf(SignalSource source) {
            return switch (source) {
                case VALUATION -> valuationWeight;
                case FUNDAMENTALS -> fundamentalsWeight;
                case TECHNICAL -> technicalWeight;
                case SENTIMENT -> sentimentWeight;
            };
        }
    }
}
