package com.verdict.backend.service.signal;

import com.verdict.backend.config.AgentProperties;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Owner-earnings and discounted-cash-flow valuations. Both return 0 when the cash measure is not positive
 * or an input is missing, and never return a negative value.
 */
@Component
@RequiredArgsConstructor
public class IntrinsicValueCalculator {

    private final AgentProperties agentProperties;

    public static double workingCapitalChange(Double current, Double previous) {
        return orZero(current) - orZero(previous);
    }

    /**
     * Discounts owner earnings (net income + D&A - capex - working capital change) over the projection horizon
     * with a growth rate that decays linearly to half its starting value, adds a perpetuity and applies the
     * margin of safety.
     */
    public double ownerEarningsValue(Double netIncome, Double depreciation, Double capex,
                                     double workingCapitalChange, Double growthRate) {
        if (netIncome == null || depreciation == null || capex == null) {
            return 0.0;
        }
        double ownerEarnings = netIncome + depreciation - capex - workingCapitalChange;
        if (ownerEarnings <= 0) {
            return 0.0;
        }
        AgentProperties.Valuation config = agentProperties.getValuation();
        int years = config.getProjectionYears();
        double requiredReturn = config.getOwnerEarningsRequiredReturn();
        double growth = clampGrowth(growthRate);

        double sum = 0.0;
        double lastDiscounted = 0.0;
        for (int year = 1; year <= years; year++) {
            double yearGrowth = growth * (1 - year / (2.0 * years));
            double futureValue = ownerEarnings * Math.pow(1 + yearGrowth, year);
            lastDiscounted = futureValue / Math.pow(1 + requiredReturn, year);
            sum += lastDiscounted;
        }
        double terminalGrowth = terminalGrowth(growth);
        // perpetuity is built on the already discounted final year, then discounted again
        double terminalValue = lastDiscounted * (1 + terminalGrowth) / (requiredReturn - terminalGrowth);
        double terminalDiscounted = terminalValue / Math.pow(1 + requiredReturn, years);

        double intrinsic = sum + terminalDiscounted;
        return Math.max(intrinsic * (1 - config.getMarginOfSafety()), 0.0);
    }

    public double discountedCashFlowValue(Double freeCashFlow, Double growthRate) {
        if (freeCashFlow == null || freeCashFlow <= 0) {
            return 0.0;
        }
        AgentProperties.Valuation config = agentProperties.getValuation();
        int years = config.getProjectionYears();
        double discountRate = config.getDcfDiscountRate();
        double growth = clampGrowth(growthRate);
        double terminalGrowth = terminalGrowth(growth);

        double sum = 0.0;
        for (int year = 1; year <= years; year++) {
            sum += freeCashFlow * Math.pow(1 + growth, year) / Math.pow(1 + discountRate, year);
        }
        double terminalCashFlow = freeCashFlow * Math.pow(1 + growth, years);
        double terminalValue = terminalCashFlow * (1 + terminalGrowth) / (discountRate - terminalGrowth);
        sum += terminalValue / Math.pow(1 + discountRate, years);
        return Math.max(sum, 0.0);
    }

    private double clampGrowth(Double growthRate) {
        double growth = growthRate == null || growthRate.isNaN() ? 0.0 : growthRate;
        return Math.min(Math.max(growth, 0.0), agentProperties.getValuation().getMaxGrowthRate());
    }

    private double terminalGrowth(double growth) {
        AgentProperties.Valuation config = agentProperties.getValuation();
        return Math.min(growth * config.getTerminalGrowthFactor(), config.getTerminalGrowthCap());
    }

    private static double orZero(Double value) {
        return value == null ? 0.0 : value;
    }
}
