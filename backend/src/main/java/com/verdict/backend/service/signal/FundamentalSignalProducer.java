package com.verdict.backend.service.signal;

import com.verdict.backend.exception.MissingPreconditionException;
import com.verdict.backend.model.FinancialMetrics;
import com.verdict.backend.model.Signal;
import com.verdict.backend.model.SignalDirection;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Scores profitability, growth, financial health and price ratios; each area votes on three criteria.
 */
@Slf4j
@Service
public class FundamentalSignalProducer {

    private static final double ROE_MIN = 0.15;
    private static final double NET_MARGIN_MIN = 0.20;
    private static final double OPERATING_MARGIN_MIN = 0.15;
    private static final double GROWTH_MIN = 0.10;
    private static final double CURRENT_RATIO_MIN = 1.5;
    private static final double DEBT_TO_EQUITY_MAX = 0.5;
    private static final double FCF_TO_EPS_MIN = 0.8;
    private static final double PE_MAX = 25;
    private static final double PB_MAX = 3;
    private static final double PS_MAX = 5;

    public Signal produce(FinancialMetrics metrics) {
        if (metrics == null) {
            throw new MissingPreconditionException("Financial metrics are required for fundamental analysis");
        }
        Map<String, String> rationale = new LinkedHashMap<>();

        int profitability = count(above(metrics.getReturnOnEquity(), ROE_MIN),
                above(metrics.getNetMargin(), NET_MARGIN_MIN),
                above(metrics.getOperatingMargin(), OPERATING_MARGIN_MIN));
        SignalDirection profitabilitySignal = vote(profitability);
        rationale.put("profitability_signal", profitabilitySignal.label() + ": " + String.join(", ",
                percent("ROE", metrics.getReturnOnEquity()),
                percent("Net Margin", metrics.getNetMargin()),
                percent("Op Margin", metrics.getOperatingMargin())));

        int growth = count(above(metrics.getRevenueGrowth(), GROWTH_MIN),
                above(metrics.getEarningsGrowth(), GROWTH_MIN),
                above(metrics.getBookValueGrowth(), GROWTH_MIN));
        SignalDirection growthSignal = vote(growth);
        rationale.put("growth_signal", growthSignal.label() + ": " + String.join(", ",
                percent("Revenue Growth", metrics.getRevenueGrowth()),
                percent("Earnings Growth", metrics.getEarningsGrowth()),
                percent("Book Value Growth", metrics.getBookValueGrowth())));

        boolean cashBacksEarnings = metrics.getFreeCashFlowPerShare() != null && metrics.getEarningsPerShare() != null
                && metrics.getFreeCashFlowPerShare() > metrics.getEarningsPerShare() * FCF_TO_EPS_MIN;
        int health = count(above(metrics.getCurrentRatio(), CURRENT_RATIO_MIN),
                below(metrics.getDebtToEquity(), DEBT_TO_EQUITY_MAX),
                cashBacksEarnings);
        SignalDirection healthSignal = vote(health);
        rationale.put("financial_health_signal", healthSignal.label() + ": " + String.join(", ",
                ratio("Current Ratio", metrics.getCurrentRatio()),
                ratio("D/E", metrics.getDebtToEquity())));

        int priceRatios = count(below(metrics.getPriceToEarningsRatio(), PE_MAX),
                below(metrics.getPriceToBookRatio(), PB_MAX),
                below(metrics.getPriceToSalesRatio(), PS_MAX));
        SignalDirection priceSignal = vote(priceRatios);
        rationale.put("price_ratios_signal", priceSignal.label() + ": " + String.join(", ",
                ratio("P/E", metrics.getPriceToEarningsRatio()),
                ratio("P/B", metrics.getPriceToBookRatio()),
                ratio("P/S", metrics.getPriceToSalesRatio())));

        List<SignalDirection> votes = List.of(profitabilitySignal, growthSignal, healthSignal, priceSignal);
        long bullish = votes.stream().filter(v -> v == SignalDirection.BULLISH).count();
        long bearish = votes.stream().filter(v -> v == SignalDirection.BEARISH).count();
        SignalDirection overall = bullish > bearish
                ? SignalDirection.BULLISH
                : bearish > bullish ? SignalDirection.BEARISH : SignalDirection.NEUTRAL;
        double confidence = Math.max(bullish, bearish) / (double) votes.size();
        log.debug("Fundamentals bullish={} bearish={} -> {}", bullish, bearish, overall);
        return new Signal(overall, confidence, rationale);
    }

    private static SignalDirection vote(int score) {
        if (score >= 2) {
            return SignalDirection.BULLISH;
        }
        return score == 0 ? SignalDirection.BEARISH : SignalDirection.NEUTRAL;
    }

    private static int count(boolean... criteria) {
        int score = 0;
        for (boolean criterion : criteria) {
            if (criterion) {
                score++;
            }
        }
        return score;
    }

    private static boolean above(Double value, double threshold) {
        return value != null && value > threshold;
    }

    private static boolean below(Double value, double threshold) {
        return value != null && value < threshold;
    }

    private static String percent(String label, Double value) {
        return value == null ? label + ": N/A" : String.format(Locale.ROOT, "%s: %.2f%%", label, value * 100);
    }

    private static String ratio(String label, Double value) {
        return value == null ? label + ": N/A" : String.format(Locale.ROOT, "%s: %.2f", label, value);
    }
}
