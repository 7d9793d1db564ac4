package com.verdict.backend.service.signal;

import com.verdict.backend.config.AgentProperties;
import com.verdict.backend.exception.MissingPreconditionException;
import com.verdict.backend.model.FinancialLineItem;
import com.verdict.backend.model.FinancialMetrics;
import com.verdict.backend.model.MarketSnapshot;
import com.verdict.backend.model.Signal;
import com.verdict.backend.model.SignalDirection;
import com.verdict.backend.util.SeriesMath;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

@Slf4j
@Service
@RequiredArgsConstructor
public class ValuationSignalProducer {

    private final IntrinsicValueCalculator intrinsicValueCalculator;
    private final AgentProperties agentProperties;

    public Signal produce(FinancialMetrics metrics, FinancialLineItem current, FinancialLineItem previous,
                          MarketSnapshot market) {
        if (market == null || !(market.marketCap() > 0)) {
            throw new MissingPreconditionException("Market capitalization must be positive for valuation");
        }
        if (current == null) {
            throw new MissingPreconditionException("Current period line items are required for valuation");
        }
        Double growth = metrics == null ? null : metrics.getEarningsGrowth();
        double workingCapitalChange = IntrinsicValueCalculator.workingCapitalChange(
                current.getWorkingCapital(), previous == null ? null : previous.getWorkingCapital());

        double ownerEarningsValue = intrinsicValueCalculator.ownerEarningsValue(
                current.getNetIncome(),
                current.getDepreciationAndAmortization(),
                current.getCapitalExpenditure(),
                workingCapitalChange,
                growth);
        double dcfValue = intrinsicValueCalculator.discountedCashFlowValue(current.getFreeCashFlow(), growth);

        double marketCap = market.marketCap();
        double dcfGap = (dcfValue - marketCap) / marketCap;
        double ownerEarningsGap = (ownerEarningsValue - marketCap) / marketCap;
        double valuationGap = (dcfGap + ownerEarningsGap) / 2;

        Map<String, String> rationale = new LinkedHashMap<>();
        rationale.put("dcf_analysis", describe("Intrinsic Value", dcfValue, marketCap, dcfGap));
        rationale.put("owner_earnings_analysis", describe("Owner Earnings Value", ownerEarningsValue, marketCap, ownerEarningsGap));

        SignalDirection direction = classify(valuationGap);
        log.debug("Valuation gap {} (dcf {}, owner earnings {}) -> {}", valuationGap, dcfGap, ownerEarningsGap, direction);
        return new Signal(direction, SeriesMath.clamp(Math.abs(valuationGap), 0.0, 1.0), rationale);
    }

    private SignalDirection classify(double gap) {
        AgentProperties.Valuation config = agentProperties.getValuation();
        if (gap > config.getBullishGap()) {
            return SignalDirection.BULLISH;
        }
        if (gap < config.getBearishGap()) {
            return SignalDirection.BEARISH;
        }
        return SignalDirection.NEUTRAL;
    }

    private String describe(String label, double value, double marketCap, double gap) {
        return String.format(Locale.ROOT, "%s (%s): %s: %,.2f, Market Cap: %,.2f, Gap: %.1f%%",
                classify(gap).label(), label, label, value, marketCap, gap * 100);
    }
}
