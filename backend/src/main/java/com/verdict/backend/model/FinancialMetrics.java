package com.verdict.backend.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Latest reported ratios for a company. Any field may be null when the feed lacks it.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class FinancialMetrics {
    private Double returnOnEquity;
    private Double netMargin;
    private Double operatingMargin;
    private Double revenueGrowth;
    private Double earningsGrowth;
    private Double bookValueGrowth;
    private Double currentRatio;
    private Double debtToEquity;
    private Double freeCashFlowPerShare;
    private Double earningsPerShare;
    private Double priceToEarningsRatio;
    private Double priceToBookRatio;
    private Double priceToSalesRatio;
}
