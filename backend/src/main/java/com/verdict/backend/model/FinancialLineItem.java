package com.verdict.backend.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Statement line items for one reporting period.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class FinancialLineItem {
    private Double netIncome;
    private Double depreciationAndAmortization;
    private Double capitalExpenditure;
    private Double workingCapital;
    private Double freeCashFlow;
}
