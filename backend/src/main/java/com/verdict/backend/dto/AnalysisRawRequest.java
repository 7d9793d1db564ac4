package com.verdict.backend.dto;

import com.verdict.backend.model.Candle;
import com.verdict.backend.model.FinancialLineItem;
import com.verdict.backend.model.FinancialMetrics;
import com.verdict.backend.model.MarketSnapshot;
import com.verdict.backend.model.NewsItem;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;
import java.util.List;

/**
 * Raw upstream data from which the four signals are produced before the pipeline runs.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AnalysisRawRequest {

    @NotBlank
    private String ticker;

    private LocalDate startDate;

    private LocalDate endDate;

    @NotNull
    @Valid
    private PortfolioRequest portfolio;

    private List<Candle> candles;

    private FinancialMetrics metrics;

    private FinancialLineItem currentLineItem;

    private FinancialLineItem previousLineItem;

    private MarketSnapshot market;

    private List<NewsItem> news;
}
