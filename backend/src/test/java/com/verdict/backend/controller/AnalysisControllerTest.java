package com.verdict.backend.controller;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.verdict.backend.dto.AnalysisRawRequest;
import com.verdict.backend.dto.AnalysisRunRequest;
import com.verdict.backend.dto.PortfolioRequest;
import com.verdict.backend.dto.SignalRequest;
import com.verdict.backend.model.FinancialLineItem;
import com.verdict.backend.model.FinancialMetrics;
import com.verdict.backend.model.MarketSnapshot;
import com.verdict.backend.model.NewsItem;
import com.verdict.backend.model.SignalDirection;
import com.verdict.backend.model.SignalSource;
import com.verdict.backend.util.TestCandleFactory;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.time.LocalDateTime;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.hasSize;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest
@AutoConfigureMockMvc
class AnalysisControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @Test
    void runWithoutCompletionServiceReturnsFallbackHold() throws Exception {
        AnalysisRunRequest request = runRequest(allSignals(0.7));

        mockMvc.perform(post("/api/analysis/run")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(request)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.ticker").value("AAPL"))
                .andExpect(jsonPath("$.lastPrice").value(100.0))
                .andExpect(jsonPath("$.decision.action").value("HOLD"))
                .andExpect(jsonPath("$.decision.quantity").value(0))
                .andExpect(jsonPath("$.decision.confidence").value(0.7))
                .andExpect(jsonPath("$.decision.fallbackCause").value(containsString("SERVICE_FAILED")))
                .andExpect(jsonPath("$.decision.perSignalBreakdown", hasSize(4)))
                .andExpect(jsonPath("$.debate.llmScore").value(0.0))
                .andExpect(jsonPath("$.risk.riskScore").exists());
    }

    @Test
    void missingSignalIsUnprocessable() throws Exception {
        Map<SignalSource, SignalRequest> signals = allSignals(0.7);
        signals.remove(SignalSource.TECHNICAL);

        mockMvc.perform(post("/api/analysis/run")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(runRequest(signals))))
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.status").value(422))
                .andExpect(jsonPath("$.error").value("Unprocessable Entity"))
                .andExpect(jsonPath("$.path").value("/api/analysis/run"))
                .andExpect(jsonPath("$.message").value(containsString("technical_analysis")))
                .andExpect(jsonPath("$.details").doesNotExist());
    }

    @Test
    void outOfRangeConfidenceIsRejected() throws Exception {
        mockMvc.perform(post("/api/analysis/run")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(runRequest(allSignals(1.5)))))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message").value("Validation failed"))
                .andExpect(jsonPath("$.details", hasSize(4)))
                .andExpect(jsonPath("$.details[0].field").value(containsString("confidence")));
    }

    @Test
    void missingPortfolioIsRejected() throws Exception {
        AnalysisRunRequest request = runRequest(allSignals(0.5));
        request.setPortfolio(null);

        mockMvc.perform(post("/api/analysis/run")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(request)))
                .andExpect(status().isBadRequest());
    }

    @Test
    void malformedBodyIsRejected() throws Exception {
        mockMvc.perform(post("/api/analysis/run")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"ticker\": "))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message").value("Malformed request"));
    }

    @Test
    void analyzeProducesAllSignalsFromRawData() throws Exception {
        mockMvc.perform(post("/api/analysis/analyze")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(rawRequest(new MarketSnapshot(5_000.0, "Tech")))))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.signals.valuation.direction").exists())
                .andExpect(jsonPath("$.signals.fundamentals.direction").exists())
                .andExpect(jsonPath("$.signals.technical.rationale.trend_following").exists())
                .andExpect(jsonPath("$.signals.sentiment.direction").exists())
                .andExpect(jsonPath("$.decision.action").value("HOLD"));
    }

    @Test
    void analyzeWithoutMarketCapIsUnprocessable() throws Exception {
        mockMvc.perform(post("/api/analysis/analyze")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(rawRequest(null))))
                .andExpect(status().isUnprocessableEntity());
    }

    private static Map<SignalSource, SignalRequest> allSignals(double confidence) {
        Map<SignalSource, SignalRequest> signals = new EnumMap<>(SignalSource.class);
        for (SignalSource source : SignalSource.values()) {
            signals.put(source, SignalRequest.builder()
                    .direction(SignalDirection.BULLISH)
                    .confidence(confidence)
                    .build());
        }
        return signals;
    }

    private static AnalysisRunRequest runRequest(Map<SignalSource, SignalRequest> signals) {
        return AnalysisRunRequest.builder()
                .ticker("AAPL")
                .portfolio(PortfolioRequest.builder().cash(100_000.0).shares(0L).build())
                .signals(signals)
                .candles(TestCandleFactory.flatCandles(30, 100.0))
                .build();
    }

    private static AnalysisRawRequest rawRequest(MarketSnapshot market) {
        return AnalysisRawRequest.builder()
                .ticker("MSFT")
                .portfolio(PortfolioRequest.builder().cash(50_000.0).shares(200L).build())
                .candles(TestCandleFactory.trendingCandles(80, 50.0, 0.5))
                .metrics(FinancialMetrics.builder()
                        .returnOnEquity(0.2)
                        .netMargin(0.25)
                        .operatingMargin(0.18)
                        .revenueGrowth(0.12)
                        .earningsGrowth(0.08)
                        .bookValueGrowth(0.05)
                        .currentRatio(1.8)
                        .debtToEquity(0.4)
                        .freeCashFlowPerShare(4.0)
                        .earningsPerShare(4.5)
                        .priceToEarningsRatio(22.0)
                        .priceToBookRatio(4.0)
                        .priceToSalesRatio(6.0)
                        .build())
                .currentLineItem(FinancialLineItem.builder()
                        .netIncome(400.0)
                        .depreciationAndAmortization(50.0)
                        .capitalExpenditure(60.0)
                        .workingCapital(120.0)
                        .freeCashFlow(380.0)
                        .build())
                .previousLineItem(FinancialLineItem.builder().workingCapital(100.0).build())
                .market(market)
                .news(List.of(
                        new NewsItem("Record quarter", LocalDateTime.now().minusDays(2), 0.6),
                        new NewsItem("Supply worries", LocalDateTime.now().minusDays(3), -0.2)))
                .build();
    }
}
