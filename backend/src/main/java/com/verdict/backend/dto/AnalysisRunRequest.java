package com.verdict.backend.dto;

import com.verdict.backend.model.Candle;
import com.verdict.backend.model.SignalSource;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;
import java.util.List;
import java.util.Map;

/**
 * Pipeline input with the four signals already computed. Missing signals or prices are rejected as unprocessable.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AnalysisRunRequest {

    @NotBlank
    private String ticker;

    private LocalDate startDate;

    private LocalDate endDate;

    @NotNull
    @Valid
    private PortfolioRequest portfolio;

    private Map<SignalSource, @Valid SignalRequest> signals;

    private List<Candle> candles;
}
