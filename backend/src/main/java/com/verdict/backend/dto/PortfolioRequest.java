package com.verdict.backend.dto;

import com.verdict.backend.model.Portfolio;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PortfolioRequest {

    @NotNull
    @PositiveOrZero
    private Double cash;

    @NotNull
    @PositiveOrZero
    private Long shares;

    public Portfolio toPortfolio() {
        return new Portfolio(cash, shares);
    }
}
