package com.verdict.backend.dto;

import com.verdict.backend.model.Signal;
import com.verdict.backend.model.SignalDirection;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SignalRequest {

    @NotNull
    private SignalDirection direction;

    @NotNull
    @DecimalMin("0.0")
    @DecimalMax("1.0")
    private Double confidence;

    private Map<String, String> rationale;

    public Signal toSignal() {
        return new Signal(direction, confidence, rationale);
    }
}
