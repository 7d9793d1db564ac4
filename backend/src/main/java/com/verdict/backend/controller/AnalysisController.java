package com.verdict.backend.controller;

import com.verdict.backend.dto.AnalysisRawRequest;
import com.verdict.backend.dto.AnalysisRunRequest;
import com.verdict.backend.service.AnalysisService;
import com.verdict.backend.trading.pipeline.PipelineResult;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/analysis")
@RequiredArgsConstructor
@Tag(name = "Analysis")
public class AnalysisController {

    private final AnalysisService analysisService;

    @PostMapping("/run")
    @Operation(summary = "Run debate, risk and decision on precomputed signals")
    public ResponseEntity<PipelineResult> run(@Valid @RequestBody AnalysisRunRequest request) {
        return ResponseEntity.ok(analysisService.run(request));
    }

    @PostMapping("/analyze")
    @Operation(summary = "Produce all four signals from raw market data, then run the pipeline")
    public ResponseEntity<PipelineResult> analyze(@Valid @RequestBody AnalysisRawRequest request) {
        return ResponseEntity.ok(analysisService.analyze(request));
    }
}
