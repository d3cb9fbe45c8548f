package com.tony.sportsFeatures.controller;

import com.tony.sportsFeatures.config.FeatureProperties;
import com.tony.sportsFeatures.model.BootstrapSummary;
import com.tony.sportsFeatures.model.CalibrationReport;
import com.tony.sportsFeatures.model.ErrorInterval;
import com.tony.sportsFeatures.model.ErrorMetric;
import com.tony.sportsFeatures.model.FeatureImportanceReport;
import com.tony.sportsFeatures.model.OverfittingReport;
import com.tony.sportsFeatures.model.RowTable;
import com.tony.sportsFeatures.model.dto.FeatureImportanceRequest;
import com.tony.sportsFeatures.model.dto.FoldResponse;
import com.tony.sportsFeatures.model.dto.OverfittingRequest;
import com.tony.sportsFeatures.model.dto.PredictionMetricsRequest;
import com.tony.sportsFeatures.model.dto.StratifiedSplitResponse;
import com.tony.sportsFeatures.model.dto.ValidationRequest;
import com.tony.sportsFeatures.service.StratifiedSplitter;
import com.tony.sportsFeatures.service.TimeSeriesSplitter;
import com.tony.sportsFeatures.service.ValidationMetricsService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/v1/validation")
@RequiredArgsConstructor
public class ValidationController {
    private final TimeSeriesSplitter timeSeriesSplitter;
    private final StratifiedSplitter stratifiedSplitter;
    private final ValidationMetricsService metricsService;
    private final FeatureProperties properties;

    @PostMapping("/time-series")
    public ResponseEntity<List<FoldResponse>> timeSeries(@Valid @RequestBody ValidationRequest request) {
        return ResponseEntity.ok(timeSeriesSplitter.split(RowTable.fromMaps(request.getRows()),
                        request.getTimestampColumn(), request.getNSplits(), request.getTestFraction())
                .stream().map(FoldResponse::of).toList());
    }

    @PostMapping("/stratified")
    public ResponseEntity<StratifiedSplitResponse> stratified(@Valid @RequestBody ValidationRequest request) {
        String target = request.getTargetColumn() != null ? request.getTargetColumn() : properties.getTargetColumn();
        return ResponseEntity.ok(StratifiedSplitResponse.of(stratifiedSplitter.split(RowTable.fromMaps(request.getRows()),
                target, request.getTestFraction(), request.getSeed())));
    }

    // --- Diagnostics d'un modèle entraîné ailleurs ---

    @PostMapping("/confidence-interval")
    public ResponseEntity<ErrorInterval> confidenceInterval(@Valid @RequestBody PredictionMetricsRequest request) {
        return ResponseEntity.ok(metricsService.confidenceInterval(request.getPredictions(), request.getActuals(),
                request.getConfidence()));
    }

    @PostMapping("/bootstrap")
    public ResponseEntity<BootstrapSummary> bootstrap(@Valid @RequestBody PredictionMetricsRequest request) {
        return ResponseEntity.ok(metricsService.bootstrap(request.getPredictions(), request.getActuals(),
                ErrorMetric.fromKey(request.getMetric()), request.getIterations(), request.getSeed()));
    }

    @PostMapping("/calibration")
    public ResponseEntity<CalibrationReport> calibration(@Valid @RequestBody PredictionMetricsRequest request) {
        return ResponseEntity.ok(metricsService.calibration(request.getPredictions(), request.getActuals(), request.getBins()));
    }

    @PostMapping("/overfitting")
    public ResponseEntity<OverfittingReport> overfitting(@Valid @RequestBody OverfittingRequest request) {
        return ResponseEntity.ok(metricsService.detectOverfitting(request.getTrainMetrics(), request.getTestMetrics(),
                request.getThreshold()));
    }

    @PostMapping("/feature-importance")
    public ResponseEntity<FeatureImportanceReport> featureImportance(@Valid @RequestBody FeatureImportanceRequest request) {
        return ResponseEntity.ok(metricsService.featureImportance(request.getImportances(), request.getTopN()));
    }
}
