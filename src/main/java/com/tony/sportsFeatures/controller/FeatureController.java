package com.tony.sportsFeatures.controller;

import com.tony.sportsFeatures.config.FeatureProperties;
import com.tony.sportsFeatures.model.RollingStatistic;
import com.tony.sportsFeatures.model.RowTable;
import com.tony.sportsFeatures.model.dto.FeatureRequest;
import com.tony.sportsFeatures.model.dto.FeatureResponse;
import com.tony.sportsFeatures.model.dto.FoldResponse;
import com.tony.sportsFeatures.model.dto.StratifiedSplitResponse;
import com.tony.sportsFeatures.pipeline.PipelineResult;
import com.tony.sportsFeatures.service.EwmaCalculator;
import com.tony.sportsFeatures.service.FeaturePipelineService;
import com.tony.sportsFeatures.service.LagFeatureGenerator;
import com.tony.sportsFeatures.service.RestDaysCalculator;
import com.tony.sportsFeatures.service.StreakDetector;
import com.tony.sportsFeatures.service.WindowedAggregator;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/v1/features")
@RequiredArgsConstructor
public class FeatureController {
    private final FeaturePipelineService pipelineService;
    private final WindowedAggregator windowedAggregator;
    private final EwmaCalculator ewmaCalculator;
    private final LagFeatureGenerator lagGenerator;
    private final StreakDetector streakDetector;
    private final RestDaysCalculator restDaysCalculator;
    private final FeatureProperties properties;

    @PostMapping("/pipeline")
    public ResponseEntity<FeatureResponse> runPipeline(@Valid @RequestBody FeatureRequest request) {
        PipelineResult result = pipelineService.runStandardPipeline(RowTable.fromMaps(request.getRows()));
        RowTable table = result.getTable();

        return ResponseEntity.ok(FeatureResponse.builder()
                .rowCount(table.size())
                .columns(table.getColumns())
                .rows(table.toMaps())
                .steps(result.getSteps())
                .folds(result.getFolds().stream().map(FoldResponse::of).toList())
                .split(result.getStratifiedSplit() != null ? StratifiedSplitResponse.of(result.getStratifiedSplit()) : null)
                .build());
    }

    @PostMapping("/rolling")
    public ResponseEntity<FeatureResponse> rolling(@Valid @RequestBody FeatureRequest request) {
        RowTable table = windowedAggregator.rolling(RowTable.fromMaps(request.getRows()), request.getColumn(),
                request.getWindow(), RollingStatistic.fromKey(request.getStatistic()), request.getGroupColumn());
        return ResponseEntity.ok(FeatureResponse.of(table));
    }

    @PostMapping("/ewma")
    public ResponseEntity<FeatureResponse> ewma(@Valid @RequestBody FeatureRequest request) {
        // Alpha explicite > span explicite > configuration
        double alpha = request.getAlpha() != null ? request.getAlpha()
                : request.getSpan() != null ? EwmaCalculator.alphaFromSpan(request.getSpan())
                : properties.effectiveEwmaAlpha();
        RowTable table = ewmaCalculator.ewma(RowTable.fromMaps(request.getRows()), request.getColumn(), alpha,
                request.getGroupColumn());
        return ResponseEntity.ok(FeatureResponse.of(table));
    }

    @PostMapping("/lag")
    public ResponseEntity<FeatureResponse> lag(@Valid @RequestBody FeatureRequest request) {
        RowTable table = lagGenerator.lag(RowTable.fromMaps(request.getRows()), request.getColumn(),
                request.getPeriods(), request.getGroupColumn());
        return ResponseEntity.ok(FeatureResponse.of(table));
    }

    @PostMapping("/streaks")
    public ResponseEntity<FeatureResponse> streaks(@Valid @RequestBody FeatureRequest request) {
        String resultColumn = request.getResultColumn() != null ? request.getResultColumn() : properties.getColumns().getResult();
        RowTable table = streakDetector.streaks(RowTable.fromMaps(request.getRows()), resultColumn, request.getGroupColumn());
        table = streakDetector.momentum(table, request.getGroupColumn(), resultColumn, request.getWindow());
        return ResponseEntity.ok(FeatureResponse.of(table));
    }

    @PostMapping("/rest-days")
    public ResponseEntity<FeatureResponse> restDays(@Valid @RequestBody FeatureRequest request) {
        String dateColumn = request.getDateColumn() != null ? request.getDateColumn() : properties.getDateColumn();
        int defaultRest = request.getDefaultRestDays() != null ? request.getDefaultRestDays() : properties.getDefaultRestDays();
        RowTable table = restDaysCalculator.restDays(RowTable.fromMaps(request.getRows()), dateColumn,
                request.getGroupColumn(), defaultRest);
        return ResponseEntity.ok(FeatureResponse.of(table));
    }
}
