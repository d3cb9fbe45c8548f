package com.tony.sportsFeatures.model.dto;

import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.Positive;
import lombok.Data;

import java.util.List;

@Data
public class PredictionMetricsRequest {
    @NotEmpty
    private List<Double> predictions;
    @NotEmpty
    private List<Double> actuals;

    private double confidence = 0.95;

    // Bootstrap
    private String metric = "rmse";
    @Positive
    private int iterations = 1000;
    private long seed = 42L;

    // Calibration
    @Positive
    private int bins = 10;
}
