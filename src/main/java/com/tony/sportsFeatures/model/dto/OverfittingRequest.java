package com.tony.sportsFeatures.model.dto;

import jakarta.validation.constraints.NotNull;
import lombok.Data;

import java.util.Map;

@Data
public class OverfittingRequest {
    @NotNull
    private Map<String, Double> trainMetrics;
    @NotNull
    private Map<String, Double> testMetrics;

    private double threshold = 0.1;
}
