package com.tony.sportsFeatures.model.dto;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import lombok.Data;

import java.util.Map;

@Data
public class FeatureImportanceRequest {
    @NotNull
    private Map<String, Double> importances;

    @Positive
    private int topN = 10;
}
