package com.tony.sportsFeatures.model.dto;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import lombok.Data;

import java.util.List;
import java.util.Map;

@Data
public class FeatureRequest {
    @NotNull
    private List<Map<String, Object>> rows;

    private String column;
    private String groupColumn; // null = table entière, une seule série

    // Fenêtre glissante / momentum
    @Positive
    private int window = 5;
    private String statistic = "mean";

    // EWMA : alpha prioritaire sur le span
    private Double alpha;
    private Double span;

    // Lags
    private List<Integer> periods = List.of(1, 3, 5);

    // Séries et repos
    private String resultColumn;
    private String dateColumn;
    private Integer defaultRestDays;
}
