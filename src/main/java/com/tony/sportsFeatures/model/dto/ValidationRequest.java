package com.tony.sportsFeatures.model.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotNull;
import lombok.Data;

import java.util.List;
import java.util.Map;

@Data
public class ValidationRequest {
    @NotNull
    private List<Map<String, Object>> rows;

    private String timestampColumn = "date";
    private String targetColumn;

    @JsonProperty("nSplits")
    private int nSplits = 5;
    private double testFraction = 0.2;
    private long seed = 42L;
}
