package com.tony.sportsFeatures.model.dto;

import com.tony.sportsFeatures.model.StratifiedSplit;
import lombok.Value;

import java.util.List;
import java.util.Map;

@Value
public class StratifiedSplitResponse {
    int trainSize;
    int testSize;
    Map<String, Integer> trainClassCounts;
    Map<String, Integer> testClassCounts;
    List<Map<String, Object>> train;
    List<Map<String, Object>> test;

    public static StratifiedSplitResponse of(StratifiedSplit split) {
        return new StratifiedSplitResponse(split.getTrainSize(), split.getTestSize(),
                split.getTrainClassCounts(), split.getTestClassCounts(),
                FoldResponse.rows(split.getTrain()), FoldResponse.rows(split.getTest()));
    }
}
