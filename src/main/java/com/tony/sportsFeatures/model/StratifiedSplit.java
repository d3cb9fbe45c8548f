package com.tony.sportsFeatures.model;

import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Map;

@Value
@Builder
public class StratifiedSplit {
    List<GameRecord> train;
    List<GameRecord> test;
    Map<String, Integer> trainClassCounts;
    Map<String, Integer> testClassCounts;

    public int getTrainSize() {
        return train.size();
    }

    public int getTestSize() {
        return test.size();
    }
}
