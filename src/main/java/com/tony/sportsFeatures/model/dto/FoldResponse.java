package com.tony.sportsFeatures.model.dto;

import com.tony.sportsFeatures.model.Fold;
import com.tony.sportsFeatures.model.GameRecord;
import lombok.Value;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;

@Value
public class FoldResponse {
    int fold;
    int trainSize;
    int testSize;
    LocalDateTime lastTrainTimestamp;
    LocalDateTime firstTestTimestamp;
    List<Map<String, Object>> train;
    List<Map<String, Object>> test;

    public static FoldResponse of(Fold fold) {
        return new FoldResponse(fold.getFold(), fold.getTrainSize(), fold.getTestSize(),
                fold.getLastTrainTimestamp(), fold.getFirstTestTimestamp(),
                rows(fold.getTrain()), rows(fold.getTest()));
    }

    static List<Map<String, Object>> rows(List<GameRecord> records) {
        return records.stream().map(GameRecord::asMap).toList();
    }
}
