package com.tony.sportsFeatures.model;

import lombok.Builder;
import lombok.Value;

import java.time.LocalDateTime;
import java.util.List;

/**
 * Un pli de validation chronologique : tout le train précède (ou égale) tout le test.
 */
@Value
@Builder
public class Fold {
    int fold; // Numéro 1-based
    List<GameRecord> train;
    List<GameRecord> test;
    int trainSize;
    int testSize;
    LocalDateTime lastTrainTimestamp;
    LocalDateTime firstTestTimestamp;

    public boolean isTrainEmpty() {
        return trainSize == 0;
    }

    public boolean isChronological() {
        return lastTrainTimestamp == null || firstTestTimestamp == null
                || !lastTrainTimestamp.isAfter(firstTestTimestamp);
    }
}
