package com.tony.sportsFeatures.service;

import com.tony.sportsFeatures.exception.InsufficientDataException;
import com.tony.sportsFeatures.model.Fold;
import com.tony.sportsFeatures.model.GameRecord;
import com.tony.sportsFeatures.model.GroupedSeries;
import com.tony.sportsFeatures.model.RowTable;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Validation croisée à fenêtre croissante : le train est toujours un préfixe chronologique,
 * le test le bloc qui le suit immédiatement.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class TimeSeriesSplitter {

    private final TemporalGrouper grouper;

    public List<Fold> split(RowTable table, String timestampColumn, int nSplits, double testFraction) {
        if (nSplits < 1) {
            throw new IllegalArgumentException("Le nombre de plis doit être >= 1 : " + nSplits);
        }
        if (!(testFraction > 0.0 && testFraction < 1.0)) {
            throw new IllegalArgumentException("La fraction de test doit être dans ]0,1[ : " + testFraction);
        }
        table.requireColumn(timestampColumn, "découpage temporel");
        log.info("📅 Découpage temporel : {} plis, test {}%", nSplits, Math.round(testFraction * 100));

        RowTable copy = table.copy();
        GroupedSeries series = grouper.group(copy, null, timestampColumn, null);
        List<GameRecord> timeline = series.group(TemporalGrouper.WHOLE_TABLE);
        if (!series.getExcluded().isEmpty()) {
            log.warn("{} ligne(s) à date illisible écartée(s) du découpage", series.getExcluded().size());
        }

        int total = timeline.size();
        int testSize = (int) Math.floor(total * testFraction);
        if (testSize == 0) {
            throw new InsufficientDataException(
                    "Pas assez de lignes pour un bloc de test non vide", (int) Math.ceil(1 / testFraction), total);
        }
        if (total < testSize * nSplits) {
            throw new InsufficientDataException(
                    "Pas assez de lignes pour " + nSplits + " plis de " + testSize, testSize * nSplits, total);
        }

        List<Fold> folds = new ArrayList<>();
        for (int i = 0; i < nSplits; i++) {
            int trainEnd = total - testSize * (nSplits - i);
            int testEnd = trainEnd + testSize;
            List<GameRecord> train = List.copyOf(timeline.subList(0, trainEnd));
            List<GameRecord> test = List.copyOf(timeline.subList(trainEnd, testEnd));

            folds.add(Fold.builder()
                    .fold(i + 1)
                    .train(train)
                    .test(test)
                    .trainSize(train.size())
                    .testSize(test.size())
                    .lastTrainTimestamp(train.isEmpty() ? null : train.get(train.size() - 1).getTimestamp())
                    .firstTestTimestamp(test.get(0).getTimestamp())
                    .build());
            log.debug("Pli {} : train={} test={}", i + 1, train.size(), test.size());
        }

        log.info("✅ {} plis construits sur {} lignes", folds.size(), total);
        return folds;
    }
}
