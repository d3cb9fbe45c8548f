package com.tony.sportsFeatures.service;

import com.tony.sportsFeatures.model.GameRecord;
import com.tony.sportsFeatures.model.RowTable;
import com.tony.sportsFeatures.model.StratifiedSplit;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;

/**
 * Découpage train/test qui conserve la proportion de chaque classe de la cible.
 * Déterministe pour une graine donnée.
 */
@Service
@Slf4j
public class StratifiedSplitter {

    public StratifiedSplit split(RowTable table, String targetColumn, double testFraction, long seed) {
        if (!(testFraction > 0.0 && testFraction < 1.0)) {
            throw new IllegalArgumentException("La fraction de test doit être dans ]0,1[ : " + testFraction);
        }
        table.requireColumn(targetColumn, "découpage stratifié");
        log.info("🎯 Découpage stratifié sur {} (test {}%, graine {})", targetColumn, Math.round(testFraction * 100), seed);

        RowTable copy = table.copy();
        Map<String, List<GameRecord>> byClass = new LinkedHashMap<>();
        for (GameRecord row : copy) {
            byClass.computeIfAbsent(classOf(row, targetColumn), k -> new ArrayList<>()).add(row);
        }

        Random random = new Random(seed);
        List<GameRecord> train = new ArrayList<>();
        List<GameRecord> test = new ArrayList<>();
        Map<String, Integer> trainCounts = new LinkedHashMap<>();
        Map<String, Integer> testCounts = new LinkedHashMap<>();

        byClass.forEach((label, rows) -> {
            Collections.shuffle(rows, random);
            int splitIdx = (int) Math.floor(rows.size() * (1 - testFraction));
            train.addAll(rows.subList(0, splitIdx));
            test.addAll(rows.subList(splitIdx, rows.size()));
            trainCounts.put(label, splitIdx);
            testCounts.put(label, rows.size() - splitIdx);
        });

        log.info("✅ Découpage stratifié : train={} test={} ({} classe(s))", train.size(), test.size(), byClass.size());
        return StratifiedSplit.builder()
                .train(List.copyOf(train))
                .test(List.copyOf(test))
                .trainClassCounts(Collections.unmodifiableMap(trainCounts))
                .testClassCounts(Collections.unmodifiableMap(testCounts))
                .build();
    }

    /**
     * Libellé de classe. Les cibles numériques sont canonisées : 1, 1.0 et "1.0" tombent dans la classe "1".
     */
    static String classOf(GameRecord row, String targetColumn) {
        Object value = row.get(targetColumn);
        if (value == null) return "null";
        Double numeric = value instanceof Boolean ? null : row.getDouble(targetColumn);
        if (numeric != null) {
            return BigDecimal.valueOf(numeric).stripTrailingZeros().toPlainString();
        }
        return String.valueOf(value).trim();
    }
}
