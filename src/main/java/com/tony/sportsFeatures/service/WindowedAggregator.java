package com.tony.sportsFeatures.service;

import com.tony.sportsFeatures.model.GameRecord;
import com.tony.sportsFeatures.model.GroupedSeries;
import com.tony.sportsFeatures.model.RollingStatistic;
import com.tony.sportsFeatures.model.RowTable;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.math3.stat.descriptive.DescriptiveStatistics;
import org.apache.commons.math3.stat.descriptive.SummaryStatistics;
import org.springframework.stereotype.Service;

import java.util.List;

@Service
@RequiredArgsConstructor
@Slf4j
public class WindowedAggregator {

    private final TemporalGrouper grouper;

    public static String rollingColumn(String column, RollingStatistic statistic, int windowSize) {
        return column + "_rolling_" + statistic.key() + "_" + windowSize;
    }

    public static String cumulativeColumn(String column, RollingStatistic statistic) {
        return column + "_cumulative_" + statistic.key();
    }

    /**
     * Statistique glissante sur les lignes [max(0, i-w+1) .. i] du groupe.
     * La fenêtre inclut toujours la ligne courante et rétrécit en début de série (jamais de données futures).
     * Les valeurs non numériques sont ignorées ; fenêtre effective vide = valeur non définie.
     *
     * @param groupColumn colonne d'entité, ou null pour traiter la table entière comme une seule série chronologique
     */
    public RowTable rolling(RowTable table, String column, int windowSize, RollingStatistic statistic, String groupColumn) {
        if (windowSize <= 0) {
            throw new IllegalArgumentException("La taille de fenêtre doit être positive : " + windowSize);
        }
        table.requireColumn(column, "statistique glissante");
        log.info("📈 Calcul {} glissante de {} (fenêtre {})", statistic.key(), column, windowSize);

        RowTable result = table.copy();
        GroupedSeries series = grouper.group(result, groupColumn);
        String output = rollingColumn(column, statistic, windowSize);

        for (List<GameRecord> rows : series.values()) {
            for (int i = 0; i < rows.size(); i++) {
                DescriptiveStatistics window = new DescriptiveStatistics();
                for (int j = Math.max(0, i - windowSize + 1); j <= i; j++) {
                    Double value = rows.get(j).getDouble(column);
                    if (value != null) window.addValue(value);
                }
                rows.get(i).putFeature(output, window.getN() == 0 ? null : statistic.compute(window));
            }
        }
        return result;
    }

    /**
     * Statistique cumulée depuis le début de la série (lignes 0..i).
     */
    public RowTable cumulative(RowTable table, String column, RollingStatistic statistic, String groupColumn) {
        table.requireColumn(column, "statistique cumulée");
        log.info("➕ Calcul {} cumulé de {}", statistic.key(), column);

        RowTable result = table.copy();
        GroupedSeries series = grouper.group(result, groupColumn);
        String output = cumulativeColumn(column, statistic);

        for (List<GameRecord> rows : series.values()) {
            SummaryStatistics running = new SummaryStatistics();
            for (GameRecord row : rows) {
                Double value = row.getDouble(column);
                if (value != null) running.addValue(value);
                row.putFeature(output, running.getN() == 0 ? null : statistic.compute(running));
            }
        }
        return result;
    }
}
