package com.tony.sportsFeatures.service;

import com.tony.sportsFeatures.model.GameRecord;
import com.tony.sportsFeatures.model.GroupedSeries;
import com.tony.sportsFeatures.model.RowTable;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Collection;
import java.util.List;

@Service
@RequiredArgsConstructor
@Slf4j
public class LagFeatureGenerator {

    private final TemporalGrouper grouper;

    public static String lagColumn(String column, int period) {
        return column + "_lag" + period;
    }

    public static String diffColumn(String column) {
        return column + "_diff1";
    }

    /**
     * Valeur de la colonne k matchs plus tôt, dans la même équipe uniquement.
     * Non définie quand i - k < 0.
     */
    public RowTable lag(RowTable table, String column, Collection<Integer> periods, String groupColumn) {
        if (periods == null || periods.isEmpty()) {
            throw new IllegalArgumentException("Au moins une période de décalage est requise");
        }
        for (Integer period : periods) {
            if (period == null || period <= 0) {
                throw new IllegalArgumentException("Les périodes de décalage doivent être positives : " + periods);
            }
        }
        table.requireColumn(column, "décalage");
        log.info("⏪ Création des lags de {} : {}", column, periods);

        RowTable result = table.copy();
        GroupedSeries series = grouper.group(result, groupColumn);

        for (List<GameRecord> rows : series.values()) {
            for (int i = 0; i < rows.size(); i++) {
                for (int period : periods) {
                    Object lagged = i - period >= 0 ? rows.get(i - period).get(column) : null;
                    rows.get(i).putFeature(lagColumn(column, period), lagged);
                }
            }
        }
        return result;
    }

    /**
     * Variation par rapport au match précédent de la même équipe.
     */
    public RowTable diff(RowTable table, String column, String groupColumn) {
        table.requireColumn(column, "variation");
        log.info("Δ Calcul de la variation match à match de {}", column);

        RowTable result = table.copy();
        GroupedSeries series = grouper.group(result, groupColumn);
        String output = diffColumn(column);

        for (List<GameRecord> rows : series.values()) {
            for (int i = 0; i < rows.size(); i++) {
                Double current = rows.get(i).getDouble(column);
                Double previous = i > 0 ? rows.get(i - 1).getDouble(column) : null;
                rows.get(i).putFeature(output, current != null && previous != null ? current - previous : null);
            }
        }
        return result;
    }
}
