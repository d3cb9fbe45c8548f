package com.tony.sportsFeatures.service;

import com.tony.sportsFeatures.model.GameRecord;
import com.tony.sportsFeatures.model.GroupedSeries;
import com.tony.sportsFeatures.model.RowTable;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Moyenne mobile exponentielle : les matchs récents pèsent plus lourd.
 * e[0] = x[0] ; e[i] = alpha * x[i] + (1 - alpha) * e[i-1]. La récursion repart de zéro pour chaque équipe.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class EwmaCalculator {

    private final TemporalGrouper grouper;

    public static String ewmaColumn(String column) {
        return column + "_ewma";
    }

    public static double alphaFromSpan(double span) {
        if (span < 1.0) {
            throw new IllegalArgumentException("Le span doit être >= 1 : " + span);
        }
        return 2.0 / (span + 1.0);
    }

    public RowTable ewmaSpan(RowTable table, String column, double span, String groupColumn) {
        return ewma(table, column, alphaFromSpan(span), groupColumn);
    }

    public RowTable ewma(RowTable table, String column, double alpha, String groupColumn) {
        if (!(alpha > 0.0 && alpha <= 1.0)) {
            throw new IllegalArgumentException("Alpha doit être dans ]0, 1] : " + alpha);
        }
        table.requireColumn(column, "EWMA");
        log.info("〰️ Calcul EWMA de {} (alpha={})", column, String.format("%.4f", alpha));

        RowTable result = table.copy();
        GroupedSeries series = grouper.group(result, groupColumn);
        String output = ewmaColumn(column);

        for (List<GameRecord> rows : series.values()) {
            Double previous = null;
            for (GameRecord row : rows) {
                Double value = row.getDouble(column);
                // Valeur manquante : on reporte la dernière moyenne connue
                if (value != null) {
                    previous = previous == null ? value : alpha * value + (1.0 - alpha) * previous;
                }
                row.putFeature(output, previous);
            }
        }
        return result;
    }
}
