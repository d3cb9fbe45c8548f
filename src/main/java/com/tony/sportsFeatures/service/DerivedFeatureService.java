package com.tony.sportsFeatures.service;

import com.tony.sportsFeatures.model.GameRecord;
import com.tony.sportsFeatures.model.GroupedSeries;
import com.tony.sportsFeatures.model.RowTable;
import com.tony.sportsFeatures.util.FeatureMath;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.math3.stat.descriptive.SummaryStatistics;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

@Service
@RequiredArgsConstructor
@Slf4j
public class DerivedFeatureService {

    public static final String WIN_PCT = "win_pct";
    public static final String TIME_WEIGHT = "time_weight";

    public enum NormalizationMethod { MIN_MAX, Z_SCORE }

    private final TemporalGrouper grouper;

    /** Effet multiplicatif de deux colonnes (ex : GF x win_pct = efficacité offensive). */
    public RowTable interaction(RowTable table, String firstColumn, String secondColumn, String outputName) {
        table.requireColumn(firstColumn, "interaction");
        table.requireColumn(secondColumn, "interaction");
        String output = outputName != null ? outputName : firstColumn + "_x_" + secondColumn;
        log.info("✖️ Création de l'interaction {} × {} -> {}", firstColumn, secondColumn, output);

        RowTable result = table.copy();
        for (GameRecord row : result) {
            double product = FeatureMath.valueOrZero(row.getDouble(firstColumn)) * FeatureMath.valueOrZero(row.getDouble(secondColumn));
            row.putFeature(output, FeatureMath.round(product, 4));
        }
        return result;
    }

    public RowTable polynomial(RowTable table, String column, int degree) {
        if (degree < 2) {
            throw new IllegalArgumentException("Le degré doit être >= 2 : " + degree);
        }
        table.requireColumn(column, "polynôme");
        log.info("Création des puissances de {} (degré {})", column, degree);

        RowTable result = table.copy();
        for (GameRecord row : result) {
            double value = FeatureMath.valueOrZero(row.getDouble(column));
            for (int d = 2; d <= degree; d++) {
                row.putFeature(column + "_pow" + d, FeatureMath.round(Math.pow(value, d), 4));
            }
        }
        return result;
    }

    /**
     * Statistique de taux (ex : buts par match). Non définie si le dénominateur est nul.
     */
    public RowTable rate(RowTable table, String numeratorColumn, String denominatorColumn, String outputName) {
        table.requireColumn(numeratorColumn, "taux");
        table.requireColumn(denominatorColumn, "taux");
        String output = outputName != null ? outputName : numeratorColumn + "_per_" + denominatorColumn;

        RowTable result = table.copy();
        for (GameRecord row : result) {
            Double numerator = row.getDouble(numeratorColumn);
            Double denominator = row.getDouble(denominatorColumn);
            Double value = numerator != null && denominator != null && denominator != 0.0 ? numerator / denominator : null;
            row.putFeature(output, FeatureMath.roundOrNull(value, 4));
        }
        return result;
    }

    /** Pourcentage de victoires ; 0 quand aucun match n'a été joué. */
    public RowTable winPct(RowTable table, String winsColumn, String gamesColumn) {
        table.requireColumn(winsColumn, "pourcentage de victoires");
        table.requireColumn(gamesColumn, "pourcentage de victoires");

        RowTable result = table.copy();
        for (GameRecord row : result) {
            double games = FeatureMath.valueOrZero(row.getDouble(gamesColumn));
            double wins = FeatureMath.valueOrZero(row.getDouble(winsColumn));
            row.putFeature(WIN_PCT, games > 0 ? FeatureMath.round(wins / games, 4) : 0.0);
        }
        return result;
    }

    /**
     * Poids de décroissance temporelle : exp(-decay * jours avant la date la plus récente).
     */
    public RowTable timeDecayWeights(RowTable table, String dateColumn, double decayRate) {
        table.requireColumn(dateColumn, "décroissance temporelle");
        log.info("⏳ Application des poids de décroissance temporelle (decay={})", decayRate);

        RowTable result = table.copy();
        List<GameRecord> timeline = grouper.group(result, null, dateColumn, null).group(TemporalGrouper.WHOLE_TABLE);
        if (timeline.isEmpty()) return result;

        LocalDateTime latest = timeline.get(timeline.size() - 1).getTimestamp();
        for (GameRecord row : timeline) {
            long daysAgo = ChronoUnit.DAYS.between(row.getTimestamp().toLocalDate(), latest.toLocalDate());
            row.putFeature(TIME_WEIGHT, FeatureMath.round(Math.exp(-decayRate * daysAgo), 4));
        }
        return result;
    }

    /**
     * Classement d'une colonne (1 = meilleur). Les ex-aequo partagent le meilleur rang.
     */
    public RowTable rank(RowTable table, String column, String groupColumn, boolean ascending) {
        table.requireColumn(column, "classement");
        String output = column + "_rank";

        RowTable result = table.copy();
        GroupedSeries series = grouper.group(result, groupColumn, null, null);

        Comparator<GameRecord> byValue = Comparator.comparingDouble(r -> r.getDouble(column));
        if (!ascending) byValue = byValue.reversed();

        for (List<GameRecord> rows : series.values()) {
            List<GameRecord> ranked = new ArrayList<>();
            for (GameRecord row : rows) {
                if (row.getDouble(column) != null) ranked.add(row);
                else row.putFeature(output, null);
            }
            ranked.sort(byValue);

            for (int i = 0; i < ranked.size(); i++) {
                boolean tie = i > 0 && ranked.get(i).getDouble(column).equals(ranked.get(i - 1).getDouble(column));
                int rank = tie ? ((Number) ranked.get(i - 1).get(output)).intValue() : i + 1;
                ranked.get(i).putFeature(output, rank);
            }
        }
        return result;
    }

    /**
     * Normalisation d'une colonne numérique. Seule opération autorisée à réécrire une colonne source.
     * Colonne constante : 0 partout.
     */
    public RowTable normalize(RowTable table, String column, NormalizationMethod method) {
        table.requireColumn(column, "normalisation");
        log.info("Normalisation de {} ({})", column, method);

        RowTable result = table.copy();
        SummaryStatistics stats = new SummaryStatistics();
        for (GameRecord row : result) {
            Double value = row.getDouble(column);
            if (value != null) stats.addValue(value);
        }
        if (stats.getN() == 0) return result;

        double min = stats.getMin();
        double range = stats.getMax() - min;
        double mean = stats.getMean();
        double stdDev = Math.sqrt(stats.getPopulationVariance());

        for (GameRecord row : result) {
            Double value = row.getDouble(column);
            if (value == null) continue;
            double normalized = switch (method) {
                case MIN_MAX -> range == 0.0 ? 0.0 : (value - min) / range;
                case Z_SCORE -> stdDev == 0.0 ? 0.0 : (value - mean) / stdDev;
            };
            row.normalizeValue(column, FeatureMath.round(normalized, 4));
        }
        return result;
    }
}
