package com.tony.sportsFeatures.service;

import com.tony.sportsFeatures.config.FeatureProperties;
import com.tony.sportsFeatures.model.GameRecord;
import com.tony.sportsFeatures.model.GroupedSeries;
import com.tony.sportsFeatures.model.RowTable;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.temporal.ChronoUnit;
import java.util.List;

@Service
@RequiredArgsConstructor
@Slf4j
public class RestDaysCalculator {

    public static final String REST_DAYS = "rest_days";
    public static final String IS_BACK_TO_BACK = "is_back_to_back";

    private final TemporalGrouper grouper;
    private final FeatureProperties properties;

    public RowTable restDays(RowTable table, String dateColumn, String groupColumn) {
        return restDays(table, dateColumn, groupColumn, properties.getDefaultRestDays());
    }

    /**
     * Jours de repos depuis le match précédent de la même équipe (jours calendaires entiers).
     * Premier match du groupe : {@code defaultRestDays}. Back-to-back si repos <= 1 jour.
     * Les lignes à date illisible sont exclues et ne reçoivent aucune colonne.
     */
    public RowTable restDays(RowTable table, String dateColumn, String groupColumn, int defaultRestDays) {
        table.requireColumn(dateColumn, "jours de repos");
        log.info("😴 Calcul des jours de repos entre les matchs");

        RowTable result = table.copy();
        GroupedSeries series = grouper.group(result, groupColumn, dateColumn, null);

        for (List<GameRecord> rows : series.values()) {
            for (int i = 0; i < rows.size(); i++) {
                GameRecord row = rows.get(i);
                int rest = i == 0
                        ? defaultRestDays
                        : (int) ChronoUnit.DAYS.between(rows.get(i - 1).getTimestamp().toLocalDate(), row.getTimestamp().toLocalDate());

                row.putFeature(REST_DAYS, rest);
                row.putFeature(IS_BACK_TO_BACK, rest <= 1 ? 1 : 0);
            }
        }

        if (!series.getExcluded().isEmpty()) {
            log.warn("{} ligne(s) sans date exploitable ignorée(s) pour le repos", series.getExcluded().size());
        }
        return result;
    }
}
