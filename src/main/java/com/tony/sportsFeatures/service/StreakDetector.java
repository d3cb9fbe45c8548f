package com.tony.sportsFeatures.service;

import com.tony.sportsFeatures.model.GameRecord;
import com.tony.sportsFeatures.model.GroupedSeries;
import com.tony.sportsFeatures.model.Outcome;
import com.tony.sportsFeatures.model.RowTable;
import com.tony.sportsFeatures.util.FeatureMath;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;

@Service
@RequiredArgsConstructor
@Slf4j
public class StreakDetector {

    public static final String STREAK_TYPE = "streak_type";
    public static final String STREAK_LENGTH = "streak_length";
    public static final String IS_WIN_STREAK = "is_win_streak";
    public static final String IS_LOSS_STREAK = "is_loss_streak";
    public static final String WIN_STREAK = "win_streak";
    public static final String LOSS_STREAK = "loss_streak";
    public static final String MOMENTUM_SCORE = "momentum_score";

    private final TemporalGrouper grouper;

    /**
     * Série en cours à la fin de chaque match (match courant inclus).
     * streak_type : +1 victoires, -1 défaites, 0 si le résultat n'est ni l'un ni l'autre (nul, vide).
     * La longueur repart à 1 dès que le résultat change, et à chaque début de groupe.
     */
    public RowTable streaks(RowTable table, String resultColumn, String groupColumn) {
        table.requireColumn(resultColumn, "séries");
        log.info("🔥 Calcul des séries de victoires/défaites ({})", resultColumn);

        RowTable result = table.copy();
        GroupedSeries series = grouper.group(result, groupColumn);

        for (List<GameRecord> rows : series.values()) {
            int type = 0;
            int length = 0;

            for (GameRecord row : rows) {
                Outcome outcome = Outcome.parse(row.get(resultColumn));
                if (outcome == Outcome.OTHER) {
                    type = 0;
                    length = 0;
                } else {
                    int current = outcome == Outcome.WIN ? 1 : -1;
                    if (current == type) {
                        length++;
                    } else {
                        type = current;
                        length = 1;
                    }
                }

                row.putFeature(STREAK_TYPE, type);
                row.putFeature(STREAK_LENGTH, length);
                row.putFeature(IS_WIN_STREAK, type == 1 ? 1 : 0);
                row.putFeature(IS_LOSS_STREAK, type == -1 ? 1 : 0);
                row.putFeature(WIN_STREAK, type == 1 ? length : 0);
                row.putFeature(LOSS_STREAK, type == -1 ? length : 0);
            }
        }
        return result;
    }

    /**
     * Momentum : part de victoires sur les {@code window} derniers matchs (match courant inclus).
     */
    public RowTable momentum(RowTable table, String groupColumn, String resultColumn, int window) {
        if (window <= 0) {
            throw new IllegalArgumentException("La fenêtre de momentum doit être positive : " + window);
        }
        table.requireColumn(resultColumn, "momentum");
        log.info("🚀 Calcul du momentum (derniers {} matchs)", window);

        RowTable result = table.copy();
        GroupedSeries series = grouper.group(result, groupColumn);

        for (List<GameRecord> rows : series.values()) {
            for (int i = 0; i < rows.size(); i++) {
                int from = Math.max(0, i - window + 1);
                int wins = 0;
                for (int j = from; j <= i; j++) {
                    if (Outcome.parse(rows.get(j).get(resultColumn)) == Outcome.WIN) wins++;
                }
                double momentum = (double) wins / (i - from + 1);
                rows.get(i).putFeature(MOMENTUM_SCORE, FeatureMath.round(momentum, 3));
            }
        }
        return result;
    }
}
