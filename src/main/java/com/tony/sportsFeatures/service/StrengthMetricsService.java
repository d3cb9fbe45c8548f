package com.tony.sportsFeatures.service;

import com.tony.sportsFeatures.config.FeatureProperties;
import com.tony.sportsFeatures.model.AggregateMode;
import com.tony.sportsFeatures.model.GameRecord;
import com.tony.sportsFeatures.model.GroupedSeries;
import com.tony.sportsFeatures.model.Outcome;
import com.tony.sportsFeatures.model.RowTable;
import com.tony.sportsFeatures.util.FeatureMath;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.math3.stat.descriptive.SummaryStatistics;
import org.springframework.stereotype.Service;

import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.function.Consumer;

/**
 * Indicateurs de force d'équipe.
 * <p>
 * Les agrégats "saison" ({@link AggregateMode#SEASON}) utilisent toute la saison, matchs futurs compris :
 * ils ne sont PAS sans fuite. Pour des features utilisables en entraînement, demander
 * {@link AggregateMode#AS_OF} (date <= match courant) ou {@link AggregateMode#PRIOR} (strictement avant).
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class StrengthMetricsService {

    public static final String PYTHAGOREAN_WIN_PCT = "pythagorean_win_pct";
    public static final String PYTHAGOREAN_WINS = "pythagorean_wins";
    public static final String LUCK_FACTOR = "luck_factor";
    public static final String SCORE_STD_DEV = "score_std_dev";
    public static final String SCORE_CV = "score_cv";
    public static final String CONSISTENCY_SCORE = "consistency_score";
    public static final String CLUTCH_FACTOR = "clutch_factor";
    public static final String STRENGTH_OF_SCHEDULE = "strength_of_schedule";
    public static final String H2H_WIN_RATE = "h2h_win_rate";
    public static final String CONFERENCE_STRENGTH = "conference_strength";
    public static final String DIVISION_STRENGTH = "division_strength";
    public static final String ADJUSTED_WIN_PCT = "adjusted_win_pct";
    public static final String TEAM_STRENGTH_INDEX = "team_strength_index";
    public static final String ENHANCED_STRENGTH_INDEX = "enhanced_strength_index";
    public static final String HOME_WIN_RATE = "home_win_rate";
    public static final String AWAY_WIN_RATE = "away_win_rate";
    public static final String HOME_AWAY_DIFF = "home_away_diff";

    private static final double NEUTRAL_RATE = 0.5;
    private static final double CLOSE_GAME_MARGIN = 1.0;

    // Pondérations de l'indice de force enrichi
    private static final double W_WIN_RATE = 0.30;
    private static final double W_GOAL_DIFF = 0.20;
    private static final double W_PYTHAGOREAN = 0.30;
    private static final double W_GOALS_FOR = 0.10;
    private static final double W_GOALS_AGAINST = 0.10;
    private static final double MAX_GOAL_DIFF_PER_GAME = 3.0;
    private static final double MAX_GOALS_PER_GAME = 5.0;

    private final TemporalGrouper grouper;
    private final FeatureProperties properties;

    /** Taux de victoire, 0.5 (neutre) quand aucun match n'a été joué. */
    public static double winRate(double wins, double games) {
        return FeatureMath.ratioOrDefault(wins, games, NEUTRAL_RATE);
    }

    /** GF² / (GF² + GA²), ou null si GF ou GA n'est pas strictement positif. */
    public static Double pythagoreanExpectation(Double goalsFor, Double goalsAgainst) {
        if (goalsFor == null || goalsAgainst == null || goalsFor <= 0 || goalsAgainst <= 0) return null;
        double gf2 = goalsFor * goalsFor;
        double ga2 = goalsAgainst * goalsAgainst;
        return gf2 / (gf2 + ga2);
    }

    // =========================================================================================
    // Indicateurs ligne à ligne
    // =========================================================================================

    public RowTable pythagorean(RowTable table, String gfColumn, String gaColumn, String gamesColumn, String winsColumn) {
        requireAll(table, "espérance pythagoricienne", gfColumn, gaColumn, gamesColumn, winsColumn);
        log.info("📐 Calcul des victoires attendues (Pythagore)");

        RowTable result = table.copy();
        for (GameRecord row : result) {
            Double expectedPct = pythagoreanExpectation(row.getDouble(gfColumn), row.getDouble(gaColumn));
            if (expectedPct == null) {
                row.putFeature(PYTHAGOREAN_WIN_PCT, null);
                row.putFeature(PYTHAGOREAN_WINS, null);
                row.putFeature(LUCK_FACTOR, null);
                continue;
            }
            double expectedWins = expectedPct * FeatureMath.valueOrZero(row.getDouble(gamesColumn));
            double actualWins = FeatureMath.valueOrZero(row.getDouble(winsColumn));

            row.putFeature(PYTHAGOREAN_WIN_PCT, FeatureMath.round(expectedPct, 3));
            row.putFeature(PYTHAGOREAN_WINS, FeatureMath.round(expectedWins, 2));
            // Chance : victoires réelles - victoires "méritées"
            row.putFeature(LUCK_FACTOR, FeatureMath.round(actualWins - expectedWins, 2));
        }
        return result;
    }

    /**
     * Indice de force simple : taux de victoire * 50 + différence de buts * 0.5.
     */
    public RowTable teamStrengthIndex(RowTable table, String winsColumn, String lossesColumn, String diffColumn) {
        requireAll(table, "indice de force", winsColumn, lossesColumn, diffColumn);
        log.info("💪 Calcul de l'indice de force des équipes");

        RowTable result = table.copy();
        for (GameRecord row : result) {
            double wins = FeatureMath.valueOrZero(row.getDouble(winsColumn));
            double losses = FeatureMath.valueOrZero(row.getDouble(lossesColumn));
            double diff = FeatureMath.valueOrZero(row.getDouble(diffColumn));

            double strength = winRate(wins, wins + losses) * 50 + diff * 0.5;
            row.putFeature(TEAM_STRENGTH_INDEX, FeatureMath.round(strength, 2));
        }
        return result;
    }

    /**
     * Indice de force enrichi sur 0-100 :
     * victoires 30%, différence de buts par match 20%, Pythagore 30%, attaque 10%, défense 10%.
     * Chaque composante est ramenée sur [0, 1] avant pondération.
     */
    public RowTable enhancedStrengthIndex(RowTable table, String winsColumn, String lossesColumn, String gamesColumn,
                                          String gfColumn, String gaColumn) {
        requireAll(table, "indice de force enrichi", winsColumn, lossesColumn, gamesColumn, gfColumn, gaColumn);
        log.info("💪 Calcul de l'indice de force enrichi");

        RowTable result = table.copy();
        for (GameRecord row : result) {
            double wins = FeatureMath.valueOrZero(row.getDouble(winsColumn));
            double losses = FeatureMath.valueOrZero(row.getDouble(lossesColumn));
            Double gp = row.getDouble(gamesColumn);
            double games = gp != null && gp > 0 ? gp : wins + losses;
            double gf = FeatureMath.valueOrZero(row.getDouble(gfColumn));
            double ga = FeatureMath.valueOrZero(row.getDouble(gaColumn));

            double winComponent = winRate(wins, games);
            double goalDiffPerGame = games > 0 ? (gf - ga) / games : 0.0;
            double goalDiffComponent = FeatureMath.clamp01((goalDiffPerGame + MAX_GOAL_DIFF_PER_GAME) / (2 * MAX_GOAL_DIFF_PER_GAME));
            Double pythagorean = pythagoreanExpectation(gf, ga);
            double pythagoreanComponent = pythagorean != null ? pythagorean : NEUTRAL_RATE;
            double attackComponent = games > 0 ? FeatureMath.clamp01(gf / games / MAX_GOALS_PER_GAME) : 0.0;
            double defenseComponent = games > 0 ? 1.0 - FeatureMath.clamp01(ga / games / MAX_GOALS_PER_GAME) : 1.0;

            double index = 100.0 * (W_WIN_RATE * winComponent
                    + W_GOAL_DIFF * goalDiffComponent
                    + W_PYTHAGOREAN * pythagoreanComponent
                    + W_GOALS_FOR * attackComponent
                    + W_GOALS_AGAINST * defenseComponent);
            row.putFeature(ENHANCED_STRENGTH_INDEX, FeatureMath.round(index, 2));
        }
        return result;
    }

    // =========================================================================================
    // Agrégats par équipe
    // =========================================================================================

    public RowTable consistency(RowTable table, String groupColumn, String scoreColumn) {
        return consistency(table, groupColumn, scoreColumn, AggregateMode.SEASON);
    }

    /**
     * Régularité : écart-type de population du score, coefficient de variation (non défini si moyenne nulle),
     * consistency_score = 1 - CV (plus haut = plus régulier).
     */
    public RowTable consistency(RowTable table, String groupColumn, String scoreColumn, AggregateMode mode) {
        table.requireColumn(scoreColumn, "régularité");
        log.info("📊 Calcul de la régularité des équipes ({}, {})", scoreColumn, mode);

        RowTable result = table.copy();
        GroupedSeries series = seriesFor(result, groupColumn, mode);

        for (List<GameRecord> rows : series.values()) {
            SummaryStatistics scores = new SummaryStatistics();
            walk(rows, mode,
                    row -> {
                        Double score = row.getDouble(scoreColumn);
                        if (score != null) scores.addValue(score);
                    },
                    row -> {
                        if (scores.getN() == 0) {
                            row.putFeature(SCORE_STD_DEV, null);
                            row.putFeature(SCORE_CV, null);
                            row.putFeature(CONSISTENCY_SCORE, null);
                            return;
                        }
                        double mean = scores.getMean();
                        double stdDev = Math.sqrt(scores.getPopulationVariance());
                        row.putFeature(SCORE_STD_DEV, FeatureMath.round(stdDev, 3));
                        if (mean == 0.0) {
                            row.putFeature(SCORE_CV, null);
                            row.putFeature(CONSISTENCY_SCORE, null);
                        } else {
                            double cv = stdDev / mean;
                            row.putFeature(SCORE_CV, FeatureMath.round(cv, 3));
                            row.putFeature(CONSISTENCY_SCORE, FeatureMath.round(1.0 - cv, 3));
                        }
                    });
        }
        return result;
    }

    public RowTable clutchFactor(RowTable table, String groupColumn, String goalDiffColumn, String resultColumn) {
        return clutchFactor(table, groupColumn, goalDiffColumn, resultColumn, AggregateMode.SEASON);
    }

    /**
     * Taux de victoire dans les matchs serrés (|écart| <= 1). 0.5 sans match serré.
     */
    public RowTable clutchFactor(RowTable table, String groupColumn, String goalDiffColumn, String resultColumn,
                                 AggregateMode mode) {
        requireAll(table, "matchs serrés", goalDiffColumn, resultColumn);
        log.info("🎯 Calcul de la performance dans les matchs serrés ({})", mode);

        RowTable result = table.copy();
        GroupedSeries series = seriesFor(result, groupColumn, mode);

        for (List<GameRecord> rows : series.values()) {
            RateCounter closeGames = new RateCounter();
            walk(rows, mode,
                    row -> {
                        Double diff = row.getDouble(goalDiffColumn);
                        if (diff != null && Math.abs(diff) <= CLOSE_GAME_MARGIN) {
                            closeGames.record(Outcome.parse(row.get(resultColumn)) == Outcome.WIN);
                        }
                    },
                    row -> row.putFeature(CLUTCH_FACTOR, FeatureMath.round(closeGames.rate(NEUTRAL_RATE), 3)));
        }
        return result;
    }

    public RowTable strengthOfSchedule(RowTable table, String teamColumn, String opponentWinsColumn) {
        return strengthOfSchedule(table, teamColumn, opponentWinsColumn, AggregateMode.SEASON);
    }

    /**
     * Difficulté du calendrier : moyenne des victoires des adversaires rencontrés. 0.5 sans adversaire connu.
     */
    public RowTable strengthOfSchedule(RowTable table, String teamColumn, String opponentWinsColumn, AggregateMode mode) {
        requireAll(table, "difficulté du calendrier", teamColumn, opponentWinsColumn);
        log.info("🗓️ Calcul de la difficulté du calendrier ({})", mode);

        RowTable result = table.copy();
        GroupedSeries series = seriesFor(result, teamColumn, mode);

        for (List<GameRecord> rows : series.values()) {
            SummaryStatistics opponents = new SummaryStatistics();
            walk(rows, mode,
                    row -> {
                        Double opponentWins = row.getDouble(opponentWinsColumn);
                        if (opponentWins != null) opponents.addValue(opponentWins);
                    },
                    row -> {
                        double sos = opponents.getN() > 0 ? opponents.getMean() : NEUTRAL_RATE;
                        row.putFeature(STRENGTH_OF_SCHEDULE, FeatureMath.round(sos, 3));
                    });
        }
        return result;
    }

    public RowTable homeAwaySplits(RowTable table, String groupColumn, String locationColumn, String winsColumn) {
        return homeAwaySplits(table, groupColumn, locationColumn, winsColumn, AggregateMode.SEASON);
    }

    /**
     * Taux de victoire à domicile / à l'extérieur (colonne de lieu HOME / AWAY).
     */
    public RowTable homeAwaySplits(RowTable table, String groupColumn, String locationColumn, String winsColumn,
                                   AggregateMode mode) {
        requireAll(table, "domicile/extérieur", locationColumn, winsColumn);
        log.info("🏠 Calcul des performances domicile/extérieur ({})", mode);

        RowTable result = table.copy();
        GroupedSeries series = seriesFor(result, groupColumn, mode);

        for (List<GameRecord> rows : series.values()) {
            RateCounter home = new RateCounter();
            RateCounter away = new RateCounter();
            walk(rows, mode,
                    row -> {
                        String location = row.getString(locationColumn);
                        if (location == null) return;
                        boolean won = isWin(row, winsColumn);
                        switch (location.toUpperCase(Locale.ROOT)) {
                            case "HOME" -> home.record(won);
                            case "AWAY" -> away.record(won);
                            default -> log.debug("Lieu inconnu ignoré : {}", location);
                        }
                    },
                    row -> {
                        double homeRate = home.rate(NEUTRAL_RATE);
                        double awayRate = away.rate(NEUTRAL_RATE);
                        row.putFeature(HOME_WIN_RATE, FeatureMath.round(homeRate, 3));
                        row.putFeature(AWAY_WIN_RATE, FeatureMath.round(awayRate, 3));
                        row.putFeature(HOME_AWAY_DIFF, FeatureMath.round(homeRate - awayRate, 3));
                    });
        }
        return result;
    }

    /**
     * Variante ligne à ligne : bilans domicile / extérieur déjà agrégés sous forme "V-D[-N]"
     * (ex : HOME = "25-10-6"). Taux = victoires / total des matchs du bilan ; 0.5 si le bilan est vide ou illisible.
     */
    public RowTable homeAwayRecords(RowTable table, String homeRecordColumn, String awayRecordColumn) {
        requireAll(table, "bilans domicile/extérieur", homeRecordColumn, awayRecordColumn);
        log.info("🏠 Lecture des bilans {} / {}", homeRecordColumn, awayRecordColumn);

        RowTable result = table.copy();
        for (GameRecord row : result) {
            double homeRate = recordWinRate(row.getString(homeRecordColumn));
            double awayRate = recordWinRate(row.getString(awayRecordColumn));
            row.putFeature(HOME_WIN_RATE, FeatureMath.round(homeRate, 3));
            row.putFeature(AWAY_WIN_RATE, FeatureMath.round(awayRate, 3));
            row.putFeature(HOME_AWAY_DIFF, FeatureMath.round(homeRate - awayRate, 3));
        }
        return result;
    }

    // =========================================================================================
    // Agrégats inter-équipes
    // =========================================================================================

    public RowTable headToHead(RowTable table, String teamColumn, String opponentColumn, String resultColumn) {
        return headToHead(table, teamColumn, opponentColumn, resultColumn, AggregateMode.SEASON);
    }

    /**
     * Taux de victoire de A contre B : victoires de A face à B / matchs de la paire {A, B} (non orientée).
     * 0.5 quand la paire ne s'est jamais rencontrée. Utiliser {@link AggregateMode#PRIOR} pour exclure
     * le résultat du match courant.
     */
    public RowTable headToHead(RowTable table, String teamColumn, String opponentColumn, String resultColumn,
                               AggregateMode mode) {
        requireAll(table, "confrontations directes", teamColumn, opponentColumn, resultColumn);
        log.info("⚔️ Calcul des confrontations directes ({})", mode);

        RowTable result = table.copy();
        List<GameRecord> timeline = seriesFor(result, null, mode).values().stream()
                .flatMap(List::stream)
                .toList();

        Map<List<String>, Integer> pairGames = new HashMap<>();
        Map<List<String>, Integer> directedWins = new HashMap<>();

        walk(timeline, mode,
                row -> {
                    String team = row.getString(teamColumn);
                    String opponent = row.getString(opponentColumn);
                    if (team == null || opponent == null) return;
                    pairGames.merge(pairKey(team, opponent), 1, Integer::sum);
                    if (Outcome.parse(row.get(resultColumn)) == Outcome.WIN) {
                        directedWins.merge(List.of(team, opponent), 1, Integer::sum);
                    }
                },
                row -> {
                    String team = row.getString(teamColumn);
                    String opponent = row.getString(opponentColumn);
                    if (team == null || opponent == null) {
                        row.putFeature(H2H_WIN_RATE, null);
                        return;
                    }
                    int games = pairGames.getOrDefault(pairKey(team, opponent), 0);
                    int wins = directedWins.getOrDefault(List.of(team, opponent), 0);
                    row.putFeature(H2H_WIN_RATE, FeatureMath.round(FeatureMath.ratioOrDefault(wins, games, NEUTRAL_RATE), 3));
                });
        return result;
    }

    public RowTable conferenceAdjustment(RowTable table, String conferenceColumn, String divisionColumn, String winPctColumn) {
        return conferenceAdjustment(table, conferenceColumn, divisionColumn, winPctColumn, AggregateMode.SEASON);
    }

    /**
     * Force moyenne (win %) par conférence et par division, et win % ajusté :
     * win_pct / moyenne_conférence * 0.5. Non défini si la moyenne de conférence est nulle.
     */
    public RowTable conferenceAdjustment(RowTable table, String conferenceColumn, String divisionColumn,
                                         String winPctColumn, AggregateMode mode) {
        requireAll(table, "ajustement conférence/division", conferenceColumn, divisionColumn, winPctColumn);
        log.info("🏟️ Calcul des ajustements conférence/division ({})", mode);

        RowTable result = table.copy();
        List<GameRecord> timeline = seriesFor(result, null, mode).values().stream()
                .flatMap(List::stream)
                .toList();

        Map<String, SummaryStatistics> conferences = new HashMap<>();
        Map<String, SummaryStatistics> divisions = new HashMap<>();

        walk(timeline, mode,
                row -> {
                    Double winPct = row.getDouble(winPctColumn);
                    if (winPct == null) return;
                    conferences.computeIfAbsent(keyOf(row, conferenceColumn), k -> new SummaryStatistics()).addValue(winPct);
                    divisions.computeIfAbsent(keyOf(row, divisionColumn), k -> new SummaryStatistics()).addValue(winPct);
                },
                row -> {
                    Double conferenceAvg = meanOrNull(conferences.get(keyOf(row, conferenceColumn)));
                    Double divisionAvg = meanOrNull(divisions.get(keyOf(row, divisionColumn)));
                    Double winPct = row.getDouble(winPctColumn);

                    row.putFeature(CONFERENCE_STRENGTH, FeatureMath.roundOrNull(conferenceAvg, 3));
                    row.putFeature(DIVISION_STRENGTH, FeatureMath.roundOrNull(divisionAvg, 3));
                    Double adjusted = winPct != null && conferenceAvg != null && conferenceAvg != 0.0
                            ? winPct / conferenceAvg * 0.5
                            : null;
                    row.putFeature(ADJUSTED_WIN_PCT, FeatureMath.roundOrNull(adjusted, 3));
                });
        return result;
    }

    // =========================================================================================
    // Outils internes
    // =========================================================================================

    /**
     * Saison : pas besoin d'ordre (aucune date lue, aucune ligne exclue).
     * AS_OF / PRIOR : ordre chronologique obligatoire.
     */
    private GroupedSeries seriesFor(RowTable result, String groupColumn, AggregateMode mode) {
        if (mode == AggregateMode.SEASON) {
            return grouper.group(result, groupColumn, null, null);
        }
        return grouper.group(result, groupColumn, properties.getDateColumn(), properties.getSequenceColumn());
    }

    /**
     * Parcourt une série ordonnée en alternant accumulation et émission selon le mode.
     * Les lignes de même date forment un bloc : en AS_OF elles se voient mutuellement, en PRIOR jamais.
     */
    private static void walk(List<GameRecord> timeline, AggregateMode mode,
                             Consumer<GameRecord> accumulate, Consumer<GameRecord> emit) {
        if (mode == AggregateMode.SEASON) {
            timeline.forEach(accumulate);
            timeline.forEach(emit);
            return;
        }
        int start = 0;
        while (start < timeline.size()) {
            int end = start + 1;
            while (end < timeline.size() && sameInstant(timeline.get(start), timeline.get(end))) end++;
            List<GameRecord> block = timeline.subList(start, end);
            if (mode == AggregateMode.AS_OF) {
                block.forEach(accumulate);
                block.forEach(emit);
            } else {
                block.forEach(emit);
                block.forEach(accumulate);
            }
            start = end;
        }
    }

    private static boolean sameInstant(GameRecord a, GameRecord b) {
        return a.getTimestamp() != null && a.getTimestamp().equals(b.getTimestamp());
    }

    private static boolean isWin(GameRecord row, String winsColumn) {
        Double numeric = row.getDouble(winsColumn);
        if (numeric != null) return numeric > 0;
        return Outcome.parse(row.get(winsColumn)) == Outcome.WIN;
    }

    static double recordWinRate(String record) {
        if (record == null || record.isBlank()) return NEUTRAL_RATE;
        String[] parts = record.trim().split("-");
        int total = 0;
        try {
            for (String part : parts) {
                total += Integer.parseInt(part.trim());
            }
            return FeatureMath.ratioOrDefault(Integer.parseInt(parts[0].trim()), total, NEUTRAL_RATE);
        } catch (NumberFormatException e) {
            log.debug("Bilan illisible '{}' : taux neutre", record);
            return NEUTRAL_RATE;
        }
    }

    private static Double meanOrNull(SummaryStatistics stats) {
        return stats != null && stats.getN() > 0 ? stats.getMean() : null;
    }

    private static List<String> pairKey(String a, String b) {
        return a.compareTo(b) <= 0 ? List.of(a, b) : List.of(b, a);
    }

    private static String keyOf(GameRecord row, String column) {
        return Objects.toString(row.getString(column), "");
    }

    private static void requireAll(RowTable table, String context, String... columns) {
        for (String column : columns) {
            table.requireColumn(column, context);
        }
    }

    private static final class RateCounter {
        private int hits;
        private int total;

        void record(boolean hit) {
            total++;
            if (hit) hits++;
        }

        double rate(double fallback) {
            return FeatureMath.ratioOrDefault(hits, total, fallback);
        }
    }
}
