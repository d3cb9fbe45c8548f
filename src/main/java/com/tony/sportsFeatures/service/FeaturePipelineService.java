package com.tony.sportsFeatures.service;

import com.tony.sportsFeatures.config.FeatureProperties;
import com.tony.sportsFeatures.model.RollingStatistic;
import com.tony.sportsFeatures.model.RowTable;
import com.tony.sportsFeatures.pipeline.FeaturePipeline;
import com.tony.sportsFeatures.pipeline.FeatureStep;
import com.tony.sportsFeatures.pipeline.PipelineResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Pipeline standard de préparation des données d'équipe, piloté par la configuration.
 * Les étapes optionnelles ne sont ajoutées que si leurs colonnes sources existent.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class FeaturePipelineService {

    public static final String OFFENSE_EFFICIENCY = "offense_efficiency";
    public static final String DEFENSE_EFFICIENCY = "defense_efficiency";

    private final FeatureProperties properties;
    private final DerivedFeatureService derivedFeatures;
    private final WindowedAggregator windowedAggregator;
    private final EwmaCalculator ewmaCalculator;
    private final LagFeatureGenerator lagGenerator;
    private final StreakDetector streakDetector;
    private final RestDaysCalculator restDaysCalculator;
    private final StrengthMetricsService strengthMetrics;
    private final TimeSeriesSplitter timeSeriesSplitter;
    private final StratifiedSplitter stratifiedSplitter;

    public PipelineResult runStandardPipeline(RowTable table) {
        FeaturePipeline pipeline = buildStandardPipeline(table);
        RowTable enriched = pipeline.run(table);

        PipelineResult.PipelineResultBuilder result = PipelineResult.builder()
                .table(enriched)
                .steps(pipeline.getSteps().stream().map(FeatureStep::name).toList());

        if (enriched.size() <= properties.getMinRowsForSplit()) {
            log.info("Pas de découpage : {} ligne(s) (minimum {})", enriched.size(), properties.getMinRowsForSplit());
            return result.build();
        }

        String dateColumn = properties.getDateColumn();
        String target = properties.getTargetColumn();
        if (enriched.hasColumn(dateColumn)) {
            result.folds(timeSeriesSplitter.split(enriched, dateColumn, properties.getSplits(), properties.getTestFraction()));
        } else if (target != null && enriched.hasColumn(target)) {
            result.stratifiedSplit(stratifiedSplitter.split(enriched, target, properties.getTestFraction(), properties.getRandomSeed()));
        } else {
            log.warn("⚠️ Ni colonne '{}' ni cible '{}' : aucun découpage produit", dateColumn, target);
        }
        return result.build();
    }

    public FeaturePipeline buildStandardPipeline(RowTable table) {
        FeatureProperties.Columns cols = properties.getColumns();
        String group = table.hasColumn(properties.getGroupColumn()) ? properties.getGroupColumn() : null;
        boolean ordered = table.hasColumn(properties.getDateColumn()) || table.hasColumn(properties.getSequenceColumn());
        String winPct = DerivedFeatureService.WIN_PCT;

        FeaturePipeline pipeline = new FeaturePipeline();
        if (properties.isNormalizeScores()) {
            DerivedFeatureService.NormalizationMethod method = properties.getNormalizationMethod();
            for (String column : List.of(cols.getPoints(), cols.getGoalsFor(), cols.getGoalsAgainst())) {
                if (!table.hasColumn(column)) continue;
                // Réécriture en place : aucune colonne produite
                pipeline.add(FeatureStep.of("normalize_" + column, List.of(column), List.of(),
                        t -> derivedFeatures.normalize(t, column, method)));
            }
        }

        pipeline.add(FeatureStep.of("win_pct", List.of(cols.getWins(), cols.getGamesPlayed()), List.of(winPct),
                t -> derivedFeatures.winPct(t, cols.getWins(), cols.getGamesPlayed())));

        if (ordered) {
            int window = properties.getWindowSize();
            for (String column : List.of(cols.getPoints(), cols.getGoalsFor(), cols.getGoalsAgainst())) {
                if (!table.hasColumn(column)) continue;
                pipeline.add(FeatureStep.of("rolling_" + column, List.of(column),
                        List.of(WindowedAggregator.rollingColumn(column, RollingStatistic.MEAN, window)),
                        t -> windowedAggregator.rolling(t, column, window, RollingStatistic.MEAN, group)));
            }

            double alpha = properties.effectiveEwmaAlpha();
            pipeline.add(FeatureStep.of("ewma_win_pct", List.of(winPct), List.of(EwmaCalculator.ewmaColumn(winPct)),
                    t -> ewmaCalculator.ewma(t, winPct, alpha, group)));

            if (table.hasColumn(cols.getPoints())) {
                List<Integer> periods = properties.getLagPeriods();
                List<String> produced = new ArrayList<>();
                periods.forEach(p -> produced.add(LagFeatureGenerator.lagColumn(cols.getPoints(), p)));
                pipeline.add(FeatureStep.of("lag_" + cols.getPoints(), List.of(cols.getPoints()), produced,
                        t -> lagGenerator.lag(t, cols.getPoints(), periods, group)));
            }
        }

        if (table.hasColumn(cols.getResult())) {
            pipeline.add(FeatureStep.of("streaks", List.of(cols.getResult()),
                    List.of(StreakDetector.STREAK_TYPE, StreakDetector.STREAK_LENGTH, StreakDetector.IS_WIN_STREAK,
                            StreakDetector.IS_LOSS_STREAK, StreakDetector.WIN_STREAK, StreakDetector.LOSS_STREAK),
                    t -> streakDetector.streaks(t, cols.getResult(), group)));
            pipeline.add(FeatureStep.of("momentum", List.of(cols.getResult()), List.of(StreakDetector.MOMENTUM_SCORE),
                    t -> streakDetector.momentum(t, group, cols.getResult(), properties.getWindowSize())));
        }

        if (table.hasColumn(properties.getDateColumn())) {
            pipeline.add(FeatureStep.of("rest_days", List.of(properties.getDateColumn()),
                    List.of(RestDaysCalculator.REST_DAYS, RestDaysCalculator.IS_BACK_TO_BACK),
                    t -> restDaysCalculator.restDays(t, properties.getDateColumn(), group)));
        }

        if (table.hasColumn(cols.getLosses()) && table.hasColumn(cols.getGoalDiff())) {
            pipeline.add(FeatureStep.of("team_strength_index", List.of(cols.getWins(), cols.getLosses(), cols.getGoalDiff()),
                    List.of(StrengthMetricsService.TEAM_STRENGTH_INDEX),
                    t -> strengthMetrics.teamStrengthIndex(t, cols.getWins(), cols.getLosses(), cols.getGoalDiff())));
        }

        if (table.hasColumn(cols.getGoalsFor()) && table.hasColumn(cols.getGoalsAgainst())) {
            pipeline.add(FeatureStep.of("pythagorean",
                    List.of(cols.getGoalsFor(), cols.getGoalsAgainst(), cols.getGamesPlayed(), cols.getWins()),
                    List.of(StrengthMetricsService.PYTHAGOREAN_WIN_PCT, StrengthMetricsService.PYTHAGOREAN_WINS,
                            StrengthMetricsService.LUCK_FACTOR),
                    t -> strengthMetrics.pythagorean(t, cols.getGoalsFor(), cols.getGoalsAgainst(), cols.getGamesPlayed(), cols.getWins())));
            pipeline.add(FeatureStep.of(OFFENSE_EFFICIENCY, List.of(cols.getGoalsFor(), winPct), List.of(OFFENSE_EFFICIENCY),
                    t -> derivedFeatures.interaction(t, cols.getGoalsFor(), winPct, OFFENSE_EFFICIENCY)));
            pipeline.add(FeatureStep.of(DEFENSE_EFFICIENCY, List.of(cols.getGoalsAgainst(), winPct), List.of(DEFENSE_EFFICIENCY),
                    t -> derivedFeatures.interaction(t, cols.getGoalsAgainst(), winPct, DEFENSE_EFFICIENCY)));
        }

        for (String column : List.of(cols.getGoalDiff(), cols.getPoints())) {
            if (!table.hasColumn(column)) continue;
            pipeline.add(FeatureStep.of("poly_" + column, List.of(column), List.of(column + "_pow2"),
                    t -> derivedFeatures.polynomial(t, column, 2)));
        }

        if (table.hasColumn(cols.getHomeRecord()) && table.hasColumn(cols.getAwayRecord())) {
            pipeline.add(FeatureStep.of("home_away_records", List.of(cols.getHomeRecord(), cols.getAwayRecord()),
                    List.of(StrengthMetricsService.HOME_WIN_RATE, StrengthMetricsService.AWAY_WIN_RATE,
                            StrengthMetricsService.HOME_AWAY_DIFF),
                    t -> strengthMetrics.homeAwayRecords(t, cols.getHomeRecord(), cols.getAwayRecord())));
        }

        log.debug("Pipeline standard : {}", pipeline.getSteps());
        return pipeline;
    }
}
