package com.tony.sportsFeatures.service;

import com.tony.sportsFeatures.config.FeatureProperties;
import com.tony.sportsFeatures.model.AggregateMode;
import com.tony.sportsFeatures.model.RowTable;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static com.tony.sportsFeatures.GameLogFixtures.column;
import static com.tony.sportsFeatures.GameLogFixtures.grouper;
import static com.tony.sportsFeatures.GameLogFixtures.row;
import static com.tony.sportsFeatures.GameLogFixtures.table;
import static org.assertj.core.api.Assertions.assertThat;

class StrengthMetricsServiceTest {

    private StrengthMetricsService service;

    @BeforeEach
    void setUp() {
        service = new StrengthMetricsService(grouper(), new FeatureProperties());
    }

    @Test
    @DisplayName("Aucun match joué : taux de victoire neutre, jamais de division par zéro")
    void winRateShouldBeNeutralWithoutGames() {
        assertThat(StrengthMetricsService.winRate(0, 0)).isEqualTo(0.5);
        assertThat(StrengthMetricsService.winRate(3, 4)).isEqualTo(0.75);
    }

    @Test
    void pythagoreanShouldComputeExpectedWinsAndLuck() {
        RowTable result = service.pythagorean(table(
                row("GF", 3, "GA", 1, "GP", 10, "W", 8),
                row("GF", 0, "GA", 4, "GP", 10, "W", 0)), "GF", "GA", "GP", "W");

        assertThat(result.get(0).get(StrengthMetricsService.PYTHAGOREAN_WIN_PCT)).isEqualTo(0.9);
        assertThat(result.get(0).get(StrengthMetricsService.PYTHAGOREAN_WINS)).isEqualTo(9.0);
        assertThat(result.get(0).get(StrengthMetricsService.LUCK_FACTOR)).isEqualTo(-1.0);
        // GF nul : espérance non définie
        assertThat(result.get(1).containsColumn(StrengthMetricsService.PYTHAGOREAN_WIN_PCT)).isFalse();
    }

    @Test
    void teamStrengthIndexShouldHandleZeroGames() {
        RowTable result = service.teamStrengthIndex(table(
                row("W", 6, "L", 2, "DIFF", 10),
                row("W", 0, "L", 0, "DIFF", 0)), "W", "L", "DIFF");

        assertThat(column(result, StrengthMetricsService.TEAM_STRENGTH_INDEX)).containsExactly(42.5, 25.0);
    }

    @Test
    void enhancedStrengthIndexShouldWeightComponents() {
        RowTable result = service.enhancedStrengthIndex(table(
                row("W", 10, "L", 0, "GP", 10, "GF", 50, "GA", 0),
                row("W", 0, "L", 0, "GP", 0, "GF", 0, "GA", 0)), "W", "L", "GP", "GF", "GA");

        // Pythagore non défini (GA = 0) : composante neutre
        assertThat(result.get(0).get(StrengthMetricsService.ENHANCED_STRENGTH_INDEX)).isEqualTo(85.0);
        assertThat(result.get(1).get(StrengthMetricsService.ENHANCED_STRENGTH_INDEX)).isEqualTo(50.0);
    }

    @Test
    @DisplayName("Régularité : CV non défini quand la moyenne est nulle")
    void consistencyShouldLeaveCvUnsetForZeroMean() {
        RowTable result = service.consistency(table(
                row("Team", "A", "PTS", 10),
                row("Team", "A", "PTS", 20),
                row("Team", "A", "PTS", 30),
                row("Team", "B", "PTS", 0),
                row("Team", "B", "PTS", 0)), "Team", "PTS");

        assertThat(result.get(0).get(StrengthMetricsService.SCORE_STD_DEV)).isEqualTo(8.165);
        assertThat(result.get(0).get(StrengthMetricsService.SCORE_CV)).isEqualTo(0.408);
        assertThat(result.get(0).get(StrengthMetricsService.CONSISTENCY_SCORE)).isEqualTo(0.592);
        assertThat(result.get(3).get(StrengthMetricsService.SCORE_STD_DEV)).isEqualTo(0.0);
        assertThat(result.get(3).containsColumn(StrengthMetricsService.SCORE_CV)).isFalse();
    }

    @Test
    void clutchFactorShouldOnlyCountCloseGames() {
        RowTable result = service.clutchFactor(table(
                row("Team", "A", "DIFF", 1, "result", "W"),
                row("Team", "A", "DIFF", -1, "result", "L"),
                row("Team", "A", "DIFF", 0, "result", "W"),
                row("Team", "A", "DIFF", 5, "result", "L"),
                row("Team", "B", "DIFF", 4, "result", "W")), "Team", "DIFF", "result");

        assertThat(column(result, StrengthMetricsService.CLUTCH_FACTOR)).containsExactly(0.667, 0.667, 0.667, 0.667, 0.5);
    }

    @Test
    void strengthOfScheduleShouldAverageOpponentWins() {
        RowTable result = service.strengthOfSchedule(table(
                row("Team", "A", "opp_W", 10),
                row("Team", "A", "opp_W", 20),
                row("Team", "B", "opp_W", null)), "Team", "opp_W");

        assertThat(column(result, StrengthMetricsService.STRENGTH_OF_SCHEDULE)).containsExactly(15.0, 15.0, 0.5);
    }

    @Test
    void homeAwaySplitsShouldSeparateVenues() {
        RowTable result = service.homeAwaySplits(table(
                row("Team", "A", "loc", "HOME", "win", 1),
                row("Team", "A", "loc", "HOME", "win", 0),
                row("Team", "A", "loc", "away", "win", 1)), "Team", "loc", "win");

        assertThat(result.get(0).get(StrengthMetricsService.HOME_WIN_RATE)).isEqualTo(0.5);
        assertThat(result.get(0).get(StrengthMetricsService.AWAY_WIN_RATE)).isEqualTo(1.0);
        assertThat(result.get(0).get(StrengthMetricsService.HOME_AWAY_DIFF)).isEqualTo(-0.5);
    }

    @Test
    @DisplayName("Confrontations directes : dénominateur sur la paire non orientée")
    void headToHeadShouldUseUnorderedPairGames() {
        RowTable result = service.headToHead(h2hTable(), "Team", "Opp", "result");

        assertThat(column(result, StrengthMetricsService.H2H_WIN_RATE)).containsExactly(0.333, 0.333, 0.333, 1.0);
    }

    @Test
    @DisplayName("PRIOR n'utilise que les matchs strictement antérieurs, AS_OF inclut le match courant")
    void headToHeadPriorAndAsOfShouldNotLookAhead() {
        RowTable prior = service.headToHead(h2hTable(), "Team", "Opp", "result", AggregateMode.PRIOR);
        RowTable asOf = service.headToHead(h2hTable(), "Team", "Opp", "result", AggregateMode.AS_OF);

        assertThat(column(prior, StrengthMetricsService.H2H_WIN_RATE)).containsExactly(0.5, 1.0, 0.0, 0.5);
        assertThat(column(asOf, StrengthMetricsService.H2H_WIN_RATE)).containsExactly(1.0, 0.5, 0.333, 1.0);
    }

    @Test
    @DisplayName("Mode PRIOR : les matchs du même jour ne se voient pas")
    void priorModeShouldTreatSameDayAsOneBlock() {
        RowTable result = service.strengthOfSchedule(table(
                row("Team", "A", "date", "2024-01-01", "opp_W", 10),
                row("Team", "A", "date", "2024-01-01", "opp_W", 30),
                row("Team", "A", "date", "2024-01-02", "opp_W", 50)), "Team", "opp_W", AggregateMode.PRIOR);

        assertThat(column(result, StrengthMetricsService.STRENGTH_OF_SCHEDULE)).containsExactly(0.5, 0.5, 20.0);
    }

    @Test
    void conferenceAdjustmentShouldScaleByConferenceAverage() {
        RowTable result = service.conferenceAdjustment(table(
                row("conf", "East", "div", "Atl", "win_pct", 0.6),
                row("conf", "East", "div", "Met", "win_pct", 0.4),
                row("conf", "West", "div", "Pac", "win_pct", 0.0)), "conf", "div", "win_pct");

        assertThat(result.get(0).get(StrengthMetricsService.CONFERENCE_STRENGTH)).isEqualTo(0.5);
        assertThat(result.get(0).get(StrengthMetricsService.DIVISION_STRENGTH)).isEqualTo(0.6);
        assertThat(result.get(0).get(StrengthMetricsService.ADJUSTED_WIN_PCT)).isEqualTo(0.6);
        assertThat(result.get(2).containsColumn(StrengthMetricsService.ADJUSTED_WIN_PCT)).isFalse();
    }

    @Test
    @DisplayName("Matchs serrés : PRIOR exclut le match courant, AS_OF l'inclut")
    void clutchFactorModesShouldNotLookAhead() {
        RowTable input = table(
                row("Team", "A", "date", "2024-01-01", "DIFF", 1, "result", "W"),
                row("Team", "A", "date", "2024-01-02", "DIFF", -1, "result", "L"),
                row("Team", "A", "date", "2024-01-03", "DIFF", 0, "result", "W"),
                row("Team", "A", "date", "2024-01-04", "DIFF", 5, "result", "L"));

        RowTable prior = service.clutchFactor(input, "Team", "DIFF", "result", AggregateMode.PRIOR);
        RowTable asOf = service.clutchFactor(input, "Team", "DIFF", "result", AggregateMode.AS_OF);

        assertThat(column(prior, StrengthMetricsService.CLUTCH_FACTOR)).containsExactly(0.5, 1.0, 0.5, 0.667);
        assertThat(column(asOf, StrengthMetricsService.CLUTCH_FACTOR)).containsExactly(1.0, 0.5, 0.667, 0.667);
    }

    @Test
    @DisplayName("Régularité en PRIOR / AS_OF : seul l'historique disponible à la date du match compte")
    void consistencyModesShouldNotLookAhead() {
        RowTable input = table(
                row("Team", "A", "date", "2024-01-03", "PTS", 30),
                row("Team", "A", "date", "2024-01-01", "PTS", 10),
                row("Team", "A", "date", "2024-01-02", "PTS", 20));

        RowTable prior = service.consistency(input, "Team", "PTS", AggregateMode.PRIOR);
        RowTable asOf = service.consistency(input, "Team", "PTS", AggregateMode.AS_OF);

        // Premier match : aucun historique
        assertThat(prior.get(1).containsColumn(StrengthMetricsService.SCORE_STD_DEV)).isFalse();
        assertThat(prior.get(2).get(StrengthMetricsService.SCORE_STD_DEV)).isEqualTo(0.0);
        assertThat(prior.get(2).get(StrengthMetricsService.CONSISTENCY_SCORE)).isEqualTo(1.0);
        assertThat(prior.get(0).get(StrengthMetricsService.SCORE_STD_DEV)).isEqualTo(5.0);
        assertThat(prior.get(0).get(StrengthMetricsService.CONSISTENCY_SCORE)).isEqualTo(0.667);

        assertThat(asOf.get(1).get(StrengthMetricsService.SCORE_STD_DEV)).isEqualTo(0.0);
        assertThat(asOf.get(2).get(StrengthMetricsService.SCORE_CV)).isEqualTo(0.333);
        assertThat(asOf.get(0).get(StrengthMetricsService.SCORE_STD_DEV)).isEqualTo(8.165);
    }

    @Test
    @DisplayName("Conférences en PRIOR : les matchs du même jour et les suivants sont ignorés")
    void conferenceAdjustmentModesShouldNotLookAhead() {
        RowTable input = table(
                row("date", "2024-01-01", "conf", "East", "div", "Atl", "win_pct", 0.6),
                row("date", "2024-01-02", "conf", "East", "div", "Met", "win_pct", 0.4),
                row("date", "2024-01-03", "conf", "West", "div", "Pac", "win_pct", 0.5),
                row("date", "2024-01-03", "conf", "East", "div", "Atl", "win_pct", 0.8));

        RowTable prior = service.conferenceAdjustment(input, "conf", "div", "win_pct", AggregateMode.PRIOR);
        RowTable asOf = service.conferenceAdjustment(input, "conf", "div", "win_pct", AggregateMode.AS_OF);

        assertThat(prior.get(0).containsColumn(StrengthMetricsService.CONFERENCE_STRENGTH)).isFalse();
        assertThat(prior.get(1).get(StrengthMetricsService.CONFERENCE_STRENGTH)).isEqualTo(0.6);
        assertThat(prior.get(1).containsColumn(StrengthMetricsService.DIVISION_STRENGTH)).isFalse();
        assertThat(prior.get(1).get(StrengthMetricsService.ADJUSTED_WIN_PCT)).isEqualTo(0.333);
        assertThat(prior.get(2).containsColumn(StrengthMetricsService.CONFERENCE_STRENGTH)).isFalse();
        assertThat(prior.get(3).get(StrengthMetricsService.CONFERENCE_STRENGTH)).isEqualTo(0.5);
        assertThat(prior.get(3).get(StrengthMetricsService.DIVISION_STRENGTH)).isEqualTo(0.6);
        assertThat(prior.get(3).get(StrengthMetricsService.ADJUSTED_WIN_PCT)).isEqualTo(0.8);

        assertThat(asOf.get(0).get(StrengthMetricsService.ADJUSTED_WIN_PCT)).isEqualTo(0.5);
        assertThat(asOf.get(2).get(StrengthMetricsService.CONFERENCE_STRENGTH)).isEqualTo(0.5);
        assertThat(asOf.get(3).get(StrengthMetricsService.CONFERENCE_STRENGTH)).isEqualTo(0.6);
        assertThat(asOf.get(3).get(StrengthMetricsService.DIVISION_STRENGTH)).isEqualTo(0.7);
        assertThat(asOf.get(3).get(StrengthMetricsService.ADJUSTED_WIN_PCT)).isEqualTo(0.667);
    }

    @Test
    @DisplayName("Bilans \"V-D-N\" : victoires sur total, neutre si vide ou illisible")
    void homeAwayRecordsShouldParseRecordStrings() {
        RowTable result = service.homeAwayRecords(table(
                row("HOME", "25-10-6", "AWAY", "20-15-6"),
                row("HOME", "0-0-0", "AWAY", "n/a")), "HOME", "AWAY");

        assertThat(result.get(0).get(StrengthMetricsService.HOME_WIN_RATE)).isEqualTo(0.61);
        assertThat(result.get(0).get(StrengthMetricsService.AWAY_WIN_RATE)).isEqualTo(0.488);
        assertThat(result.get(0).get(StrengthMetricsService.HOME_AWAY_DIFF)).isEqualTo(0.122);
        assertThat(result.get(1).get(StrengthMetricsService.HOME_WIN_RATE)).isEqualTo(0.5);
        assertThat(result.get(1).get(StrengthMetricsService.AWAY_WIN_RATE)).isEqualTo(0.5);
        assertThat(result.get(1).get(StrengthMetricsService.HOME_AWAY_DIFF)).isEqualTo(0.0);
    }

    private static RowTable h2hTable() {
        return table(
                row("Team", "A", "Opp", "B", "date", "2024-01-01", "result", "W"),
                row("Team", "A", "Opp", "B", "date", "2024-01-02", "result", "L"),
                row("Team", "B", "Opp", "A", "date", "2024-01-03", "result", "W"),
                row("Team", "C", "Opp", "D", "date", "2024-01-04", "result", "W"));
    }
}
