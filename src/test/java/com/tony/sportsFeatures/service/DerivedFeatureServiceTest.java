package com.tony.sportsFeatures.service;

import com.tony.sportsFeatures.model.RowTable;
import com.tony.sportsFeatures.service.DerivedFeatureService.NormalizationMethod;
import org.junit.jupiter.api.Test;

import static com.tony.sportsFeatures.GameLogFixtures.column;
import static com.tony.sportsFeatures.GameLogFixtures.grouper;
import static com.tony.sportsFeatures.GameLogFixtures.row;
import static com.tony.sportsFeatures.GameLogFixtures.table;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DerivedFeatureServiceTest {

    private final DerivedFeatureService service = new DerivedFeatureService(grouper());

    @Test
    void winPctShouldBeZeroWithoutGames() {
        RowTable result = service.winPct(table(row("W", 3, "GP", 4), row("W", 0, "GP", 0)), "W", "GP");

        assertThat(column(result, DerivedFeatureService.WIN_PCT)).containsExactly(0.75, 0.0);
    }

    @Test
    void interactionAndPolynomialShouldUseNamingConvention() {
        RowTable input = table(row("GF", 2.5, "win_pct", 0.5));

        RowTable interaction = service.interaction(input, "GF", "win_pct", null);
        RowTable polynomial = service.polynomial(input, "GF", 3);

        assertThat(interaction.get(0).get("GF_x_win_pct")).isEqualTo(1.25);
        assertThat(polynomial.get(0).get("GF_pow2")).isEqualTo(6.25);
        assertThat(polynomial.get(0).get("GF_pow3")).isEqualTo(15.625);
        assertThatThrownBy(() -> service.polynomial(input, "GF", 1)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void rateShouldBeUnsetOnZeroDenominator() {
        RowTable result = service.rate(table(row("GF", 10, "GP", 4), row("GF", 3, "GP", 0)), "GF", "GP", null);

        assertThat(result.get(0).get("GF_per_GP")).isEqualTo(2.5);
        assertThat(result.get(1).containsColumn("GF_per_GP")).isFalse();
    }

    @Test
    void timeDecayShouldWeightLatestGameAtOne() {
        RowTable result = service.timeDecayWeights(table(
                row("date", "2024-01-11"),
                row("date", "2024-01-01")), "date", 0.1);

        assertThat(result.get(0).get(DerivedFeatureService.TIME_WEIGHT)).isEqualTo(1.0);
        assertThat(result.get(1).get(DerivedFeatureService.TIME_WEIGHT)).isEqualTo(0.3679);
    }

    @Test
    void rankShouldShareBestRankOnTies() {
        RowTable result = service.rank(table(
                row("PTS", 50), row("PTS", 70), row("PTS", 50), row("PTS", 40)), "PTS", null, false);

        assertThat(column(result, "PTS_rank")).containsExactly(2, 1, 2, 4);
    }

    @Test
    void normalizeShouldRewriteSourceColumn() {
        RowTable input = table(row("PTS", 10), row("PTS", 20), row("PTS", 30));

        assertThat(column(service.normalize(input, "PTS", NormalizationMethod.MIN_MAX), "PTS")).containsExactly(0.0, 0.5, 1.0);
        assertThat(column(service.normalize(input, "PTS", NormalizationMethod.Z_SCORE), "PTS")).containsExactly(-1.2247, 0.0, 1.2247);
        assertThat(column(input, "PTS")).containsExactly(10, 20, 30);
    }
}
