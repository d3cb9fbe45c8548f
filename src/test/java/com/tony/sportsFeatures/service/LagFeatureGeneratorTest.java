package com.tony.sportsFeatures.service;

import com.tony.sportsFeatures.model.RowTable;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static com.tony.sportsFeatures.GameLogFixtures.column;
import static com.tony.sportsFeatures.GameLogFixtures.dailySeries;
import static com.tony.sportsFeatures.GameLogFixtures.grouper;
import static com.tony.sportsFeatures.GameLogFixtures.row;
import static com.tony.sportsFeatures.GameLogFixtures.table;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class LagFeatureGeneratorTest {

    private final LagFeatureGenerator generator = new LagFeatureGenerator(grouper());

    @Test
    @DisplayName("lag1 de [10, 20, 30, 40] = [non défini, 10, 20, 30]")
    void lagShouldShiftWithinSeries() {
        RowTable result = generator.lag(dailySeries("A", "PTS", 10, 20, 30, 40), "PTS", List.of(1, 3), "Team");

        assertThat(result.get(0).containsColumn("PTS_lag1")).isFalse();
        assertThat(column(result, "PTS_lag1")).containsExactly(null, 10, 20, 30);
        assertThat(column(result, "PTS_lag3")).containsExactly(null, null, null, 10);
    }

    @Test
    @DisplayName("Jamais de valeur d'une autre équipe")
    void lagShouldNotCrossGroups() {
        RowTable input = table(
                row("Team", "A", "date", "2024-01-01", "PTS", 1),
                row("Team", "B", "date", "2024-01-02", "PTS", 2),
                row("Team", "B", "date", "2024-01-03", "PTS", 3));

        RowTable result = generator.lag(input, "PTS", List.of(1), "Team");

        assertThat(column(result, "PTS_lag1")).isEqualTo(Arrays.asList(null, null, 2));
    }

    @Test
    void diffShouldCompareWithPreviousGame() {
        RowTable result = generator.diff(dailySeries("A", "PTS", 10, 15, 12), "PTS", "Team");

        assertThat(column(result, "PTS_diff1")).containsExactly(null, 5.0, -3.0);
    }

    @Test
    void shouldRejectInvalidPeriods() {
        RowTable input = dailySeries("A", "PTS", 1);

        assertThatThrownBy(() -> generator.lag(input, "PTS", List.of(), "Team")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> generator.lag(input, "PTS", List.of(0), "Team")).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("Sans colonne d'équipe, les lags suivent la date et non l'ordre d'entrée")
    void lagWithoutGroupShouldFollowDates() {
        RowTable input = table(
                row("date", "2024-01-03", "PTS", 30),
                row("date", "2024-01-01", "PTS", 10),
                row("date", "2024-01-02", "PTS", 20));

        RowTable result = generator.lag(input, "PTS", List.of(1), null);

        assertThat(column(result, "PTS_lag1")).isEqualTo(Arrays.asList(20, null, 10));
    }

    @Test
    @DisplayName("Modifier ou retirer les matchs futurs ne change aucun lag passé")
    void lagShouldIgnoreFutureRows() {
        RowTable full = generator.lag(dailySeries("A", "PTS", 10, 20, 30, 40), "PTS", List.of(1, 3), "Team");
        RowTable altered = generator.lag(dailySeries("A", "PTS", 10, 20, 30, 99), "PTS", List.of(1, 3), "Team");
        RowTable truncated = generator.lag(dailySeries("A", "PTS", 10, 20, 30), "PTS", List.of(1, 3), "Team");

        assertThat(column(altered, "PTS_lag1")).isEqualTo(column(full, "PTS_lag1"));
        assertThat(column(full, "PTS_lag1").subList(0, 3)).isEqualTo(column(truncated, "PTS_lag1"));
        assertThat(column(generator.diff(dailySeries("A", "PTS", 10, 20, 30, 99), "PTS", "Team"), "PTS_diff1").subList(0, 3))
                .isEqualTo(column(generator.diff(dailySeries("A", "PTS", 10, 20, 30), "PTS", "Team"), "PTS_diff1"));
    }
}
