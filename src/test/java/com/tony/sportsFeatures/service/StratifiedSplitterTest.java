package com.tony.sportsFeatures.service;

import com.tony.sportsFeatures.exception.UnknownColumnException;
import com.tony.sportsFeatures.model.GameRecord;
import com.tony.sportsFeatures.model.RowTable;
import com.tony.sportsFeatures.model.StratifiedSplit;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static com.tony.sportsFeatures.GameLogFixtures.row;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class StratifiedSplitterTest {

    private final StratifiedSplitter splitter = new StratifiedSplitter();

    @Test
    @DisplayName("Chaque classe est coupée 80/20")
    void shouldPreserveClassProportions() {
        StratifiedSplit split = splitter.split(playoffTable(), "playoff_status", 0.2, 42L);

        assertThat(split.getTrainSize()).isEqualTo(80);
        assertThat(split.getTestSize()).isEqualTo(20);
        assertThat(split.getTrainClassCounts()).containsEntry("1", 24).containsEntry("0", 56);
        assertThat(split.getTestClassCounts()).containsEntry("1", 6).containsEntry("0", 14);
    }

    @Test
    @DisplayName("Même graine, même découpage")
    void shouldBeDeterministicForSeed() {
        StratifiedSplit first = splitter.split(playoffTable(), "playoff_status", 0.2, 42L);
        StratifiedSplit second = splitter.split(playoffTable(), "playoff_status", 0.2, 42L);

        assertThat(first.getTest()).extracting(GameRecord::getIndex)
                .containsExactlyElementsOf(second.getTest().stream().map(GameRecord::getIndex).toList());
    }

    @Test
    @DisplayName("1, 1.0 et \"1.0\" forment une seule classe")
    void shouldMergeNumericallyEqualLabels() {
        List<Map<String, Object>> rows = new ArrayList<>();
        for (int i = 0; i < 10; i++) {
            Object label = switch (i % 3) {
                case 0 -> 1;
                case 1 -> 1.0;
                default -> "1.0";
            };
            rows.add(row("Team", "T" + i, "playoff_status", label));
        }
        for (int i = 0; i < 10; i++) {
            rows.add(row("Team", "U" + i, "playoff_status", i % 2 == 0 ? 0 : "0"));
        }

        StratifiedSplit split = splitter.split(RowTable.fromMaps(rows), "playoff_status", 0.2, 42L);

        assertThat(split.getTrainClassCounts()).containsOnlyKeys("1", "0")
                .containsEntry("1", 8).containsEntry("0", 8);
        assertThat(split.getTestClassCounts()).containsEntry("1", 2).containsEntry("0", 2);
    }

    @Test
    void textLabelsShouldStayAsIs() {
        List<Map<String, Object>> rows = new ArrayList<>();
        for (int i = 0; i < 10; i++) {
            rows.add(row("Team", "T" + i, "playoff_status", i % 2 == 0 ? "in" : " out "));
        }

        StratifiedSplit split = splitter.split(RowTable.fromMaps(rows), "playoff_status", 0.2, 7L);

        assertThat(split.getTrainClassCounts()).containsOnlyKeys("in", "out");
    }

    @Test
    void shouldRequireTargetColumn() {
        assertThatThrownBy(() -> splitter.split(playoffTable(), "made_playoffs", 0.2, 1L))
                .isInstanceOf(UnknownColumnException.class);
    }

    private static RowTable playoffTable() {
        List<Map<String, Object>> rows = new ArrayList<>();
        for (int i = 0; i < 100; i++) {
            rows.add(row("Team", "T" + i, "playoff_status", i % 10 < 3 ? 1 : 0));
        }
        return RowTable.fromMaps(rows);
    }
}
