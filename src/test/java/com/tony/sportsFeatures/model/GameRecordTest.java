package com.tony.sportsFeatures.model;

import org.junit.jupiter.api.Test;

import static com.tony.sportsFeatures.GameLogFixtures.row;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class GameRecordTest {

    @Test
    void sourceColumnsShouldNeverBeOverwrittenByFeatures() {
        GameRecord record = new GameRecord(0, row("PTS", 10));

        assertThatThrownBy(() -> record.putFeature("PTS", 3)).isInstanceOf(IllegalStateException.class);
        assertThat(record.isSourceColumn("PTS")).isTrue();
    }

    @Test
    void undefinedFeatureValuesShouldRemoveColumn() {
        GameRecord record = new GameRecord(0, row("PTS", 10));
        record.putFeature("ratio", 0.5);
        record.putFeature("ratio", Double.NaN);

        assertThat(record.containsColumn("ratio")).isFalse();
    }

    @Test
    void numericReadsShouldBeLenient() {
        GameRecord record = new GameRecord(0, row("a", "3.5", "b", true, "c", "abc", "d", " ", "e", Double.POSITIVE_INFINITY));

        assertThat(record.getDouble("a")).isEqualTo(3.5);
        assertThat(record.getDouble("b")).isEqualTo(1.0);
        assertThat(record.getDouble("c")).isNull();
        assertThat(record.getDouble("d")).isNull();
        assertThat(record.getDouble("e")).isNull();
        assertThat(record.getString("d")).isNull();
    }

    @Test
    void copyShouldBeIndependent() {
        GameRecord original = new GameRecord(3, row("PTS", 10));
        GameRecord copy = original.copy();
        copy.putFeature("extra", 1);

        assertThat(original.containsColumn("extra")).isFalse();
        assertThat(copy.getIndex()).isEqualTo(3);
        assertThat(copy.isSourceColumn("PTS")).isTrue();
    }
}
