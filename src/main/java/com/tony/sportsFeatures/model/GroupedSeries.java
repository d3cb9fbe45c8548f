package com.tony.sportsFeatures.model;

import lombok.Getter;
import lombok.Value;

import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Lignes regroupées par entité, chaque groupe trié par ordre chronologique croissant.
 * Les lignes dont la clé d'ordre est illisible sont listées à part (et ne figurent dans aucun groupe).
 */
@Getter
public class GroupedSeries {

    public enum OrderingMode { TIMESTAMP, SEQUENCE, INPUT_ORDER }

    private final Map<String, List<GameRecord>> groups;
    private final List<ExcludedRecord> excluded;
    private final OrderingMode orderingMode;

    public GroupedSeries(Map<String, List<GameRecord>> groups, List<ExcludedRecord> excluded, OrderingMode orderingMode) {
        this.groups = Collections.unmodifiableMap(groups);
        this.excluded = Collections.unmodifiableList(excluded);
        this.orderingMode = orderingMode;
    }

    public Set<String> keys() {
        return groups.keySet();
    }

    public List<GameRecord> group(String key) {
        return groups.getOrDefault(key, Collections.emptyList());
    }

    public Collection<List<GameRecord>> values() {
        return groups.values();
    }

    @Value
    public static class ExcludedRecord {
        GameRecord record;
        String reason;
    }
}
