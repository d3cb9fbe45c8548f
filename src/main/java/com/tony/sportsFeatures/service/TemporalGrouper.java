package com.tony.sportsFeatures.service;

import com.tony.sportsFeatures.config.FeatureProperties;
import com.tony.sportsFeatures.exception.MalformedTimestampException;
import com.tony.sportsFeatures.model.GameRecord;
import com.tony.sportsFeatures.model.GroupedSeries;
import com.tony.sportsFeatures.model.GroupedSeries.ExcludedRecord;
import com.tony.sportsFeatures.model.GroupedSeries.OrderingMode;
import com.tony.sportsFeatures.model.RowTable;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Regroupe les lignes par entité et trie chaque groupe chronologiquement.
 * Toutes les autres passes s'appuient sur cet ordre : on ne fait jamais confiance à l'ordre d'entrée.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class TemporalGrouper {

    /** Clé du groupe unique quand aucune colonne de regroupement n'est fournie. */
    public static final String WHOLE_TABLE = "*";

    private final TimestampParser timestampParser;
    private final FeatureProperties properties;

    /**
     * Regroupement avec les colonnes de temps configurées.
     * Sans colonne de regroupement, la table entière forme une seule série, triée elle aussi par date
     * (ou numéro de match) ; l'ordre d'entrée ne sert que si aucune de ces colonnes n'existe.
     */
    public GroupedSeries group(RowTable table, String groupColumn) {
        return group(table, groupColumn, properties.getDateColumn(), properties.getSequenceColumn());
    }

    /**
     * @param groupColumn    colonne d'entité (null = une seule série)
     * @param dateColumn     colonne de date, prioritaire si elle existe dans la table
     * @param sequenceColumn numéro de match, utilisé à défaut de date
     */
    public GroupedSeries group(RowTable table, String groupColumn, String dateColumn, String sequenceColumn) {
        if (groupColumn != null) {
            table.requireColumn(groupColumn, "colonne de regroupement");
        }
        OrderingMode mode = resolveMode(table, dateColumn, sequenceColumn);

        Map<String, List<GameRecord>> groups = new LinkedHashMap<>();
        List<ExcludedRecord> excluded = new ArrayList<>();

        for (GameRecord record : table) {
            String key = groupColumn == null ? WHOLE_TABLE : keyOf(record, groupColumn);
            record.setEntityKey(key);
            try {
                assignOrderKey(record, mode, dateColumn, sequenceColumn);
            } catch (MalformedTimestampException e) {
                // La ligne reste dans la table plate, mais sort des calculs ordonnés
                log.warn("⚠️ Ligne {} ({}) exclue des calculs temporels : {}", record.getIndex(), key, e.getMessage());
                excluded.add(new ExcludedRecord(record, e.getMessage()));
                continue;
            }
            groups.computeIfAbsent(key, k -> new ArrayList<>()).add(record);
        }

        // À clé égale, l'ordre d'entrée départage
        Comparator<GameRecord> order = comparatorFor(mode, sequenceColumn);
        groups.values().forEach(rows -> rows.sort(order));

        log.debug("Regroupement : {} groupe(s), {} ligne(s) exclue(s), ordre {}", groups.size(), excluded.size(), mode);
        return new GroupedSeries(groups, excluded, mode);
    }

    private OrderingMode resolveMode(RowTable table, String dateColumn, String sequenceColumn) {
        if (dateColumn != null && table.hasColumn(dateColumn)) return OrderingMode.TIMESTAMP;
        if (sequenceColumn != null && table.hasColumn(sequenceColumn)) return OrderingMode.SEQUENCE;
        return OrderingMode.INPUT_ORDER;
    }

    private void assignOrderKey(GameRecord record, OrderingMode mode, String dateColumn, String sequenceColumn) {
        switch (mode) {
            case TIMESTAMP -> record.setTimestamp(timestampParser.parse(dateColumn, record.get(dateColumn)));
            case SEQUENCE -> {
                if (record.getDouble(sequenceColumn) == null) {
                    throw new MalformedTimestampException(sequenceColumn, String.valueOf(record.get(sequenceColumn)));
                }
            }
            case INPUT_ORDER -> {
                // Rien à lire : l'index d'entrée fait foi
            }
        }
    }

    private Comparator<GameRecord> comparatorFor(OrderingMode mode, String sequenceColumn) {
        return switch (mode) {
            case TIMESTAMP -> Comparator.comparing(GameRecord::getTimestamp).thenComparingInt(GameRecord::getIndex);
            case SEQUENCE -> Comparator.<GameRecord>comparingDouble(r -> r.getDouble(sequenceColumn))
                    .thenComparingInt(GameRecord::getIndex);
            case INPUT_ORDER -> Comparator.comparingInt(GameRecord::getIndex);
        };
    }

    private static String keyOf(GameRecord record, String groupColumn) {
        String key = record.getString(groupColumn);
        return key != null ? key : "";
    }
}
