package com.tony.sportsFeatures.model;

import com.tony.sportsFeatures.exception.UnknownColumnException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Séquence ordonnée de lignes partageant des noms de colonnes.
 * Toutes les lignes ne renseignent pas forcément toutes les colonnes optionnelles.
 */
public class RowTable implements Iterable<GameRecord> {

    private final List<GameRecord> records;

    public RowTable(List<GameRecord> records) {
        this.records = new ArrayList<>(records);
    }

    public static RowTable fromMaps(List<? extends Map<String, ?>> rows) {
        List<GameRecord> records = new ArrayList<>(rows.size());
        for (int i = 0; i < rows.size(); i++) {
            records.add(new GameRecord(i, rows.get(i)));
        }
        return new RowTable(records);
    }

    /** Union des colonnes, dans l'ordre de première apparition. */
    public List<String> getColumns() {
        Set<String> columns = new LinkedHashSet<>();
        for (GameRecord record : records) {
            columns.addAll(record.columns());
        }
        return new ArrayList<>(columns);
    }

    public boolean hasColumn(String column) {
        if (column == null) return false;
        for (GameRecord record : records) {
            if (record.containsColumn(column)) return true;
        }
        return false;
    }

    /**
     * Échoue immédiatement si la colonne n'existe pas. Une table vide ne déclenche pas d'erreur :
     * il n'y a simplement rien à calculer.
     */
    public void requireColumn(String column, String context) {
        if (records.isEmpty()) return;
        if (!hasColumn(column)) {
            throw new UnknownColumnException(column, context);
        }
    }

    /** Copie profonde : chaque passe travaille sur sa propre copie. */
    public RowTable copy() {
        List<GameRecord> copies = new ArrayList<>(records.size());
        for (GameRecord record : records) {
            copies.add(record.copy());
        }
        return new RowTable(copies);
    }

    public List<GameRecord> getRecords() {
        return Collections.unmodifiableList(records);
    }

    public GameRecord get(int i) {
        return records.get(i);
    }

    public int size() {
        return records.size();
    }

    public boolean isEmpty() {
        return records.isEmpty();
    }

    public List<Map<String, Object>> toMaps() {
        List<Map<String, Object>> rows = new ArrayList<>(records.size());
        for (GameRecord record : records) {
            rows.add(record.asMap());
        }
        return rows;
    }

    @Override
    public Iterator<GameRecord> iterator() {
        return getRecords().iterator();
    }
}
