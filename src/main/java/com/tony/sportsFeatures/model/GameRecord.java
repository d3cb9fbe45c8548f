package com.tony.sportsFeatures.model;

import lombok.Getter;
import lombok.Setter;

import java.time.LocalDateTime;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * Une observation : une ligne "équipe x match".
 * <p>
 * Identité et temps sont des champs fixes (renseignés par le {@code TemporalGrouper}),
 * le reste est une map ordonnée colonne -> valeur. Les colonnes présentes à la création
 * sont des colonnes <i>source</i> : les passes de features ne font qu'ajouter des colonnes.
 */
@Getter
public class GameRecord {

    private final int index; // Position dans l'entrée, sert de départage stable
    @Setter
    private String entityKey;
    @Setter
    private LocalDateTime timestamp;

    @Getter(lombok.AccessLevel.NONE)
    private final Map<String, Object> values;
    @Getter(lombok.AccessLevel.NONE)
    private final Set<String> sourceColumns;

    public GameRecord(int index, Map<String, ?> raw) {
        this.index = index;
        this.values = new LinkedHashMap<>(raw);
        this.sourceColumns = new LinkedHashSet<>(raw.keySet());
    }

    private GameRecord(GameRecord other) {
        this.index = other.index;
        this.entityKey = other.entityKey;
        this.timestamp = other.timestamp;
        this.values = new LinkedHashMap<>(other.values);
        this.sourceColumns = new LinkedHashSet<>(other.sourceColumns);
    }

    public GameRecord copy() {
        return new GameRecord(this);
    }

    /** Colonne déclarée sur la ligne (même si sa valeur est nulle). */
    public boolean containsColumn(String column) {
        return values.containsKey(column);
    }

    /** Valeur présente et non nulle. */
    public boolean has(String column) {
        return values.get(column) != null;
    }

    public Object get(String column) {
        return values.get(column);
    }

    public String getString(String column) {
        Object value = values.get(column);
        if (value == null) return null;
        String text = value.toString().trim();
        return text.isEmpty() ? null : text;
    }

    /**
     * Lecture numérique tolérante : nombres, chaînes numériques, booléens (1/0).
     * Toute autre valeur est considérée comme absente.
     */
    public Double getDouble(String column) {
        Object value = values.get(column);
        if (value == null) return null;
        if (value instanceof Number number) {
            double d = number.doubleValue();
            return Double.isFinite(d) ? d : null;
        }
        if (value instanceof Boolean bool) return bool ? 1.0 : 0.0;

        String text = value.toString().trim();
        if (text.isEmpty()) return null;
        try {
            double d = Double.parseDouble(text);
            return Double.isFinite(d) ? d : null;
        } catch (NumberFormatException e) {
            return null;
        }
    }

    /**
     * Ajoute (ou remplace) une feature dérivée. {@code null}, NaN et l'infini signifient "non défini" :
     * la colonne est alors retirée de la ligne.
     *
     * @throws IllegalStateException si la colonne est une colonne source
     */
    public void putFeature(String column, Object value) {
        if (sourceColumns.contains(column)) {
            throw new IllegalStateException("La colonne source '" + column + "' ne peut pas être écrasée par une feature");
        }
        if (value == null || (value instanceof Double d && !Double.isFinite(d))) {
            values.remove(column);
            return;
        }
        values.put(column, value);
    }

    /**
     * Seule écriture autorisée sur une colonne source (étapes de normalisation explicites).
     */
    public void normalizeValue(String column, Double value) {
        if (value == null || !Double.isFinite(value)) {
            values.put(column, null);
            return;
        }
        values.put(column, value);
    }

    public boolean isSourceColumn(String column) {
        return sourceColumns.contains(column);
    }

    public Set<String> columns() {
        return Collections.unmodifiableSet(values.keySet());
    }

    public Map<String, Object> asMap() {
        return Collections.unmodifiableMap(values);
    }

    @Override
    public String toString() {
        return "GameRecord{index=" + index + ", entityKey=" + entityKey + ", timestamp=" + timestamp + ", values=" + values + "}";
    }
}
