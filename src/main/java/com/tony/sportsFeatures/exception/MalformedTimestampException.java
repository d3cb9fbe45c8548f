package com.tony.sportsFeatures.exception;

import lombok.Getter;

/**
 * Date (ou numéro de séquence) illisible là où un ordre chronologique est requis.
 * Traitée localement : la ligne est exclue des calculs ordonnés mais reste dans la table.
 */
@Getter
public class MalformedTimestampException extends FeatureEngineException {
    private final String column;
    private final String rawValue;

    public MalformedTimestampException(String column, String rawValue) {
        super("Valeur temporelle illisible pour la colonne '" + column + "' : '" + rawValue + "'");
        this.column = column;
        this.rawValue = rawValue;
    }

    public MalformedTimestampException(String column, String rawValue, Throwable cause) {
        super("Valeur temporelle illisible pour la colonne '" + column + "' : '" + rawValue + "'", cause);
        this.column = column;
        this.rawValue = rawValue;
    }
}
