package com.tony.sportsFeatures.exception;

import lombok.Getter;

/**
 * Colonne demandée absente de la table : erreur de configuration de l'appelant.
 */
@Getter
public class UnknownColumnException extends FeatureEngineException {
    private final String column;

    public UnknownColumnException(String column, String context) {
        super("Colonne inconnue '" + column + "' (" + context + ")");
        this.column = column;
    }
}
