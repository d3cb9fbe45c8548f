package com.tony.sportsFeatures.model;

/**
 * Fenêtre temporelle des agrégats "saison".
 */
public enum AggregateMode {
    /** Toute la saison, matchs futurs compris (fuite assumée, valeur diffusée à chaque ligne). */
    SEASON,
    /** Lignes dont la date est antérieure ou égale à celle de la ligne courante. */
    AS_OF,
    /** Lignes strictement antérieures à la ligne courante (avant le match). */
    PRIOR
}
