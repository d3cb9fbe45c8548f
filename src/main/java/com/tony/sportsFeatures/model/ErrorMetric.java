package com.tony.sportsFeatures.model;

import java.util.Locale;

/** Métrique d'erreur d'un jeu de prédictions. */
public enum ErrorMetric {
    RMSE, MAE, R2;

    public static ErrorMetric fromKey(String key) {
        if (key == null) return RMSE;
        return valueOf(key.trim().toUpperCase(Locale.ROOT));
    }
}
