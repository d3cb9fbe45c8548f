package com.tony.sportsFeatures.util;

public final class FeatureMath {

    private FeatureMath() {
    }

    public static double round(double value, int decimals) {
        double factor = Math.pow(10, decimals);
        return Math.round(value * factor) / factor;
    }

    /** Arrondi qui laisse passer le "non défini". */
    public static Double roundOrNull(Double value, int decimals) {
        if (value == null || !Double.isFinite(value)) return null;
        return round(value, decimals);
    }

    /** Taux avec valeur neutre si le dénominateur est nul (ex : 0.5 pour un taux de victoire). */
    public static double ratioOrDefault(double numerator, double denominator, double fallback) {
        return denominator > 0 ? numerator / denominator : fallback;
    }

    public static double clamp01(double value) {
        return Math.max(0.0, Math.min(1.0, value));
    }

    public static double valueOrZero(Double value) {
        return value != null ? value : 0.0;
    }
}
