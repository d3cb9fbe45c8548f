package com.tony.sportsFeatures.model;

import java.util.Locale;

public enum Outcome {
    WIN, LOSS, OTHER;

    /**
     * W / WIN / 1 / true = victoire ; L / LOSS / 0 / false / OTL / SOL = défaite.
     * Le reste (nul, vide...) casse la série.
     */
    public static Outcome parse(Object raw) {
        if (raw == null) return OTHER;
        if (raw instanceof Boolean bool) return bool ? WIN : LOSS;
        if (raw instanceof Number number) {
            double d = number.doubleValue();
            if (d == 1.0) return WIN;
            if (d == 0.0) return LOSS;
            return OTHER;
        }
        String text = raw.toString().trim().toUpperCase(Locale.ROOT);
        return switch (text) {
            case "W", "WIN", "1", "TRUE" -> WIN;
            case "L", "LOSS", "0", "FALSE", "OTL", "SOL" -> LOSS;
            default -> OTHER;
        };
    }
}
