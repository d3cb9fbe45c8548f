package com.tony.sportsFeatures.model;

import org.apache.commons.math3.stat.descriptive.StatisticalSummary;

import java.util.Locale;

public enum RollingStatistic {
    MEAN, SUM, MAX, MIN, STD;

    public String key() {
        return name().toLowerCase(Locale.ROOT);
    }

    /** Écart-type de population (diviseur n), comme les moyennes de forme. */
    public double compute(StatisticalSummary stats) {
        return switch (this) {
            case MEAN -> stats.getMean();
            case SUM -> stats.getSum();
            case MAX -> stats.getMax();
            case MIN -> stats.getMin();
            case STD -> stats.getN() == 0 ? Double.NaN
                    : Math.sqrt(stats.getVariance() * (stats.getN() - 1) / stats.getN());
        };
    }

    public static RollingStatistic fromKey(String key) {
        if (key == null) return MEAN;
        return valueOf(key.trim().toUpperCase(Locale.ROOT));
    }
}
