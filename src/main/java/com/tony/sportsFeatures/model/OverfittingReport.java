package com.tony.sportsFeatures.model;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Comparaison métrique par métrique entre entraînement et test.
 */
@Value
@Builder
public class OverfittingReport {
    boolean overfit;
    double threshold;
    List<Signal> signals;

    @Value
    public static class Signal {
        String metric;
        double train;
        double test;
        double diff;
        Double pctDiff; // null si la valeur d'entraînement est nulle
    }
}
