package com.tony.sportsFeatures.model;

import lombok.Builder;
import lombok.Value;

/**
 * Intervalle empirique sur l'erreur absolue : {@code ciBound} couvre {@code confidenceLevel} des erreurs.
 */
@Value
@Builder
public class ErrorInterval {
    double confidenceLevel;
    double ciBound;
    double meanError;
    double medianError;
    int sampleSize;
}
