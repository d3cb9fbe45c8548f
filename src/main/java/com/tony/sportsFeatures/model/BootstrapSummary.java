package com.tony.sportsFeatures.model;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class BootstrapSummary {
    ErrorMetric metric;
    int iterations; // Rééchantillonnages retenus (R2 indéfini écarté)
    double mean;
    double median;
    double ci95Lower;
    double ci95Upper;
    double stdDev; // Écart-type de population des scores
}
