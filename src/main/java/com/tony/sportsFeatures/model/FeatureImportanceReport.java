package com.tony.sportsFeatures.model;

import lombok.Builder;
import lombok.Value;

import java.util.Map;

@Value
@Builder
public class FeatureImportanceReport {
    Map<String, Double> topFeatures; // Ordre décroissant d'importance
    Double cumulativeImportance; // Part cumulée du top ; null si l'importance totale est nulle
}
