package com.tony.sportsFeatures.model;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Un point de courbe d'apprentissage : les premières lignes chronologiques, scores à remplir par l'appelant.
 */
@Value
@Builder
public class LearningCurvePoint {
    double trainFraction;
    int trainSize;
    List<GameRecord> train;
}
