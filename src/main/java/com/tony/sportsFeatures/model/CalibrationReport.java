package com.tony.sportsFeatures.model;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Calibration par tranches de prédictions triées : moyenne prédite contre moyenne observée.
 */
@Value
@Builder
public class CalibrationReport {
    List<Bin> bins;
    double meanCalibrationError;

    @Value
    public static class Bin {
        int bin; // 1-based
        int size;
        double avgPredicted;
        double avgActual;
        double calibrationError;
    }
}
