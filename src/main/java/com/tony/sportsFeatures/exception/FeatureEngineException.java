package com.tony.sportsFeatures.exception;

/**
 * Racine des erreurs du moteur de features.
 */
public class FeatureEngineException extends RuntimeException {

    public FeatureEngineException(String message) {
        super(message);
    }

    public FeatureEngineException(String message, Throwable cause) {
        super(message, cause);
    }
}
