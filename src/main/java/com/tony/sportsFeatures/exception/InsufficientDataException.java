package com.tony.sportsFeatures.exception;

import lombok.Getter;

@Getter
public class InsufficientDataException extends FeatureEngineException {
    private final int required;
    private final int available;

    public InsufficientDataException(String message, int required, int available) {
        super(message + " (requis : " + required + ", disponible : " + available + ")");
        this.required = required;
        this.available = available;
    }
}
