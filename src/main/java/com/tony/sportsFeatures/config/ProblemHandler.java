package com.tony.sportsFeatures.config;

import com.tony.sportsFeatures.exception.InsufficientDataException;
import com.tony.sportsFeatures.exception.UnknownColumnException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.net.URI;

/**
 * Traduction des erreurs métier en RFC 7807 (application/problem+json).
 */
@RestControllerAdvice
@Slf4j
public class ProblemHandler {

    private static final String PROBLEM_BASE = "https://sports-features.local/problems/";

    @ExceptionHandler(UnknownColumnException.class)
    public ProblemDetail unknownColumn(UnknownColumnException ex) {
        ProblemDetail pd = ProblemDetail.forStatusAndDetail(HttpStatus.BAD_REQUEST, ex.getMessage());
        pd.setType(URI.create(PROBLEM_BASE + "unknown-column"));
        pd.setTitle("Unknown Column");
        pd.setProperty("column", ex.getColumn());
        return pd;
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ProblemDetail badArgument(IllegalArgumentException ex) {
        ProblemDetail pd = ProblemDetail.forStatusAndDetail(HttpStatus.BAD_REQUEST, ex.getMessage());
        pd.setType(URI.create(PROBLEM_BASE + "invalid-parameter"));
        pd.setTitle("Bad Request");
        return pd;
    }

    @ExceptionHandler(InsufficientDataException.class)
    public ProblemDetail insufficientData(InsufficientDataException ex) {
        ProblemDetail pd = ProblemDetail.forStatusAndDetail(HttpStatus.UNPROCESSABLE_ENTITY, ex.getMessage());
        pd.setType(URI.create(PROBLEM_BASE + "insufficient-data"));
        pd.setTitle("Insufficient Data");
        pd.setProperty("required", ex.getRequired());
        pd.setProperty("available", ex.getAvailable());
        return pd;
    }

    // Le reste devient une 500 sans détail interne
    @ExceptionHandler(IllegalStateException.class)
    public ProblemDetail internal(IllegalStateException ex) {
        log.error("❌ Erreur inattendue", ex);
        ProblemDetail pd = ProblemDetail.forStatusAndDetail(HttpStatus.INTERNAL_SERVER_ERROR, "Erreur interne du moteur de features");
        pd.setType(URI.create(PROBLEM_BASE + "internal-error"));
        pd.setTitle("Internal Server Error");
        return pd;
    }
}
