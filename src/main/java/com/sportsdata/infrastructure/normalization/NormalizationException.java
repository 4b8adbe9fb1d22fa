package com.sportsdata.infrastructure.normalization;

/**
 * A provider payload is missing something a normalized record requires.
 * Fatal for the single record being built, never for the whole fetch.
 */
public class NormalizationException extends RuntimeException {

    public NormalizationException(String message) {
        super(message);
    }

    public NormalizationException(String message, Throwable cause) {
        super(message, cause);
    }
}
