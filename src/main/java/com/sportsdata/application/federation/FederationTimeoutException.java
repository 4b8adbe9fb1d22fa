package com.sportsdata.application.federation;

/**
 * The time budget ran out before any provider could be asked.
 */
public class FederationTimeoutException extends RuntimeException {

    private final String cacheKey;

    public FederationTimeoutException(String cacheKey, String message) {
        super(message);
        this.cacheKey = cacheKey;
    }

    public String getCacheKey() {
        return cacheKey;
    }
}
