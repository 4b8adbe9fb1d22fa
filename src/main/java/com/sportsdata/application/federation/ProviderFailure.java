package com.sportsdata.application.federation;

import com.sportsdata.domain.ports.Operation;

/**
 * A provider call that threw or timed out. {@code error} is null for timeouts.
 */
public record ProviderFailure(String provider, Operation operation, String message, Throwable error) {

    static ProviderFailure of(String provider, Operation operation, Throwable error) {
        String message = error.getMessage() != null ? error.getMessage() : error.getClass().getSimpleName();
        return new ProviderFailure(provider, operation, message, error);
    }

    static ProviderFailure timedOut(String provider, Operation operation) {
        return new ProviderFailure(provider, operation, "timed out", null);
    }
}
