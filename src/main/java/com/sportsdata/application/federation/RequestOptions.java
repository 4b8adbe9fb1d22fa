package com.sportsdata.application.federation;

import java.time.Duration;

/**
 * Per-call options.
 *
 * @param forceRefresh skip the cache read; the fresh result replaces the cached one
 * @param timeout      budget for the whole federated call, null for the configured default
 */
public record RequestOptions(boolean forceRefresh, Duration timeout) {

    public static final RequestOptions DEFAULT = new RequestOptions(false, null);

    public RequestOptions {
        if (timeout != null && timeout.isNegative()) {
            throw new IllegalArgumentException("timeout must not be negative");
        }
    }

    public static RequestOptions refresh() {
        return new RequestOptions(true, null);
    }

    public static RequestOptions withTimeout(Duration timeout) {
        return new RequestOptions(false, timeout);
    }
}
