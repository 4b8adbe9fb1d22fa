package com.sportsdata.application.federation;

import com.sportsdata.domain.ports.SportsDataProvider;

import java.util.Objects;

/**
 * An enabled provider and its priority. Lower priority values are tried first.
 */
public record ProviderRegistration(SportsDataProvider provider, int priority) {

    public ProviderRegistration {
        Objects.requireNonNull(provider, "provider");
    }

    public String name() {
        return provider.name();
    }
}
