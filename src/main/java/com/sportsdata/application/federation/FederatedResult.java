package com.sportsdata.application.federation;

import java.util.List;
import java.util.Optional;

/**
 * Value of a federated call plus how it was obtained.
 *
 * @param providers providers whose data is in {@code value}, in priority order; empty when nothing was found
 * @param failures  provider failures seen while resolving, in call order
 */
public record FederatedResult<T>(T value, Outcome outcome, List<String> providers, List<ProviderFailure> failures) {

    public enum Outcome {
        /** Served from a live cache entry. */
        CACHE_HIT,
        /** One provider answered with data. */
        SERVED,
        /** Several providers contributed to a merged value. */
        MERGED,
        /** Every provider asked had nothing. */
        NOT_FOUND,
        /** Every provider asked failed. */
        ALL_FAILED,
        /** The time budget ran out mid-fallback. */
        TIMED_OUT
    }

    public FederatedResult {
        providers = List.copyOf(providers);
        failures = List.copyOf(failures);
    }

    public Optional<ProviderFailure> lastFailure() {
        return failures.isEmpty() ? Optional.empty() : Optional.of(failures.get(failures.size() - 1));
    }
}
