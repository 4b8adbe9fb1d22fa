package com.sportsdata.application.federation;

import com.sportsdata.application.federation.FederatedResult.Outcome;
import com.sportsdata.domain.ports.Operation;
import com.sportsdata.domain.ports.ProviderException;
import com.sportsdata.domain.ports.SportsDataProvider;
import com.sportsdata.infrastructure.cache.CacheTtlPolicy;
import com.sportsdata.infrastructure.cache.ProviderResultCache;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Resolves read operations against a prioritized set of providers.
 *
 * Flow:
 * 1) Serve a live cache entry for the request key (skipped on force refresh)
 * 2) Join a fetch already in flight for the same key, or become its owner
 * 3) Ask providers supporting the league in priority order on the worker pool;
 *    mergeable operations ask all of them in parallel instead
 * 4) Cache and return the first non-empty answer; failures and empty answers
 *    fall through to the next provider
 * 5) When providers run out, return the request's empty value. A "nothing here"
 *    answer is cached briefly; outright failure is not cached.
 */
public class ProviderFederator {

    private static final Logger logger = LoggerFactory.getLogger(ProviderFederator.class);

    private final List<ProviderRegistration> registrations;
    private final ProviderResultCache cache;
    private final CacheTtlPolicy ttlPolicy;
    private final ExecutorService executorService;
    private final Duration defaultTimeout;
    private final Set<Operation> mergeable;
    private final Map<String, CompletableFuture<FederatedResult<?>>> inFlight = new ConcurrentHashMap<>();
    private final Map<String, AtomicLong> failureCounts = new ConcurrentHashMap<>();

    public ProviderFederator(List<ProviderRegistration> registrations, ProviderResultCache cache,
                             CacheTtlPolicy ttlPolicy, ExecutorService executorService, Duration defaultTimeout,
                             Set<Operation> mergeable) {
        Set<String> names = new HashSet<>();
        for (ProviderRegistration registration : registrations) {
            if (!names.add(registration.name())) {
                throw new IllegalArgumentException("Provider registered twice: " + registration.name());
            }
        }
        this.registrations = registrations.stream()
            .sorted(Comparator.comparingInt(ProviderRegistration::priority))
            .toList();
        this.cache = cache;
        this.ttlPolicy = ttlPolicy;
        this.executorService = executorService;
        this.defaultTimeout = defaultTimeout;
        this.mergeable = Set.copyOf(mergeable);

        logger.info("Federating providers {} (mergeable operations: {})", providerNames(), this.mergeable);
    }

    /**
     * Provider names in priority order.
     */
    public List<String> providerNames() {
        return registrations.stream().map(ProviderRegistration::name).toList();
    }

    /**
     * Budget used when a call does not set its own timeout.
     */
    public Duration defaultTimeout() {
        return defaultTimeout;
    }

    public boolean supportsLeague(String league) {
        return registrations.stream().anyMatch(r -> r.provider().supportsLeague(league));
    }

    public <T> FederatedResult<T> execute(FederatedRequest<T> request) {
        return execute(request, RequestOptions.DEFAULT);
    }

    /**
     * Never throws for provider trouble. {@link FederationTimeoutException} is
     * thrown only when the time budget is gone before any provider was asked.
     */
    public <T> FederatedResult<T> execute(FederatedRequest<T> request, RequestOptions options) {
        String key = request.cacheKey();
        Duration timeout = options.timeout() != null ? options.timeout() : defaultTimeout;
        long deadline = System.nanoTime() + timeout.toNanos();

        if (!options.forceRefresh()) {
            Optional<FederatedResult<T>> cached = fromCache(key);
            if (cached.isPresent()) {
                return cached.get();
            }
        }

        CompletableFuture<FederatedResult<?>> owned = new CompletableFuture<>();
        CompletableFuture<FederatedResult<?>> pending = inFlight.putIfAbsent(key, owned);
        if (pending != null) {
            logger.debug("Joining in-flight fetch for {}", key);
            return awaitInFlight(pending, request, deadline);
        }

        try {
            FederatedResult<T> result = null;
            if (!options.forceRefresh()) {
                // another caller may have filled the entry between the first read and taking ownership
                result = this.<T>fromCache(key).orElse(null);
            }
            if (result == null) {
                result = resolve(request, deadline);
            }
            owned.complete(result);
            return result;
        } catch (RuntimeException | Error e) {
            owned.completeExceptionally(e);
            throw e;
        } finally {
            inFlight.remove(key, owned);
        }
    }

    public Map<String, Long> failureCounts() {
        Map<String, Long> snapshot = new TreeMap<>();
        failureCounts.forEach((provider, count) -> snapshot.put(provider, count.get()));
        return snapshot;
    }

    public ProviderResultCache.Stats cacheStats() {
        return cache.stats();
    }

    public int clearCache() {
        return cache.clear();
    }

    public int invalidateProvider(String provider) {
        return cache.invalidateProvider(provider);
    }

    @SuppressWarnings("unchecked")
    private <T> Optional<FederatedResult<T>> fromCache(String key) {
        return cache.get(key).map(entry -> {
            logger.debug("Cache hit for {}", key);
            return new FederatedResult<>((T) entry.value(), Outcome.CACHE_HIT, inPriorityOrder(entry.providers()),
                List.of());
        });
    }

    @SuppressWarnings("unchecked")
    private <T> FederatedResult<T> awaitInFlight(CompletableFuture<FederatedResult<?>> pending,
                                                 FederatedRequest<T> request, long deadline) {
        try {
            return (FederatedResult<T>) pending.get(Math.max(0, deadline - System.nanoTime()), TimeUnit.NANOSECONDS);
        } catch (TimeoutException e) {
            logger.warn("Timed out waiting for in-flight fetch of {}", request.cacheKey());
            return new FederatedResult<>(request.emptyValue(), Outcome.TIMED_OUT, List.of(), List.of());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return new FederatedResult<>(request.emptyValue(), Outcome.TIMED_OUT, List.of(), List.of());
        } catch (ExecutionException e) {
            if (e.getCause() instanceof FederationTimeoutException) {
                // the owner's budget ran out, not ours
                logger.warn("In-flight fetch of {} timed out for its owner", request.cacheKey());
                return new FederatedResult<>(request.emptyValue(), Outcome.TIMED_OUT, List.of(), List.of());
            }
            if (e.getCause() instanceof RuntimeException runtime) {
                throw runtime;
            }
            throw new IllegalStateException("In-flight fetch of " + request.cacheKey() + " failed", e.getCause());
        }
    }

    private <T> FederatedResult<T> resolve(FederatedRequest<T> request, long deadline) {
        List<ProviderRegistration> candidates = registrations.stream()
            .filter(r -> request.league() == null || r.provider().supportsLeague(request.league()))
            .toList();
        if (candidates.isEmpty()) {
            logger.debug("No provider supports league {} for {}", request.league(), request.cacheKey());
            return new FederatedResult<>(request.emptyValue(), Outcome.NOT_FOUND, List.of(), List.of());
        }
        if (request.merger() != null && mergeable.contains(request.operation()) && candidates.size() > 1) {
            return resolveMerged(request, candidates, deadline);
        }
        return resolveInOrder(request, candidates, deadline);
    }

    private <T> FederatedResult<T> resolveInOrder(FederatedRequest<T> request, List<ProviderRegistration> candidates,
                                                  long deadline) {
        String key = request.cacheKey();
        List<ProviderFailure> failures = new ArrayList<>();
        List<String> emptyProviders = new ArrayList<>();

        for (ProviderRegistration registration : candidates) {
            long remaining = deadline - System.nanoTime();
            if (remaining <= 0) {
                return timedOut(request, emptyProviders, failures);
            }
            CompletableFuture<Attempt<T>> future = submit(registration.provider(), request);
            Attempt<T> attempt;
            try {
                attempt = await(future, remaining);
            } catch (TimeoutException e) {
                future.cancel(true);
                fail(key, failures, ProviderFailure.timedOut(registration.name(), request.operation()));
                return timedOut(request, emptyProviders, failures);
            }

            if (attempt.failure() != null) {
                fail(key, failures, attempt.failure());
            } else if (request.isEmpty(attempt.value())) {
                logger.debug("Provider {} has nothing for {}", registration.name(), key);
                emptyProviders.add(registration.name());
            } else {
                cache.put(key, attempt.value(), Set.of(registration.name()),
                    ttlPolicy.ttlFor(request.operation(), attempt.value(), request.date()));
                logger.info("Served {} from {}", key, registration.name());
                return new FederatedResult<>(attempt.value(), Outcome.SERVED, List.of(registration.name()), failures);
            }
        }
        return exhausted(request, emptyProviders, failures);
    }

    /**
     * All candidates are asked at once; answers are folded from highest to
     * lowest priority. A merge missing a timed-out provider is returned but not
     * cached.
     */
    private <T> FederatedResult<T> resolveMerged(FederatedRequest<T> request, List<ProviderRegistration> candidates,
                                                 long deadline) {
        String key = request.cacheKey();
        long remaining = deadline - System.nanoTime();
        if (remaining <= 0) {
            return timedOut(request, List.of(), List.of());
        }

        List<CompletableFuture<Attempt<T>>> futures = candidates.stream()
            .map(r -> submit(r.provider(), request))
            .toList();

        boolean timedOut = false;
        try {
            CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).get(remaining, TimeUnit.NANOSECONDS);
        } catch (TimeoutException e) {
            timedOut = true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            timedOut = true;
        } catch (ExecutionException e) {
            throw new IllegalStateException("Provider attempt for " + key + " failed unexpectedly", e.getCause());
        }

        List<ProviderFailure> failures = new ArrayList<>();
        List<String> emptyProviders = new ArrayList<>();
        List<String> contributors = new ArrayList<>();
        T merged = null;

        for (int i = 0; i < candidates.size(); i++) {
            String provider = candidates.get(i).name();
            CompletableFuture<Attempt<T>> future = futures.get(i);
            if (!future.isDone()) {
                future.cancel(true);
                fail(key, failures, ProviderFailure.timedOut(provider, request.operation()));
                continue;
            }
            Attempt<T> attempt = future.join();
            if (attempt.failure() != null) {
                fail(key, failures, attempt.failure());
            } else if (request.isEmpty(attempt.value())) {
                emptyProviders.add(provider);
            } else {
                merged = merged == null ? attempt.value() : request.merger().apply(merged, attempt.value());
                contributors.add(provider);
            }
        }

        if (contributors.isEmpty()) {
            return timedOut ? timedOut(request, emptyProviders, failures) : exhausted(request, emptyProviders, failures);
        }
        if (timedOut) {
            logger.warn("Returning partial merge of {} from {}; not cached", key, contributors);
        } else {
            cache.put(key, merged, Set.copyOf(contributors),
                ttlPolicy.ttlFor(request.operation(), merged, request.date()));
            logger.info("Merged {} from {}", key, contributors);
        }
        Outcome outcome = contributors.size() > 1 ? Outcome.MERGED : Outcome.SERVED;
        return new FederatedResult<>(merged, outcome, contributors, failures);
    }

    private <T> FederatedResult<T> exhausted(FederatedRequest<T> request, List<String> emptyProviders,
                                             List<ProviderFailure> failures) {
        String key = request.cacheKey();
        if (!emptyProviders.isEmpty()) {
            cache.put(key, request.emptyValue(), Set.copyOf(emptyProviders), ttlPolicy.emptyTtl());
            logger.debug("No provider has data for {}", key);
            return new FederatedResult<>(request.emptyValue(), Outcome.NOT_FOUND, List.of(), failures);
        }
        ProviderFailure last = failures.get(failures.size() - 1);
        logger.warn("All {} providers failed for {}; last failure from {}: {}",
            failures.size(), key, last.provider(), last.message());
        return new FederatedResult<>(request.emptyValue(), Outcome.ALL_FAILED, List.of(), failures);
    }

    private <T> FederatedResult<T> timedOut(FederatedRequest<T> request, List<String> emptyProviders,
                                            List<ProviderFailure> failures) {
        if (emptyProviders.isEmpty() && failures.isEmpty()) {
            throw new FederationTimeoutException(request.cacheKey(),
                "Time budget exhausted before any provider was asked for " + request.cacheKey());
        }
        logger.warn("Timed out resolving {} after {} provider(s)",
            request.cacheKey(), emptyProviders.size() + failures.size());
        return new FederatedResult<>(request.emptyValue(), Outcome.TIMED_OUT, List.of(), failures);
    }

    private void fail(String key, List<ProviderFailure> failures, ProviderFailure failure) {
        failures.add(failure);
        failureCounts.computeIfAbsent(failure.provider(), p -> new AtomicLong()).incrementAndGet();
        if (failure.error() == null || failure.error() instanceof ProviderException) {
            logger.warn("Provider {} failed for {}: {}", failure.provider(), key, failure.message());
        } else {
            logger.warn("Provider {} failed unexpectedly for {}", failure.provider(), key, failure.error());
        }
    }

    private <T> CompletableFuture<Attempt<T>> submit(SportsDataProvider provider, FederatedRequest<T> request) {
        return CompletableFuture.supplyAsync(() -> attempt(provider, request), executorService);
    }

    private <T> Attempt<T> await(CompletableFuture<Attempt<T>> future, long remainingNanos) throws TimeoutException {
        try {
            return future.get(remainingNanos, TimeUnit.NANOSECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TimeoutException("Interrupted while waiting for provider");
        } catch (ExecutionException e) {
            throw new IllegalStateException("Provider attempt failed unexpectedly", e.getCause());
        }
    }

    // Runs on the worker pool; every provider error becomes a failed attempt
    private <T> Attempt<T> attempt(SportsDataProvider provider, FederatedRequest<T> request) {
        try {
            return new Attempt<>(request.sanitize(request.call().apply(provider)), null);
        } catch (ProviderException | RuntimeException e) {
            return new Attempt<>(null, ProviderFailure.of(provider.name(), request.operation(), e));
        }
    }

    private List<String> inPriorityOrder(Set<String> providers) {
        return providerNames().stream().filter(providers::contains).toList();
    }

    private record Attempt<T>(T value, ProviderFailure failure) {}
}
