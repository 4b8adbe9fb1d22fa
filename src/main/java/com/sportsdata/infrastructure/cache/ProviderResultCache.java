package com.sportsdata.infrastructure.cache;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Expiry;
import com.github.benmanes.caffeine.cache.Ticker;
import com.github.benmanes.caffeine.cache.stats.CacheStats;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Optional;
import java.util.Set;

/**
 * Provider-agnostic result cache keyed by full call signature.
 *
 * <p>Every entry carries its own TTL. Entries also remember which providers
 * produced them so one provider's results can be dropped without touching the
 * rest. Reads are lock-free.
 */
public class ProviderResultCache {

    private static final Logger logger = LoggerFactory.getLogger(ProviderResultCache.class);

    public static final long DEFAULT_MAX_SIZE = 10_000;

    /**
     * @param value     cached value (an Optional, List or Map of normalized records)
     * @param providers providers whose data is in the value; empty for "nobody had anything"
     * @param ttl       lifetime of this entry
     */
    public record CachedResult(Object value, Set<String> providers, Duration ttl) {}

    public record Stats(long entries, long hits, long misses, double hitRate, long evictions) {}

    private final Cache<String, CachedResult> cache;

    public ProviderResultCache(long maxSize) {
        this(maxSize, Ticker.systemTicker());
    }

    public ProviderResultCache(long maxSize, Ticker ticker) {
        this.cache = Caffeine.newBuilder()
            .maximumSize(maxSize)
            .expireAfter(new PerEntryExpiry())
            .ticker(ticker)
            .recordStats()
            .build();
    }

    public Optional<CachedResult> get(String key) {
        return Optional.ofNullable(cache.getIfPresent(key));
    }

    public void put(String key, Object value, Set<String> providers, Duration ttl) {
        cache.put(key, new CachedResult(value, Set.copyOf(providers), ttl));
        logger.debug("Cached {} for {} (providers {})", key, ttl, providers);
    }

    public void invalidate(String key) {
        cache.invalidate(key);
    }

    /**
     * Drops every entry that holds data from {@code provider}.
     *
     * @return number of entries removed
     */
    public int invalidateProvider(String provider) {
        int before = cache.asMap().size();
        cache.asMap().values().removeIf(entry -> entry.providers().contains(provider));
        int removed = before - cache.asMap().size();
        logger.info("Invalidated {} cache entries from provider {}", removed, provider);
        return removed;
    }

    /**
     * @return number of entries removed
     */
    public int clear() {
        int size = cache.asMap().size();
        cache.invalidateAll();
        logger.info("Cleared {} cache entries", size);
        return size;
    }

    public Stats stats() {
        cache.cleanUp();
        CacheStats stats = cache.stats();
        return new Stats(cache.estimatedSize(), stats.hitCount(), stats.missCount(), stats.hitRate(),
            stats.evictionCount());
    }

    private static final class PerEntryExpiry implements Expiry<String, CachedResult> {

        @Override
        public long expireAfterCreate(String key, CachedResult value, long currentTime) {
            return value.ttl().toNanos();
        }

        @Override
        public long expireAfterUpdate(String key, CachedResult value, long currentTime, long currentDuration) {
            return value.ttl().toNanos();
        }

        @Override
        public long expireAfterRead(String key, CachedResult value, long currentTime, long currentDuration) {
            return currentDuration;
        }
    }
}
