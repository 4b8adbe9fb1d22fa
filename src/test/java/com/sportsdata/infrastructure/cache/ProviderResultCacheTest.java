package com.sportsdata.infrastructure.cache;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Set;
import java.util.concurrent.atomic.AtomicLong;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for ProviderResultCache.
 */
class ProviderResultCacheTest {

    private AtomicLong nanos;
    private ProviderResultCache cache;

    @BeforeEach
    void setUp() {
        nanos = new AtomicLong();
        cache = new ProviderResultCache(100, nanos::get);
    }

    @Test
    void testEntryExpiresAfterItsOwnTtl() {
        cache.put("team:nfl:12", List.of("short"), Set.of("espn"), Duration.ofSeconds(30));
        cache.put("team:nfl:13", List.of("long"), Set.of("espn"), Duration.ofHours(1));

        nanos.addAndGet(Duration.ofSeconds(31).toNanos());

        assertTrue(cache.get("team:nfl:12").isEmpty());
        assertEquals(List.of("long"), cache.get("team:nfl:13").orElseThrow().value());
    }

    @Test
    void testOverwriteResetsTtl() {
        cache.put("events:nfl:2024-01-15", List.of("a"), Set.of("espn"), Duration.ofSeconds(30));
        nanos.addAndGet(Duration.ofSeconds(20).toNanos());
        cache.put("events:nfl:2024-01-15", List.of("b"), Set.of("espn"), Duration.ofSeconds(30));
        nanos.addAndGet(Duration.ofSeconds(20).toNanos());

        assertEquals(List.of("b"), cache.get("events:nfl:2024-01-15").orElseThrow().value());
    }

    @Test
    void testInvalidateProviderKeepsOtherProvidersEntries() {
        cache.put("a", "espn only", Set.of("espn"), Duration.ofHours(1));
        cache.put("b", "merged", Set.of("espn", "tsdb"), Duration.ofHours(1));
        cache.put("c", "tsdb only", Set.of("tsdb"), Duration.ofHours(1));

        assertEquals(2, cache.invalidateProvider("espn"));

        assertTrue(cache.get("a").isEmpty());
        assertTrue(cache.get("b").isEmpty());
        assertTrue(cache.get("c").isPresent());
    }

    @Test
    void testStatsCountHitsAndMisses() {
        cache.put("a", "value", Set.of("espn"), Duration.ofHours(1));
        cache.get("a");
        cache.get("a");
        cache.get("missing");

        ProviderResultCache.Stats stats = cache.stats();

        assertEquals(1, stats.entries());
        assertEquals(2, stats.hits());
        assertEquals(1, stats.misses());
        assertEquals(2.0 / 3.0, stats.hitRate(), 0.0001);
    }

    @Test
    void testClearRemovesEverything() {
        cache.put("a", "value", Set.of("espn"), Duration.ofHours(1));
        cache.put("b", "value", Set.of("tsdb"), Duration.ofHours(1));

        assertEquals(2, cache.clear());
        assertTrue(cache.get("a").isEmpty());
    }
}
