package com.sportsdata.infrastructure.cache;

import com.sportsdata.domain.model.EventState;
import com.sportsdata.domain.ports.Operation;
import com.sportsdata.support.TestData;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for CacheTtlPolicy.
 */
class CacheTtlPolicyTest {

    private static final Instant NOW = Instant.parse("2024-01-15T17:00:00Z");
    private static final ZoneId EASTERN = ZoneId.of("America/New_York");

    private final CacheTtlPolicy policy = CacheTtlPolicy.defaults(EASTERN, Clock.fixed(NOW, EASTERN));

    @Test
    void testEventsTtlIsTieredByDate() {
        assertEquals(Duration.ofDays(180), policy.ttlFor(Operation.EVENTS, List.of(), LocalDate.of(2024, 1, 10)));
        assertEquals(Duration.ofMinutes(30), policy.ttlFor(Operation.EVENTS, List.of(), LocalDate.of(2024, 1, 15)));
        assertEquals(Duration.ofHours(4), policy.ttlFor(Operation.EVENTS, List.of(), LocalDate.of(2024, 1, 16)));
        assertEquals(Duration.ofHours(8), policy.ttlFor(Operation.EVENTS, List.of(), LocalDate.of(2024, 1, 17)));
    }

    @Test
    void testTodayIsResolvedInConfiguredZone() {
        // 02:00 UTC on the 16th is still the 15th in New York
        CacheTtlPolicy lateEvening = CacheTtlPolicy.defaults(EASTERN,
            Clock.fixed(Instant.parse("2024-01-16T02:00:00Z"), EASTERN));

        assertEquals(Duration.ofMinutes(30),
            lateEvening.ttlFor(Operation.EVENTS, List.of(), LocalDate.of(2024, 1, 15)));
    }

    @Test
    void testLiveEventShortensTtl() {
        List<Object> events = List.of(
            TestData.event("espn", "1", "nfl", NOW, EventState.FINAL),
            TestData.event("espn", "2", "nfl", NOW, EventState.LIVE));

        assertEquals(Duration.ofSeconds(30), policy.ttlFor(Operation.EVENTS, events, LocalDate.of(2024, 1, 10)));
        assertEquals(Duration.ofSeconds(30), policy.ttlFor(Operation.EVENT,
            Optional.of(TestData.event("espn", "2", "nfl", NOW, EventState.LIVE)), null));
    }

    @Test
    void testOperationDefaults() {
        assertEquals(Duration.ofHours(24), policy.ttlFor(Operation.TEAM, Optional.empty(), null));
        assertEquals(Duration.ofHours(8), policy.ttlFor(Operation.TEAM_SCHEDULE, List.of(), null));
        assertEquals(Duration.ofHours(4), policy.ttlFor(Operation.TEAM_STATS, Optional.empty(), null));
        assertEquals(Duration.ofMinutes(30), policy.ttlFor(Operation.EVENT, Optional.empty(), null));
        assertEquals(Duration.ofHours(1), policy.ttlFor(Operation.SEARCH_TEAMS, List.of(), null));
        assertEquals(Duration.ofMinutes(2), policy.emptyTtl());
    }

    @Test
    void testOverridesReplaceDefaults() {
        CacheTtlPolicy custom = new CacheTtlPolicy(Map.of("team-stats", Duration.ofMinutes(10)), EASTERN,
            Clock.fixed(NOW, EASTERN));

        assertEquals(Duration.ofMinutes(10), custom.ttlFor(Operation.TEAM_STATS, Optional.empty(), null));
        assertEquals(Duration.ofHours(24), custom.ttlFor(Operation.TEAM, Optional.empty(), null));
    }

    @Test
    void testUnknownOrNonPositiveOverrideIsRejected() {
        assertThrows(IllegalArgumentException.class,
            () -> new CacheTtlPolicy(Map.of("teams", Duration.ofMinutes(1)), EASTERN, Clock.systemUTC()));
        assertThrows(IllegalArgumentException.class,
            () -> new CacheTtlPolicy(Map.of("team", Duration.ZERO), EASTERN, Clock.systemUTC()));
    }
}
