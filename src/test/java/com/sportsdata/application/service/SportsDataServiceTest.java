package com.sportsdata.application.service;

import com.sportsdata.application.federation.ProviderFederator;
import com.sportsdata.application.federation.ProviderRegistration;
import com.sportsdata.application.federation.RequestOptions;
import com.sportsdata.domain.model.Event;
import com.sportsdata.domain.model.Team;
import com.sportsdata.domain.model.TeamStats;
import com.sportsdata.domain.ports.Operation;
import com.sportsdata.infrastructure.cache.CacheTtlPolicy;
import com.sportsdata.infrastructure.cache.ProviderResultCache;
import com.sportsdata.support.StubProvider;
import com.sportsdata.support.TestData;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for SportsDataService.
 */
class SportsDataServiceTest {

    private static final Instant NOW = Instant.parse("2024-01-15T12:00:00Z");

    private ExecutorService executorService;
    private StubProvider primary;
    private StubProvider secondary;
    private SportsDataService service;

    @BeforeEach
    void setUp() {
        executorService = Executors.newFixedThreadPool(4);
        primary = new StubProvider("primary", "nfl", "nba", "epl");
        secondary = new StubProvider("secondary", "nfl", "nba", "epl", "ahl");
        ProviderFederator federator = new ProviderFederator(
            List.of(new ProviderRegistration(primary, 0), new ProviderRegistration(secondary, 1)),
            new ProviderResultCache(1_000),
            CacheTtlPolicy.defaults(ZoneOffset.UTC, Clock.fixed(NOW, ZoneOffset.UTC)),
            executorService,
            Duration.ofSeconds(5),
            Set.of(Operation.LEAGUE_TEAMS));
        service = new SportsDataService(federator);
    }

    @AfterEach
    void tearDown() {
        executorService.shutdownNow();
    }

    @Test
    void testTeamScheduleIsSortedAndFetchedOnce() {
        Event week3 = TestData.event("primary", "401547003", "nfl", Instant.parse("2024-01-28T20:30:00Z"));
        Event week1 = TestData.event("primary", "401547001", "nfl", Instant.parse("2024-01-16T01:15:00Z"));
        Event week2 = TestData.event("primary", "401547002", "nfl", Instant.parse("2024-01-21T18:00:00Z"));
        primary.returning(Operation.TEAM_SCHEDULE, List.of(week3, week1, week2));

        List<Event> schedule = service.getTeamSchedule("133604", "nfl", 14);
        List<Event> again = service.getTeamSchedule("133604", "nfl", 14);

        assertEquals(List.of(week1, week2, week3), schedule);
        assertEquals(schedule, again);
        assertEquals(1, primary.calls(Operation.TEAM_SCHEDULE));
        assertEquals(0, secondary.calls(Operation.TEAM_SCHEDULE));
    }

    @Test
    void testLeagueOnlySupportedBySecondarySkipsPrimary() {
        secondary.returning(Operation.EVENTS,
            List.of(TestData.event("secondary", "2052711", "ahl", Instant.parse("2024-01-16T00:00:00Z"))));

        List<Event> events = service.getEvents("ahl", LocalDate.of(2024, 1, 15));

        assertEquals(1, events.size());
        assertEquals("secondary", events.get(0).provider());
        assertEquals(0, primary.totalCalls());
        assertTrue(service.failureCounts().isEmpty());
    }

    @Test
    void testEventsFromOtherLeaguesAreDropped() {
        primary.returning(Operation.EVENTS, List.of(
            TestData.event("primary", "1", "nfl", NOW),
            TestData.event("primary", "2", "nba", NOW),
            TestData.event("primary", "3", "nfl", NOW.minusSeconds(3600))));

        List<Event> events = service.getEvents("nfl", LocalDate.of(2024, 1, 15));

        assertEquals(List.of("3", "1"), events.stream().map(Event::id).toList());
        assertTrue(events.stream().allMatch(e -> e.league().equals("nfl")));
    }

    @Test
    void testExhaustedProvidersReturnEmptyWithoutThrowing() {
        primary.failing(Operation.TEAM);
        secondary.failing(Operation.TEAM);

        Optional<Team> team = assertDoesNotThrow(() -> service.getTeam("12", "nfl"));

        assertTrue(team.isEmpty());
        assertEquals(Map.of("primary", 1L, "secondary", 1L), service.failureCounts());
    }

    @Test
    void testTeamNotFoundByPrimaryIsServedBySecondary() {
        Team lions = TestData.team("secondary", "134934", "Detroit Lions", "nfl");
        secondary.returning(Operation.TEAM, Optional.of(lions));

        Optional<Team> team = service.getTeam("134934", "nfl");
        service.getTeam("134934", "nfl");

        assertEquals(Optional.of(lions), team);
        assertEquals(1, primary.calls(Operation.TEAM));
        assertEquals(1, secondary.calls(Operation.TEAM));
        assertTrue(service.failureCounts().isEmpty());
    }

    @Test
    void testFallbackToSecondaryOnPrimaryFailure() {
        primary.failing(Operation.TEAM_STATS);
        secondary.returning(Operation.TEAM_STATS, Optional.of(TeamStats.builder("10-4").wins(10).losses(4).build()));

        Optional<TeamStats> stats = service.getTeamStats("134931", "nfl");

        assertEquals("10-4", stats.orElseThrow().record());
        assertEquals(Map.of("primary", 1L), service.failureCounts());
    }

    @Test
    void testDateRangeFederatesEachDayOnce() {
        AtomicInteger day = new AtomicInteger();
        primary.answer(Operation.EVENTS, () -> {
            int offset = day.getAndIncrement();
            return List.of(TestData.event("primary", "d" + offset, "nfl", NOW.plus(Duration.ofDays(offset))));
        });

        List<Event> first = service.getEvents("nfl", LocalDate.of(2024, 1, 15), LocalDate.of(2024, 1, 17));
        List<Event> second = service.getEvents("nfl", LocalDate.of(2024, 1, 15), LocalDate.of(2024, 1, 17));

        assertEquals(List.of("d0", "d1", "d2"), first.stream().map(Event::id).toList());
        assertEquals(first, second);
        assertEquals(3, primary.calls(Operation.EVENTS));
    }

    @Test
    void testDateRangeTimeoutBoundsTheWholeRange() {
        AtomicInteger day = new AtomicInteger();
        primary.answer(Operation.EVENTS, () -> {
            int offset = day.getAndIncrement();
            try {
                Thread.sleep(400);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            return List.of(TestData.event("primary", "d" + offset, "nfl", NOW.plus(Duration.ofDays(offset))));
        });

        List<Event> events = service.getEvents("nfl", LocalDate.of(2024, 1, 15), LocalDate.of(2024, 1, 17),
            RequestOptions.withTimeout(Duration.ofMillis(600)));

        assertEquals(List.of("d0"), events.stream().map(Event::id).toList());
        assertEquals(2, primary.calls(Operation.EVENTS));
        assertEquals(0, secondary.calls(Operation.EVENTS));
    }

    @Test
    void testDateRangeRejectsReversedBounds() {
        assertThrows(IllegalArgumentException.class,
            () -> service.getEvents("nfl", LocalDate.of(2024, 1, 17), LocalDate.of(2024, 1, 15)));
    }

    @Test
    void testGetEventDropsEventFromAnotherLeague() {
        primary.returning(Operation.EVENT, Optional.of(TestData.event("primary", "7", "nba", NOW)));

        assertTrue(service.getEvent("7", "nfl").isEmpty());
        assertEquals(1, secondary.calls(Operation.EVENT));
    }

    @Test
    void testLeagueTeamsAreMergedAcrossProviders() {
        primary.returning(Operation.LEAGUE_TEAMS, List.of(TestData.team("primary", "12", "Kansas City Chiefs", "nfl")));
        secondary.returning(Operation.LEAGUE_TEAMS, List.of(
            TestData.team("secondary", "134931", "Kansas City Chiefs", "nfl"),
            TestData.team("secondary", "134918", "Buffalo Bills", "nfl")));

        List<Team> teams = service.getLeagueTeams("nfl");

        assertEquals(List.of("Buffalo Bills", "Kansas City Chiefs"), teams.stream().map(Team::name).toList());
        assertEquals("primary", teams.get(1).provider());
    }

    @Test
    void testTeamsByConferenceFallsBackWhenPrimaryHasNoStructure() {
        secondary.returning(Operation.TEAMS_BY_CONFERENCE,
            Map.of("AFC", List.of(TestData.team("secondary", "134931", "Kansas City Chiefs", "nfl"))));

        Map<String, List<Team>> conferences = service.getTeamsByConference("nfl");

        assertEquals(Set.of("AFC"), conferences.keySet());
        assertThrows(UnsupportedOperationException.class, () -> conferences.put("NFC", List.of()));
    }

    @Test
    void testBlankSearchQueryNeverReachesProviders() {
        assertTrue(service.searchTeams("  ", null).isEmpty());
        assertEquals(0, primary.totalCalls() + secondary.totalCalls());
    }

    @Test
    void testSearchWithoutLeagueAsksProvidersRegardlessOfLeagueSupport() {
        primary.returning(Operation.SEARCH_TEAMS, List.of(TestData.team("primary", "12", "Kansas City Chiefs", "nfl")));

        List<Team> teams = service.searchTeams("Chiefs", null);

        assertEquals(1, teams.size());
        assertEquals(1, primary.calls(Operation.SEARCH_TEAMS));
    }

    @Test
    void testForceRefreshOverloadRefetches() {
        primary.returning(Operation.TEAM, Optional.of(TestData.team("primary", "12", "Kansas City Chiefs", "nfl")));

        service.getTeam("12", "nfl");
        service.getTeam("12", "nfl", RequestOptions.refresh());

        assertEquals(2, primary.calls(Operation.TEAM));
    }

    @Test
    void testCacheDiagnostics() {
        primary.returning(Operation.TEAM, Optional.of(TestData.team("primary", "12", "Kansas City Chiefs", "nfl")));
        service.getTeam("12", "nfl");
        service.getTeam("12", "nfl");

        ProviderResultCache.Stats stats = service.cacheStats();
        assertEquals(1, stats.entries());
        assertTrue(stats.hits() >= 1);

        assertEquals(1, service.clearCache());
        assertEquals(0, service.cacheStats().entries());
    }

    @Test
    void testSupportsLeague() {
        assertTrue(service.supportsLeague("ahl"));
        assertFalse(service.supportsLeague("xfl"));
        assertEquals(List.of("primary", "secondary"), service.providerNames());
    }
}
