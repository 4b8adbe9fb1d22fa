package com.sportsdata.infrastructure.provider.espn;

import com.sportsdata.domain.model.Event;
import com.sportsdata.domain.model.Team;
import com.sportsdata.domain.ports.ProviderException;
import com.sportsdata.support.FixtureJsonFetcher;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for EspnProvider wired to fixture payloads.
 */
class EspnProviderTest {

    private static final ZoneId EASTERN = ZoneId.of("America/New_York");

    private FixtureJsonFetcher fetcher;
    private EspnProvider provider;

    @BeforeEach
    void setUp() {
        fetcher = new FixtureJsonFetcher()
            .route("/football/nfl/scoreboard", "/fixtures/espn/scoreboard.json")
            .route("/football/nfl/teams/12/schedule", "/fixtures/espn/schedule.json")
            .route("/football/nfl/teams/12", "/fixtures/espn/team.json")
            .route("/football/nfl/teams", "/fixtures/espn/teams.json")
            .route("/football/nfl/summary", "/fixtures/espn/summary.json")
            .route("/football/nfl/standings", "/fixtures/espn/standings.json");
        EspnClient client = new EspnClient(fetcher, EspnClient.DEFAULT_SITE_URL, EspnClient.DEFAULT_STANDINGS_URL);
        Clock clock = Clock.fixed(Instant.parse("2024-01-15T12:00:00Z"), ZoneOffset.UTC);
        provider = new EspnProvider(client, new EspnNormalizer(), EspnLeague.DEFAULTS, EASTERN, clock);
    }

    @Test
    void testEventsAreCutToTheLocalDate() throws ProviderException {
        List<Event> events = provider.getEvents("nfl", LocalDate.of(2024, 1, 15));

        assertEquals(List.of("401547005", "401547002", "401547003"), events.stream().map(Event::id).toList());
        FixtureJsonFetcher.Request request = fetcher.requests().get(0);
        assertEquals("https://site.api.espn.com/apis/site/v2/sports/football/nfl/scoreboard", request.url());
        assertEquals("20240114-20240116", request.params().get("dates"));
    }

    @Test
    void testUnsupportedLeagueNeverReachesNetwork() throws ProviderException {
        assertFalse(provider.supportsLeague("ahl"));
        assertTrue(provider.getEvents("ahl", LocalDate.of(2024, 1, 15)).isEmpty());
        assertTrue(provider.getTeam("1", "ahl").isEmpty());
        assertTrue(fetcher.requests().isEmpty());
    }

    @Test
    void testTeamScheduleKeepsUpcomingWindow() throws ProviderException {
        List<Event> schedule = provider.getTeamSchedule("12", "nfl", 14);

        assertEquals(List.of("401547010"), schedule.stream().map(Event::id).toList());
    }

    @Test
    void testGetTeamAndStats() throws ProviderException {
        Team team = provider.getTeam("12", "nfl").orElseThrow();

        assertEquals("Kansas City Chiefs", team.name());
        assertEquals("KC", team.abbreviation());
        assertEquals("https://a.espncdn.com/i/teamlogos/nfl/500/kc.png", team.logoUrl());
        assertEquals("11-6", provider.getTeamStats("12", "nfl").orElseThrow().record());
    }

    @Test
    void testMissingResourceIsEmpty() throws ProviderException {
        assertTrue(provider.getTeam("404", "nfl").isEmpty());
        assertTrue(provider.getTeamStats("404", "nfl").isEmpty());
        assertTrue(provider.getEvent("1", "nba").isEmpty());
    }

    @Test
    void testGetEventFromSummary() throws ProviderException {
        Event event = provider.getEvent("401547003", "nfl").orElseThrow();

        assertEquals("401547003", event.id());
        assertEquals(Map.of("event", "401547003"), fetcher.requests().get(0).params());
    }

    @Test
    void testLeagueTeamsAreSortedByName() throws ProviderException {
        List<Team> teams = provider.getLeagueTeams("nfl");

        assertEquals(List.of("Buffalo Bills", "Detroit Lions", "Kansas City Chiefs"),
            teams.stream().map(Team::name).toList());
    }

    @Test
    void testTeamsByConference() throws ProviderException {
        assertEquals(2, provider.getTeamsByConference("nfl").size());
        assertTrue(provider.getTeamsByConference("epl").isEmpty());
    }

    @Test
    void testSearchRanksLeagueTeams() throws ProviderException {
        List<Team> teams = provider.searchTeams("chiefs", "nfl");

        assertEquals(1, teams.size());
        assertEquals("12", teams.get(0).id());
    }

    @Test
    void testTransportFailurePropagates() {
        fetcher.fail("/scoreboard", new ProviderException("espn", ProviderException.Kind.TRANSPORT, "HTTP 503"));

        ProviderException error = assertThrows(ProviderException.class,
            () -> provider.getEvents("nfl", LocalDate.of(2024, 1, 15)));
        assertEquals(ProviderException.Kind.TRANSPORT, error.getKind());
    }
}
