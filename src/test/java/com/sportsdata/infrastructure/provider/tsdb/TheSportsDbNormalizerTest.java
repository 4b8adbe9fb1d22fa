package com.sportsdata.infrastructure.provider.tsdb;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sportsdata.domain.model.EventState;
import com.sportsdata.domain.model.Team;
import com.sportsdata.domain.model.TeamStats;
import com.sportsdata.infrastructure.normalization.NormalizationException;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.InputStream;
import java.time.Instant;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for TheSportsDbNormalizer.
 */
class TheSportsDbNormalizerTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final TheSportsDbLeague AHL = TheSportsDbLeague.DEFAULTS.get("ahl");
    private static final TheSportsDbLeague NBA = TheSportsDbLeague.DEFAULTS.get("nba");
    private static final TheSportsDbLeague EPL = TheSportsDbLeague.DEFAULTS.get("epl");

    private final TheSportsDbNormalizer normalizer = new TheSportsDbNormalizer();

    @Test
    void testTeamFields() throws IOException {
        Team team = normalizer.normalizeTeams(fixture("teams_epl.json"), EPL).get(0);

        assertEquals("133604", team.id());
        assertEquals("tsdb", team.provider());
        assertEquals("Arsenal", team.name());
        assertEquals("Arsenal Football Club", team.shortName());
        assertEquals("ARS", team.abbreviation());
        assertEquals("epl", team.league());
        assertEquals("soccer", team.sport());
        assertEquals("EF0107", team.color());
    }

    @Test
    void testTimestampWithAndWithoutOffset() {
        assertEquals(Instant.parse("2024-01-16T00:00:00Z"),
            TheSportsDbNormalizer.parseTimestamp("2024-01-16T00:00:00", "1"));
        assertEquals(Instant.parse("2024-01-15T20:00:00Z"),
            TheSportsDbNormalizer.parseTimestamp("2024-01-15T20:00:00+00:00", "1"));
        assertThrows(NormalizationException.class, () -> TheSportsDbNormalizer.parseTimestamp("tomorrow", "1"));
    }

    @Test
    void testMissingStatusIsScheduled() throws IOException {
        JsonNode event = MAPPER.readTree("{\"idEvent\": \"1\", \"strStatus\": null, \"strProgress\": \"5\"}");

        assertEquals(EventState.SCHEDULED, normalizer.normalizeStatus(event, "1").state());
        assertNull(normalizer.normalizeStatus(event, "1").clock());
    }

    @Test
    void testNormalizingTwiceYieldsEqualRecords() throws IOException {
        JsonNode payload = fixture("eventsday_ahl.json");
        Map<String, Team> roster = Map.of();

        assertEquals(normalizer.normalizeEvents(payload, AHL, roster), normalizer.normalizeEvents(payload, AHL, roster));
    }

    @Test
    void testEventWithoutTimestampIsDropped() throws IOException {
        assertTrue(normalizer.normalizeEvents(fixture("eventsday_ahl.json"), AHL, Map.of()).stream()
            .noneMatch(e -> e.id().equals("2052714")));
    }

    @Test
    void testNonSoccerRecordOmitsZeroDraws() throws IOException {
        JsonNode row = MAPPER.readTree("{\"idTeam\": \"134860\", \"intRank\": \"3\", \"intWin\": \"30\","
            + " \"intLoss\": \"12\", \"intDraw\": \"0\", \"strForm\": \"WWLLL\"}");

        TeamStats stats = normalizer.normalizeTeamStats(row, NBA);

        assertEquals("30-12", stats.record());
        assertEquals("L3", stats.streak());
    }

    @Test
    void testRowWithoutWinsHasNoStats() throws IOException {
        assertNull(normalizer.normalizeTeamStats(MAPPER.readTree("{\"idTeam\": \"1\"}"), EPL));
    }

    private static JsonNode fixture(String name) throws IOException {
        try (InputStream in = TheSportsDbNormalizerTest.class.getResourceAsStream("/fixtures/tsdb/" + name)) {
            return MAPPER.readTree(in);
        }
    }
}
