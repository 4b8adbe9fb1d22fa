package com.sportsdata.infrastructure.normalization;

import com.sportsdata.domain.model.Team;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for TeamSearch.
 */
class TeamSearchTest {

    private static final Team LIONS = team("8", "Detroit Lions", "Lions", "DET");
    private static final Team RAMS = team("14", "Los Angeles Rams", "Rams", "LAR");
    private static final Team CHARGERS = team("24", "Los Angeles Chargers", "Chargers", "LAC");
    private static final Team MONTREAL = team("8", "Montréal Canadiens", "Canadiens", "MTL");

    @Test
    void testExactNameBeatsPrefixAndSubstring() {
        Team reserve = team("50", "Detroit Lions Reserve", "Reserve", "DLR");

        List<Team> ranked = TeamSearch.rank(List.of(reserve, LIONS), "detroit lions");

        assertEquals(List.of(LIONS, reserve), ranked);
    }

    @Test
    void testAbbreviationAndShortNameMatch() {
        assertEquals(List.of(RAMS), TeamSearch.rank(List.of(LIONS, RAMS, CHARGERS), "LAR"));
        assertEquals(List.of(RAMS), TeamSearch.rank(List.of(LIONS, RAMS, CHARGERS), "rams"));
    }

    @Test
    void testWordPrefixMatchesSortedByName() {
        assertEquals(List.of(CHARGERS, RAMS), TeamSearch.rank(List.of(LIONS, RAMS, CHARGERS), "angeles"));
    }

    @Test
    void testAccentInsensitive() {
        assertEquals(List.of(MONTREAL), TeamSearch.rank(List.of(LIONS, MONTREAL), "montreal"));
    }

    @Test
    void testAllQueryWordsAsPrefixes() {
        assertEquals(List.of(CHARGERS), TeamSearch.rank(List.of(LIONS, RAMS, CHARGERS), "los char"));
    }

    @Test
    void testMisspelledQueryMatchesFuzzily() {
        Team chiefs = team("12", "Kansas City Chiefs", "Chiefs", "KC");

        assertEquals(List.of(chiefs), TeamSearch.rank(List.of(LIONS, RAMS, chiefs), "Cheifs"));
        assertEquals(List.of(MONTREAL), TeamSearch.rank(List.of(LIONS, MONTREAL), "canadians"));
    }

    @Test
    void testFuzzyTierRanksBelowExactMatches() {
        Team lionesses = team("60", "London Lionesses", "Lionesses", "LDN");

        assertEquals(List.of(LIONS, lionesses), TeamSearch.rank(List.of(lionesses, LIONS), "lions"));
    }

    @Test
    void testUnrelatedQueryMatchesNothing() {
        assertTrue(TeamSearch.rank(List.of(LIONS, RAMS, CHARGERS), "packers").isEmpty());
        assertTrue(TeamSearch.rank(List.of(LIONS, RAMS, CHARGERS), "lam").isEmpty());
    }

    @Test
    void testBlankQueryMatchesNothing() {
        assertTrue(TeamSearch.rank(List.of(LIONS), "  ").isEmpty());
    }

    private static Team team(String id, String name, String shortName, String abbreviation) {
        return new Team(id, "espn", name, shortName, abbreviation, "nfl", "football", null, null);
    }
}
