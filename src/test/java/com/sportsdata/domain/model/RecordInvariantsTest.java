package com.sportsdata.domain.model;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for the required fields of Team, Venue and TeamStats.
 */
class RecordInvariantsTest {

    @Test
    void testTeamRequiresIdentityFields() {
        assertThrows(IllegalArgumentException.class,
            () -> new Team(" ", "espn", "Detroit Lions", null, null, "nfl", null, null, null));
        assertThrows(IllegalArgumentException.class,
            () -> new Team("8", "espn", "Detroit Lions", null, null, "", null, null, null));
    }

    @Test
    void testVenueRequiresName() {
        assertThrows(IllegalArgumentException.class, () -> new Venue(null, "Detroit", "MI", null));
        assertNull(new Venue("Ford Field", null, null, null).city());
    }

    @Test
    void testTeamStatsRequiresRecord() {
        assertThrows(IllegalArgumentException.class, () -> TeamStats.builder(" ").build());
        assertEquals(0, TeamStats.builder("0-0").build().wins());
    }
}
