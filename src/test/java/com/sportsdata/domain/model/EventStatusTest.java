package com.sportsdata.domain.model;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for EventStatus.
 */
class EventStatusTest {

    @Test
    void testPeriodAndClockOnlyKeptWithProgress() {
        EventStatus live = new EventStatus(EventState.LIVE, "Q3 4:12", 3, "4:12");
        EventStatus postponed = new EventStatus(EventState.POSTPONED, "Postponed", 3, "4:12");

        assertEquals(3, live.period());
        assertEquals("4:12", live.clock());
        assertNull(postponed.period());
        assertNull(postponed.clock());
        assertEquals("Postponed", postponed.detail());
    }

    @Test
    void testStateIsRequired() {
        assertThrows(NullPointerException.class, () -> new EventStatus(null, null, null, null));
    }
}
