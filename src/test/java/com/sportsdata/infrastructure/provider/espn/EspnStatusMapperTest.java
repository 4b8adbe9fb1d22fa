package com.sportsdata.infrastructure.provider.espn;

import com.sportsdata.domain.model.EventState;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for EspnStatusMapper.
 */
class EspnStatusMapperTest {

    @Test
    void testKnownStatuses() {
        assertEquals(EventState.SCHEDULED, EspnStatusMapper.map("STATUS_SCHEDULED"));
        assertEquals(EventState.LIVE, EspnStatusMapper.map("STATUS_HALFTIME"));
        assertEquals(EventState.FINAL, EspnStatusMapper.map("STATUS_FINAL_OT"));
        assertEquals(EventState.POSTPONED, EspnStatusMapper.map("STATUS_POSTPONED"));
        assertEquals(EventState.CANCELLED, EspnStatusMapper.map("STATUS_CANCELED"));
    }

    @Test
    void testUnknownStatusHasNoMapping() {
        assertNull(EspnStatusMapper.map("STATUS_WEATHER_HOLD"));
        assertNull(EspnStatusMapper.map(null));
    }

    @Test
    void testSeasonTypes() {
        assertEquals("preseason", EspnStatusMapper.mapSeasonType(1));
        assertEquals("regular", EspnStatusMapper.mapSeasonType(2));
        assertEquals("postseason", EspnStatusMapper.mapSeasonType(3));
        assertNull(EspnStatusMapper.mapSeasonType(4));
    }
}
