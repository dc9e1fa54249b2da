package io.trading.optionchain.core;

import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;

import static org.junit.jupiter.api.Assertions.*;

class MarketHoursTest {

    private static final ZoneId IST = ZoneId.of("Asia/Kolkata");

    private final MarketHours hours = new MarketHours(LocalTime.of(9, 15), LocalTime.of(15, 30), IST);

    private static ZonedDateTime ist(int day, int hour, int minute) {
        // January 2025: the 2nd is a Thursday
        return LocalDateTime.of(2025, 1, day, hour, minute).atZone(IST);
    }

    @Test
    void testPhases() {
        assertEquals(MarketHours.Phase.BEFORE_OPEN, hours.phase(ist(2, 9, 14)));
        assertEquals(MarketHours.Phase.IN_MARKET, hours.phase(ist(2, 9, 15)));
        assertEquals(MarketHours.Phase.IN_MARKET, hours.phase(ist(2, 15, 29)));
        assertEquals(MarketHours.Phase.AFTER_CLOSE, hours.phase(ist(2, 15, 30)));
        assertEquals(MarketHours.Phase.WEEKEND, hours.phase(ist(4, 11, 0)));
        assertEquals(MarketHours.Phase.WEEKEND, hours.phase(ist(5, 11, 0)));
    }

    @Test
    void testPhaseUsesExchangeZone() {
        ZonedDateTime utc = ZonedDateTime.of(2025, 1, 2, 4, 0, 0, 0, ZoneId.of("UTC"));

        assertTrue(hours.isOpen(utc));
        assertFalse(hours.isOpen(utc.minusHours(1)));
    }

    @Test
    void testSessionClose() {
        assertEquals(ist(2, 15, 30), hours.sessionClose(ist(2, 10, 0)));
    }

    @Test
    void testNextOpen() {
        assertEquals(ist(2, 9, 15), hours.nextOpen(ist(2, 8, 0)));
        assertEquals(ist(3, 9, 15), hours.nextOpen(ist(2, 16, 0)));
        assertEquals(ist(6, 9, 15), hours.nextOpen(ist(3, 16, 0)));
        assertEquals(ist(6, 9, 15), hours.nextOpen(ist(4, 8, 0)));
    }

    @Test
    void testOpenMustPrecedeClose() {
        assertThrows(IllegalArgumentException.class,
            () -> new MarketHours(LocalTime.of(15, 30), LocalTime.of(9, 15), IST));
    }
}
