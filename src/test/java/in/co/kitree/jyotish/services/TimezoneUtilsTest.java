package in.co.kitree.jyotish.services;

import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for TimezoneUtils with Timeshape integration
 */
public class TimezoneUtilsTest {

    @Test
    public void testTimeshapeIntegration() {
        Optional<ZoneId> delhi = TimezoneUtils.getZoneId(28.6139, 77.2090);
        assertTrue(delhi.isPresent(), "Delhi timezone should be found");
        assertEquals("Asia/Kolkata", delhi.get().getId());

        Optional<ZoneId> newYork = TimezoneUtils.getZoneId(40.7128, -74.0060);
        assertTrue(newYork.isPresent(), "New York timezone should be found");
        assertEquals("America/New_York", newYork.get().getId());
    }

    @Test
    public void testExplicitZoneWins() {
        // coordinates are in India but the caller asked for London
        assertEquals(ZoneId.of("Europe/London"), TimezoneUtils.resolveZone("Europe/London", 28.6139, 77.2090));
        assertEquals(ZoneId.of("Asia/Kolkata"), TimezoneUtils.resolveZone(" Asia/Kolkata ", 0.0, 0.0));
    }

    @Test
    public void testUnknownExplicitZoneRejected() {
        assertThrows(InputDomainException.class, () -> TimezoneUtils.resolveZone("Mars/Olympus", 28.6, 77.2));
    }

    @Test
    public void testResolveZoneFromCoordinates() {
        assertEquals(ZoneId.of("Asia/Kolkata"), TimezoneUtils.resolveZone(null, 28.6139, 77.2090));
        assertThrows(InputDomainException.class, () -> TimezoneUtils.resolveZone(null, 100.0, 0.0));
    }

    @Test
    public void testOffsetFollowsHistoricalDst() {
        ZoneId newYork = ZoneId.of("America/New_York");
        assertEquals(-4.0, TimezoneUtils.getTimezoneOffset(LocalDateTime.of(2024, 7, 1, 12, 0), newYork), 1e-9);
        assertEquals(-5.0, TimezoneUtils.getTimezoneOffset(LocalDateTime.of(2024, 1, 15, 12, 0), newYork), 1e-9);
        assertEquals(5.5, TimezoneUtils.getTimezoneOffset(LocalDateTime.of(1990, 5, 17, 9, 42),
                ZoneId.of("Asia/Kolkata")), 1e-9);
    }

    @Test
    public void testFallbackOffsetRoundsToHalfHour() {
        assertEquals(5.0, TimezoneUtils.getFallbackTimezoneOffset(77.2090), 1e-9);
        assertEquals(5.5, TimezoneUtils.getFallbackTimezoneOffset(82.5), 1e-9);
        assertEquals(-5.0, TimezoneUtils.getFallbackTimezoneOffset(-74.0060), 1e-9);
        assertEquals(ZoneOffset.ofHoursMinutes(5, 30), TimezoneUtils.getFallbackZoneOffset(82.5));
        assertEquals(ZoneOffset.ofHoursMinutes(-3, -30), TimezoneUtils.getFallbackZoneOffset(-52.5));
    }
}
