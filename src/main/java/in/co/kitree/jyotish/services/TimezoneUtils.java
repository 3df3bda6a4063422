package in.co.kitree.jyotish.services;

import net.iakovlev.timeshape.TimeZoneEngine;

import java.time.LocalDateTime;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.Map;
import java.util.Optional;

/**
 * Resolves the civil time zone of a birth or observation place with Timeshape.
 * When the polygons give no answer, a fixed offset of longitude / 15 hours (to the half hour) is used.
 */
public class TimezoneUtils {

    // Singleton instance of TimeZoneEngine; loading the polygons takes seconds
    private static volatile TimeZoneEngine timeZoneEngine;
    private static final Object lock = new Object();

    private static TimeZoneEngine getTimeZoneEngine() {
        if (timeZoneEngine == null) {
            synchronized (lock) {
                if (timeZoneEngine == null) {
                    long start = System.currentTimeMillis();
                    timeZoneEngine = TimeZoneEngine.initialize();
                    LoggingService.info("timezone_engine_initialized",
                            Map.of("durationMs", System.currentTimeMillis() - start));
                }
            }
        }
        return timeZoneEngine;
    }

    /**
     * Zone from the Timeshape polygons, if the point falls inside one.
     */
    public static Optional<ZoneId> getZoneId(double latitude, double longitude) {
        try {
            return getTimeZoneEngine().query(latitude, longitude);
        } catch (RuntimeException e) {
            LoggingService.error("timezone_get_zoneid_error", e,
                    Map.of("latitude", latitude, "longitude", longitude));
            return Optional.empty();
        }
    }

    /**
     * Zone for the place: an explicit id wins, then Timeshape, then the longitude fallback.
     *
     * @throws InputDomainException for an unparseable explicit id
     */
    public static ZoneId resolveZone(String explicitZoneId, double latitude, double longitude) {
        if (explicitZoneId != null && !explicitZoneId.isBlank()) {
            try {
                return ZoneId.of(explicitZoneId.trim());
            } catch (RuntimeException e) {
                throw new InputDomainException("Unknown time zone: " + explicitZoneId);
            }
        }
        SignUtils.requireGeoLocation(latitude, longitude);
        Optional<ZoneId> zone = getZoneId(latitude, longitude);
        if (zone.isPresent()) {
            return zone.get();
        }
        ZoneOffset fallback = getFallbackZoneOffset(longitude);
        LoggingService.warn("timezone_fallback_used", Map.of(
                "latitude", latitude, "longitude", longitude, "offset", fallback.getId()));
        return fallback;
    }

    /**
     * Offset in hours in force at the given local time, so historical dates get their own DST rules.
     */
    public static double getTimezoneOffset(LocalDateTime localDateTime, ZoneId zone) {
        return zone.getRules().getOffset(localDateTime).getTotalSeconds() / 3600.0;
    }

    /**
     * Fallback offset: each 15 degrees of longitude is one hour, rounded to the nearest half hour.
     */
    static double getFallbackTimezoneOffset(double longitude) {
        double timezoneOffset = longitude / 15.0;
        return Math.round(timezoneOffset * 2.0) / 2.0;
    }

    static ZoneOffset getFallbackZoneOffset(double longitude) {
        double offset = getFallbackTimezoneOffset(longitude);
        int hours = (int) offset;
        int minutes = (int) ((offset - hours) * 60);
        return ZoneOffset.ofHoursMinutes(hours, minutes);
    }
}
