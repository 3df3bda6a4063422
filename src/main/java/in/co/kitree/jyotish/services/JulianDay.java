package in.co.kitree.jyotish.services;

import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneId;

/**
 * Julian Day (UT) conversions.
 */
public final class JulianDay {

    /** JD of 1970-01-01T00:00:00Z. */
    public static final double UNIX_EPOCH_JD = 2440587.5;
    public static final double SECONDS_PER_DAY = 86400.0;

    private JulianDay() {}

    public static double fromInstant(Instant instant) {
        double seconds = instant.getEpochSecond() + instant.getNano() / 1e9;
        return UNIX_EPOCH_JD + seconds / SECONDS_PER_DAY;
    }

    public static double fromLocal(LocalDateTime localDateTime, ZoneId zone) {
        return fromInstant(localDateTime.atZone(zone).toInstant());
    }

    /**
     * Nearest microsecond; finer digits are below ephemeris precision.
     */
    public static Instant toInstant(double julianDay) {
        double seconds = (julianDay - UNIX_EPOCH_JD) * SECONDS_PER_DAY;
        long micros = Math.round(seconds * 1e6);
        return Instant.ofEpochSecond(Math.floorDiv(micros, 1_000_000L), Math.floorMod(micros, 1_000_000L) * 1000L);
    }

    /** Julian centuries since J2000.0. */
    public static double centuriesSinceJ2000(double julianDay) {
        return (julianDay - 2451545.0) / 36525.0;
    }
}
