package in.co.kitree.jyotish.services;

import in.co.kitree.jyotish.pojos.GeoLocation;

import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.Map;

/**
 * Sunrise equation (NOAA / Meeus low-precision form), accurate to about a minute.
 *
 * <p>Rise and set are taken when the Sun's upper limb, corrected for standard refraction, touches the
 * horizon: geometric altitude -0.833°.</p>
 */
public class NoaaSunriseCalculator implements SunriseProvider {

    private static final double J2000 = 2451545.0;
    // TT - UT, in days
    private static final double DELTA_T_DAYS = 0.0008;
    private static final double HORIZON_ALTITUDE = -0.833;
    private static final double OBLIQUITY = 23.4397;

    @Override
    public double sunrise(LocalDate date, GeoLocation location) {
        return transitJd(date, location) - hourAngle(date, location, "sunrise") / 360.0;
    }

    @Override
    public double sunset(LocalDate date, GeoLocation location) {
        return transitJd(date, location) + hourAngle(date, location, "sunset") / 360.0;
    }

    /**
     * Solar noon as Julian Day (UT).
     */
    public double transitJd(LocalDate date, GeoLocation location) {
        double meanSolarTime = meanSolarTime(date, location);
        double m = meanAnomaly(meanSolarTime);
        double lambda = eclipticLongitude(m);
        return J2000 + meanSolarTime + 0.0053 * sin(m) - 0.0069 * sin(2 * lambda);
    }

    private double hourAngle(LocalDate date, GeoLocation location, String event) {
        double lambda = eclipticLongitude(meanAnomaly(meanSolarTime(date, location)));
        double sinDeclination = sin(lambda) * sin(OBLIQUITY);
        double cosDeclination = Math.cos(Math.asin(sinDeclination));
        double cosOmega = (sin(HORIZON_ALTITUDE) - sin(location.latitude) * sinDeclination)
                / (Math.cos(Math.toRadians(location.latitude)) * cosDeclination);
        if (cosOmega < -1.0 || cosOmega > 1.0) {
            LoggingService.warn("sun_event_missing", Map.of("event", event, "date", date.toString(),
                    "latitude", location.latitude, "longitude", location.longitude));
            throw new BoundaryNotFoundException(String.format("No %s on %s at latitude %.4f (%s)",
                    event, date, location.latitude, cosOmega > 1.0 ? "polar night" : "midnight sun"));
        }
        return Math.toDegrees(Math.acos(cosOmega));
    }

    /** Days since J2000 to local mean solar noon, east longitudes positive. */
    private static double meanSolarTime(LocalDate date, GeoLocation location) {
        double noonJd = JulianDay.fromInstant(date.atTime(12, 0).toInstant(ZoneOffset.UTC));
        return Math.round(noonJd - J2000) + DELTA_T_DAYS - location.longitude / 360.0;
    }

    private static double meanAnomaly(double meanSolarTime) {
        return SignUtils.normalize(357.5291 + 0.98560028 * meanSolarTime);
    }

    private static double eclipticLongitude(double meanAnomaly) {
        double center = 1.9148 * sin(meanAnomaly) + 0.0200 * sin(2 * meanAnomaly) + 0.0003 * sin(3 * meanAnomaly);
        return SignUtils.normalize(meanAnomaly + center + 180.0 + 102.9372);
    }

    private static double sin(double degrees) {
        return Math.sin(Math.toRadians(degrees));
    }
}
