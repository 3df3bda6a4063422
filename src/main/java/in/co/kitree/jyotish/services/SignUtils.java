package in.co.kitree.jyotish.services;

import in.co.kitree.jyotish.pojos.NakshatraPlacement;
import in.co.kitree.jyotish.pojos.SignPlacement;

/**
 * Longitude to sign / nakshatra / pada arithmetic. All methods are static.
 */
public final class SignUtils {

    public static final double SIGN_SPAN = 30.0;
    public static final double NAKSHATRA_SPAN = 40.0 / 3.0;
    public static final double PADA_SPAN = NAKSHATRA_SPAN / 4.0;

    private SignUtils() {}

    /**
     * Reduce any finite angle into [0, 360).
     */
    public static double normalize(double degrees) {
        double d = degrees % 360.0;
        if (d < 0) {
            d += 360.0;
        }
        // -1e-17 % 360 + 360 rounds to exactly 360
        return d >= 360.0 ? 0.0 : d;
    }

    public static SignPlacement signOf(double longitude) {
        double lon = normalize(longitude);
        int sign = Math.min((int) Math.floor(lon / SIGN_SPAN), 11);
        return SignPlacement.of(sign, lon - sign * SIGN_SPAN);
    }

    public static int signIndex(double longitude) {
        return signOf(longitude).sign;
    }

    public static NakshatraPlacement nakshatraOf(double longitude) {
        double lon = normalize(longitude);
        int nakshatra = Math.min((int) Math.floor(lon / NAKSHATRA_SPAN), 26);
        double into = lon - nakshatra * NAKSHATRA_SPAN;
        int pada = Math.min((int) Math.floor(into / PADA_SPAN), 3) + 1;
        return NakshatraPlacement.of(nakshatra, pada, into / NAKSHATRA_SPAN);
    }

    /**
     * Entry check for externally supplied longitudes. Everything past this point assumes finite input.
     */
    public static double requireLongitude(String label, double longitude) {
        if (Double.isNaN(longitude) || Double.isInfinite(longitude)) {
            throw new InputDomainException(label + " longitude is not a finite number: " + longitude);
        }
        return normalize(longitude);
    }

    public static void requireGeoLocation(double latitude, double longitude) {
        if (Double.isNaN(latitude) || latitude < -90.0 || latitude > 90.0) {
            throw new InputDomainException("Latitude must be within [-90, 90]: " + latitude);
        }
        if (Double.isNaN(longitude) || longitude < -180.0 || longitude > 180.0) {
            throw new InputDomainException("Longitude must be within [-180, 180]: " + longitude);
        }
    }
}
