package in.co.kitree.jyotish.services;

import in.co.kitree.jyotish.pojos.Planet;
import in.co.kitree.jyotish.pojos.SiderealPosition;

/**
 * Source of sidereal positions. Implementations must be deterministic and safe for concurrent reads.
 *
 * <p>Implementations need not know Ketu: {@link #bodyPosition} derives it from Rahu.</p>
 */
public interface EphemerisAdapter {

    /**
     * @param planet     any planet except {@link Planet#KETU}
     * @param julianDay  Julian Day (UT)
     * @throws EphemerisException when the lookup fails
     */
    SiderealPosition position(Planet planet, double julianDay);

    /**
     * Sidereal longitude of the rising degree for a place and instant.
     */
    double siderealAscendant(double julianDay, double latitude, double longitude);

    /**
     * Like {@link #position} but also answers for Ketu, as Rahu + 180 with Rahu's speed.
     */
    default SiderealPosition bodyPosition(Planet planet, double julianDay) {
        if (planet.isDerived()) {
            SiderealPosition rahu = position(Planet.RAHU, julianDay);
            return SiderealPosition.of(SignUtils.normalize(rahu.longitude + 180.0), rahu.speed);
        }
        return position(planet, julianDay);
    }

    /**
     * Longitude alone, for any body including Ketu. Boundary searches read through this, so adapters that
     * pay extra to estimate speed should override it.
     */
    default double longitude(Planet planet, double julianDay) {
        return bodyPosition(planet, julianDay).longitude;
    }
}
