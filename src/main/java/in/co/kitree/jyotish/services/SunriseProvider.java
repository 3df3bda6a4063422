package in.co.kitree.jyotish.services;

import in.co.kitree.jyotish.pojos.GeoLocation;

import java.time.LocalDate;

/**
 * Sunrise and sunset for a civil date, as Julian Days (UT).
 */
public interface SunriseProvider {

    /**
     * @throws BoundaryNotFoundException if the Sun does not rise at that place on that date
     */
    double sunrise(LocalDate date, GeoLocation location);

    /**
     * @throws BoundaryNotFoundException if the Sun does not set at that place on that date
     */
    double sunset(LocalDate date, GeoLocation location);
}
