package in.co.kitree.jyotish.pojos;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * D1 inputs for every chart: the sidereal ascendant plus all nine bodies at one instant.
 */
public final class NatalPositions {

    public final double julianDay;
    public final double ascendantLongitude;
    public final Map<Planet, SiderealPosition> bodies;

    private NatalPositions(double julianDay, double ascendantLongitude, Map<Planet, SiderealPosition> bodies) {
        this.julianDay = julianDay;
        this.ascendantLongitude = ascendantLongitude;
        this.bodies = Collections.unmodifiableMap(new EnumMap<>(bodies));
    }

    public static NatalPositions of(double julianDay, double ascendantLongitude, Map<Planet, SiderealPosition> bodies) {
        return new NatalPositions(julianDay, ascendantLongitude, bodies);
    }

    public SiderealPosition get(Planet planet) {
        return bodies.get(planet);
    }
}
