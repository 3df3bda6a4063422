package in.co.kitree.jyotish.services;

import in.co.kitree.jyotish.pojos.Planet;
import in.co.kitree.jyotish.pojos.SiderealPosition;

import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;

/**
 * Memoizes another adapter by exact (body, Julian Day) and (Julian Day, place).
 * Lookups are idempotent, so the cache never changes results. The delegate is called outside the maps;
 * two threads racing on one key may both call it, and the first stored answer wins.
 */
public class CachingEphemerisAdapter implements EphemerisAdapter {

    private final EphemerisAdapter delegate;
    private final Map<PositionKey, SiderealPosition> positions = new ConcurrentHashMap<>();
    private final Map<PositionKey, Double> longitudes = new ConcurrentHashMap<>();
    private final Map<AscendantKey, Double> ascendants = new ConcurrentHashMap<>();

    public CachingEphemerisAdapter(EphemerisAdapter delegate) {
        this.delegate = delegate;
    }

    @Override
    public SiderealPosition position(Planet planet, double julianDay) {
        return lookup(positions, new PositionKey(planet, julianDay),
                key -> delegate.position(key.planet, key.julianDay));
    }

    /**
     * Served from a cached full position when there is one, otherwise from the delegate's own longitude read.
     */
    @Override
    public double longitude(Planet planet, double julianDay) {
        PositionKey key = new PositionKey(planet, julianDay);
        SiderealPosition known = positions.get(key);
        if (known != null) {
            return known.longitude;
        }
        return lookup(longitudes, key, k -> delegate.longitude(k.planet, k.julianDay));
    }

    @Override
    public double siderealAscendant(double julianDay, double latitude, double longitude) {
        return lookup(ascendants, new AscendantKey(julianDay, latitude, longitude),
                key -> delegate.siderealAscendant(key.julianDay, key.latitude, key.longitude));
    }

    public int size() {
        return positions.size() + longitudes.size() + ascendants.size();
    }

    public void clear() {
        positions.clear();
        longitudes.clear();
        ascendants.clear();
    }

    private static <K, V> V lookup(Map<K, V> cache, K key, Function<K, V> loader) {
        V value = cache.get(key);
        if (value == null) {
            value = loader.apply(key);
            V raced = cache.putIfAbsent(key, value);
            if (raced != null) {
                value = raced;
            }
        }
        return value;
    }

    private static final class PositionKey {
        private final Planet planet;
        private final double julianDay;

        PositionKey(Planet planet, double julianDay) {
            this.planet = planet;
            this.julianDay = julianDay;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) {
                return true;
            }
            if (!(o instanceof PositionKey)) {
                return false;
            }
            PositionKey other = (PositionKey) o;
            return planet == other.planet && Double.compare(julianDay, other.julianDay) == 0;
        }

        @Override
        public int hashCode() {
            return Objects.hash(planet, julianDay);
        }
    }

    private static final class AscendantKey {
        private final double julianDay;
        private final double latitude;
        private final double longitude;

        AscendantKey(double julianDay, double latitude, double longitude) {
            this.julianDay = julianDay;
            this.latitude = latitude;
            this.longitude = longitude;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) {
                return true;
            }
            if (!(o instanceof AscendantKey)) {
                return false;
            }
            AscendantKey other = (AscendantKey) o;
            return Double.compare(julianDay, other.julianDay) == 0
                    && Double.compare(latitude, other.latitude) == 0
                    && Double.compare(longitude, other.longitude) == 0;
        }

        @Override
        public int hashCode() {
            return Objects.hash(julianDay, latitude, longitude);
        }
    }
}
