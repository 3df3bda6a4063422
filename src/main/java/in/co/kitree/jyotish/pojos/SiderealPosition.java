package in.co.kitree.jyotish.pojos;

/**
 * One ephemeris reading: sidereal longitude in [0, 360) and daily motion in degrees.
 */
public final class SiderealPosition {

    public final double longitude;

    /** Degrees per day; negative while retrograde. */
    public final double speed;

    private SiderealPosition(double longitude, double speed) {
        this.longitude = longitude;
        this.speed = speed;
    }

    public static SiderealPosition of(double longitude, double speed) {
        return new SiderealPosition(longitude, speed);
    }

    public boolean isRetrograde() {
        return speed < 0;
    }

    @Override
    public String toString() {
        return String.format("SiderealPosition{longitude=%.6f, speed=%.6f}", longitude, speed);
    }
}
