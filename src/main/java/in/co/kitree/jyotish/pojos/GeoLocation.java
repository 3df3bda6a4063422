package in.co.kitree.jyotish.pojos;

public final class GeoLocation {

    public final double latitude;
    public final double longitude;

    private GeoLocation(double latitude, double longitude) {
        this.latitude = latitude;
        this.longitude = longitude;
    }

    public static GeoLocation of(double latitude, double longitude) {
        return new GeoLocation(latitude, longitude);
    }

    @Override
    public String toString() {
        return String.format("GeoLocation{lat=%.4f, lon=%.4f}", latitude, longitude);
    }
}
