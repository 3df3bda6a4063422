package in.co.kitree.jyotish.pojos;

/**
 * The three continuous panchanga limbs, with their angular span and value count.
 */
public enum PanchangaElementKind {
    TITHI(12.0, 30),
    NAKSHATRA(40.0 / 3.0, 27),
    YOGA(40.0 / 3.0, 27);

    private final double spanDegrees;
    private final int count;

    PanchangaElementKind(double spanDegrees, int count) {
        this.spanDegrees = spanDegrees;
        this.count = count;
    }

    public double getSpanDegrees() {
        return spanDegrees;
    }

    public int getCount() {
        return count;
    }
}
