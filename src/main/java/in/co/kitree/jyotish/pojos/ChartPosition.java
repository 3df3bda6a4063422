package in.co.kitree.jyotish.pojos;

/**
 * Placement of the ascendant or a body inside one chart.
 *
 * <p>{@code degreeInSign} is always the D1 degree-in-sign; divisional charts move the sign only.</p>
 */
public final class ChartPosition {

    public final Sign sign;
    public final double degreeInSign;

    /** Whole-sign house, 1 to 12. */
    public final int house;

    /** 1-based division of the source sign the position fell in (1 for D1). */
    public final int division;

    public final boolean retrograde;

    private ChartPosition(Sign sign, double degreeInSign, int house, int division, boolean retrograde) {
        this.sign = sign;
        this.degreeInSign = degreeInSign;
        this.house = house;
        this.division = division;
        this.retrograde = retrograde;
    }

    public static ChartPosition of(Sign sign, double degreeInSign, int house, int division, boolean retrograde) {
        return new ChartPosition(sign, degreeInSign, house, division, retrograde);
    }

    @Override
    public String toString() {
        return String.format("ChartPosition{sign=%s, deg=%.4f, house=%d, division=%d%s}",
                sign, degreeInSign, house, division, retrograde ? ", R" : "");
    }
}
