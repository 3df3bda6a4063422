package in.co.kitree.jyotish.pojos;

public final class NakshatraPlacement {

    /** 0 = Ashwini ... 26 = Revati. */
    public final int nakshatra;

    /** Quarter of the nakshatra, 1 to 4. */
    public final int pada;

    /** Portion of the nakshatra already traversed, in [0, 1). */
    public final double fraction;

    private NakshatraPlacement(int nakshatra, int pada, double fraction) {
        this.nakshatra = nakshatra;
        this.pada = pada;
        this.fraction = fraction;
    }

    public static NakshatraPlacement of(int nakshatra, int pada, double fraction) {
        return new NakshatraPlacement(nakshatra, pada, fraction);
    }

    public Nakshatra asNakshatra() {
        return Nakshatra.of(nakshatra);
    }

    @Override
    public String toString() {
        return String.format("NakshatraPlacement{nakshatra=%d, pada=%d, fraction=%.6f}", nakshatra, pada, fraction);
    }
}
