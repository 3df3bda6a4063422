package in.co.kitree.jyotish.pojos;

import java.time.Instant;

public final class DashaTimeline {

    public final Instant birth;
    public final Nakshatra birthNakshatra;
    public final Planet startingLord;

    /** Portion of the birth nakshatra the Moon had already crossed. */
    public final double elapsedFraction;

    /** Years of the first Mahadasha still to run at birth. */
    public final double balanceYears;

    public final int depth;
    public final DashaInterval root;

    private DashaTimeline(Instant birth, Nakshatra birthNakshatra, Planet startingLord, double elapsedFraction,
                          double balanceYears, int depth, DashaInterval root) {
        this.birth = birth;
        this.birthNakshatra = birthNakshatra;
        this.startingLord = startingLord;
        this.elapsedFraction = elapsedFraction;
        this.balanceYears = balanceYears;
        this.depth = depth;
        this.root = root;
    }

    public static DashaTimeline of(Instant birth, Nakshatra birthNakshatra, Planet startingLord,
                                   double elapsedFraction, double balanceYears, int depth, DashaInterval root) {
        return new DashaTimeline(birth, birthNakshatra, startingLord, elapsedFraction, balanceYears, depth, root);
    }
}
