package in.co.kitree.jyotish.pojos;

/**
 * Lunar month containing a given sunrise, in both reckonings.
 *
 * <p>Amanta months run new moon to new moon, Purnimanta months full moon to full moon.
 * {@code adhikaMasa} is set when the Sun stays in one sign across the whole Amanta month.</p>
 */
public final class LunarMonth {

    public final String amantaName;
    public final String purnimantaName;
    public final boolean adhikaMasa;
    public final double amantaStartJd;
    public final double amantaEndJd;
    public final double purnimantaStartJd;
    public final double purnimantaEndJd;

    private LunarMonth(String amantaName, String purnimantaName, boolean adhikaMasa,
                       double amantaStartJd, double amantaEndJd,
                       double purnimantaStartJd, double purnimantaEndJd) {
        this.amantaName = amantaName;
        this.purnimantaName = purnimantaName;
        this.adhikaMasa = adhikaMasa;
        this.amantaStartJd = amantaStartJd;
        this.amantaEndJd = amantaEndJd;
        this.purnimantaStartJd = purnimantaStartJd;
        this.purnimantaEndJd = purnimantaEndJd;
    }

    public static LunarMonth of(String amantaName, String purnimantaName, boolean adhikaMasa,
                                double amantaStartJd, double amantaEndJd,
                                double purnimantaStartJd, double purnimantaEndJd) {
        return new LunarMonth(amantaName, purnimantaName, adhikaMasa,
                amantaStartJd, amantaEndJd, purnimantaStartJd, purnimantaEndJd);
    }

    @Override
    public String toString() {
        return "LunarMonth{amanta=" + amantaName + ", purnimanta=" + purnimantaName
                + (adhikaMasa ? ", adhika" : "") + "}";
    }
}
