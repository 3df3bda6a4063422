package in.co.kitree.jyotish.pojos;

/**
 * Tithi, nakshatra or yoga active at sunrise, bounded by its exact transition instants (Julian Days, UT).
 */
public final class PanchangaElement {

    public final PanchangaElementKind kind;
    public final int currentValue;
    public final String currentName;
    public final double currentStartJd;
    public final double currentEndJd;
    public final int nextValue;
    public final String nextName;
    public final double nextEndJd;

    private PanchangaElement(PanchangaElementKind kind, int currentValue, String currentName,
                             double currentStartJd, double currentEndJd,
                             int nextValue, String nextName, double nextEndJd) {
        this.kind = kind;
        this.currentValue = currentValue;
        this.currentName = currentName;
        this.currentStartJd = currentStartJd;
        this.currentEndJd = currentEndJd;
        this.nextValue = nextValue;
        this.nextName = nextName;
        this.nextEndJd = nextEndJd;
    }

    public static PanchangaElement of(PanchangaElementKind kind, int currentValue, String currentName,
                                      double currentStartJd, double currentEndJd,
                                      int nextValue, String nextName, double nextEndJd) {
        return new PanchangaElement(kind, currentValue, currentName, currentStartJd, currentEndJd,
                nextValue, nextName, nextEndJd);
    }

    @Override
    public String toString() {
        return String.format("%s{current=%d %s [%.6f, %.6f), next=%d %s until %.6f}",
                kind, currentValue, currentName, currentStartJd, currentEndJd, nextValue, nextName, nextEndJd);
    }
}
