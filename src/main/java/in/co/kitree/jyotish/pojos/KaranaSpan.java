package in.co.kitree.jyotish.pojos;

public final class KaranaSpan {

    /** Half-tithi slot of the lunar month, 0 to 59. */
    public final int slot;
    public final String name;
    public final double endJd;

    private KaranaSpan(int slot, String name, double endJd) {
        this.slot = slot;
        this.name = name;
        this.endJd = endJd;
    }

    public static KaranaSpan of(int slot, String name, double endJd) {
        return new KaranaSpan(slot, name, endJd);
    }

    @Override
    public String toString() {
        return String.format("KaranaSpan{slot=%d, name=%s, end=%.6f}", slot, name, endJd);
    }
}
