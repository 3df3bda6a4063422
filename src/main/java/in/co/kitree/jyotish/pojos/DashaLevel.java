package in.co.kitree.jyotish.pojos;

/**
 * Depth names of the Vimshottari tree. Root (depth 0) is the full 120-year cycle.
 */
public enum DashaLevel {
    CYCLE("Cycle"),
    MAHA("Mahadasha"),
    ANTAR("Antardasha"),
    PRATYANTAR("Pratyantardasha"),
    SOOKSHMA("Sookshmadasha"),
    PRANA("Pranadasha");

    public static final int MAX_DEPTH = 5;

    private final String displayName;

    DashaLevel(String displayName) {
        this.displayName = displayName;
    }

    public String getDisplayName() {
        return displayName;
    }

    public static DashaLevel ofDepth(int depth) {
        return values()[depth];
    }
}
