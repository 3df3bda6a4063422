package in.co.kitree.jyotish.pojos;

import java.util.List;

/**
 * The nine grahas: seven classical planets plus the two lunar nodes.
 */
public enum Planet {
    SUN("Sun"),
    MOON("Moon"),
    MARS("Mars"),
    MERCURY("Mercury"),
    JUPITER("Jupiter"),
    VENUS("Venus"),
    SATURN("Saturn"),
    RAHU("Rahu"),
    KETU("Ketu");

    /** Vimshottari lord order, starting from the lord of Ashwini. */
    public static final List<Planet> VIMSHOTTARI_CYCLE = List.of(
            KETU, VENUS, SUN, MOON, MARS, RAHU, JUPITER, SATURN, MERCURY);

    private final String displayName;

    Planet(String displayName) {
        this.displayName = displayName;
    }

    public String getDisplayName() {
        return displayName;
    }

    /** Ketu is never read from an ephemeris; it is always Rahu + 180. */
    public boolean isDerived() {
        return this == KETU;
    }
}
