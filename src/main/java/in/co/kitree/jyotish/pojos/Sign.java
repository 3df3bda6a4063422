package in.co.kitree.jyotish.pojos;

/**
 * Sidereal signs, Aries = 0 through Pisces = 11.
 */
public enum Sign {
    ARIES("Aries"),
    TAURUS("Taurus"),
    GEMINI("Gemini"),
    CANCER("Cancer"),
    LEO("Leo"),
    VIRGO("Virgo"),
    LIBRA("Libra"),
    SCORPIO("Scorpio"),
    SAGITTARIUS("Sagittarius"),
    CAPRICORN("Capricorn"),
    AQUARIUS("Aquarius"),
    PISCES("Pisces");

    public enum Nature { MOVABLE, FIXED, DUAL }

    public enum Element { FIRE, EARTH, AIR, WATER }

    private static final Sign[] VALUES = values();

    private final String displayName;

    Sign(String displayName) {
        this.displayName = displayName;
    }

    public String getDisplayName() {
        return displayName;
    }

    public int index() {
        return ordinal();
    }

    public Nature nature() {
        return Nature.values()[ordinal() % 3];
    }

    public Element element() {
        return Element.values()[ordinal() % 4];
    }

    /** True for Aries, Gemini, Leo... (odd in 1-based classical numbering). */
    public boolean isEvenIndexed() {
        return ordinal() % 2 == 0;
    }

    public static Sign of(int index) {
        return VALUES[Math.floorMod(index, 12)];
    }
}
