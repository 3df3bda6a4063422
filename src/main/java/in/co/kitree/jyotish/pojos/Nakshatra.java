package in.co.kitree.jyotish.pojos;

/**
 * The 27 lunar mansions of 13°20' each, Ashwini = 0.
 */
public enum Nakshatra {
    ASHWINI("Ashwini"),
    BHARANI("Bharani"),
    KRITTIKA("Krittika"),
    ROHINI("Rohini"),
    MRIGASHIRA("Mrigashira"),
    ARDRA("Ardra"),
    PUNARVASU("Punarvasu"),
    PUSHYA("Pushya"),
    ASHLESHA("Ashlesha"),
    MAGHA("Magha"),
    PURVA_PHALGUNI("Purva Phalguni"),
    UTTARA_PHALGUNI("Uttara Phalguni"),
    HASTA("Hasta"),
    CHITRA("Chitra"),
    SWATI("Swati"),
    VISHAKHA("Vishakha"),
    ANURADHA("Anuradha"),
    JYESHTHA("Jyeshtha"),
    MULA("Mula"),
    PURVA_ASHADHA("Purva Ashadha"),
    UTTARA_ASHADHA("Uttara Ashadha"),
    SHRAVANA("Shravana"),
    DHANISHTA("Dhanishta"),
    SHATABHISHA("Shatabhisha"),
    PURVA_BHADRAPADA("Purva Bhadrapada"),
    UTTARA_BHADRAPADA("Uttara Bhadrapada"),
    REVATI("Revati");

    private static final Nakshatra[] VALUES = values();

    private final String displayName;

    Nakshatra(String displayName) {
        this.displayName = displayName;
    }

    public String getDisplayName() {
        return displayName;
    }

    /** Vimshottari starting lord: cycle[index mod 9]. */
    public Planet lord() {
        return Planet.VIMSHOTTARI_CYCLE.get(ordinal() % 9);
    }

    public static Nakshatra of(int index) {
        return VALUES[Math.floorMod(index, 27)];
    }
}
