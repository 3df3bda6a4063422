package in.co.kitree.jyotish.pojos;

import java.time.DayOfWeek;

/**
 * Weekday of the civil date, with its planetary day lord.
 */
public enum Vara {
    SUNDAY("Sunday", "Ravivara", Planet.SUN),
    MONDAY("Monday", "Somavara", Planet.MOON),
    TUESDAY("Tuesday", "Mangalavara", Planet.MARS),
    WEDNESDAY("Wednesday", "Budhavara", Planet.MERCURY),
    THURSDAY("Thursday", "Guruvara", Planet.JUPITER),
    FRIDAY("Friday", "Shukravara", Planet.VENUS),
    SATURDAY("Saturday", "Shanivara", Planet.SATURN);

    private final String displayName;
    private final String sanskritName;
    private final Planet lord;

    Vara(String displayName, String sanskritName, Planet lord) {
        this.displayName = displayName;
        this.sanskritName = sanskritName;
        this.lord = lord;
    }

    public String getDisplayName() {
        return displayName;
    }

    public String getSanskritName() {
        return sanskritName;
    }

    public Planet getLord() {
        return lord;
    }

    public static Vara of(DayOfWeek dayOfWeek) {
        // DayOfWeek is Monday-first; Vara is Sunday-first
        return values()[dayOfWeek.getValue() % 7];
    }
}
