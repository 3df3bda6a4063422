package in.co.kitree.jyotish.services;

import in.co.kitree.jyotish.pojos.Nakshatra;
import in.co.kitree.jyotish.pojos.Paksha;
import in.co.kitree.jyotish.pojos.PanchangaElementKind;

import java.util.List;

/**
 * Display names for tithi, nakshatra and yoga indices.
 */
public final class PanchangaNames {

    // Tithi 15 of each half is Purnima (Shukla) or Amavasya (Krishna)
    private static final List<String> TITHI_BASE_NAMES = List.of(
            "Pratipada", "Dwitiya", "Tritiya", "Chaturthi", "Panchami", "Shashthi", "Saptami",
            "Ashtami", "Navami", "Dashami", "Ekadashi", "Dwadashi", "Trayodashi", "Chaturdashi");

    public static final List<String> YOGA_NAMES = List.of(
            "Vishkambha", "Priti", "Ayushman", "Saubhagya", "Shobhana", "Atiganda", "Sukarma",
            "Dhriti", "Shula", "Ganda", "Vriddhi", "Dhruva", "Vyaghata", "Harshana",
            "Vajra", "Siddhi", "Vyatipata", "Variyana", "Parigha", "Shiva", "Siddha",
            "Sadhya", "Shubha", "Shukla", "Brahma", "Indra", "Vaidhriti");

    private PanchangaNames() {}

    public static Paksha pakshaOf(int tithi) {
        return tithi < 15 ? Paksha.SHUKLA : Paksha.KRISHNA;
    }

    /** e.g. 0 → "Shukla Pratipada", 14 → "Purnima", 29 → "Amavasya". */
    public static String tithiName(int tithi) {
        int inPaksha = tithi % 15;
        if (inPaksha == 14) {
            return tithi < 15 ? "Purnima" : "Amavasya";
        }
        return pakshaOf(tithi).getDisplayName() + " " + TITHI_BASE_NAMES.get(inPaksha);
    }

    public static String nameOf(PanchangaElementKind kind, int value) {
        switch (kind) {
            case TITHI:
                return tithiName(value);
            case NAKSHATRA:
                return Nakshatra.of(value).getDisplayName();
            case YOGA:
                return YOGA_NAMES.get(value);
            default:
                throw new IllegalArgumentException("Unknown panchanga element: " + kind);
        }
    }
}
