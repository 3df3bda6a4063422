package in.co.kitree.jyotish.services;

import in.co.kitree.jyotish.pojos.VargaFamily;
import in.co.kitree.jyotish.services.VargaRule.AnchorMode;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * The sixteen supported divisional charts, keyed by division count.
 *
 * <p>Every entry is a closed-form rule. Sign anchors below are 0-based (Aries = 0).</p>
 */
public final class VargaCatalog {

    private static final Map<Integer, VargaDefinition> DEFINITIONS;

    static {
        Map<Integer, VargaDefinition> defs = new LinkedHashMap<>();
        register(defs, new VargaDefinition("Rasi", 1, VargaFamily.UNIFORM_OFFSET, new UniformOffsetRule(1)));
        // Sun's hora (Leo) then Moon's (Cancer) for even-indexed signs, the opposite for odd-indexed
        register(defs, new VargaDefinition("Hora", 2, VargaFamily.ODD_EVEN_REVERSAL,
                new OddEvenReversalRule(AnchorMode.ABSOLUTE, 1, 4, false, 3, true)));
        // 1st, 5th, 9th from the sign; counted backwards for odd-indexed signs
        register(defs, new VargaDefinition("Drekkana", 3, VargaFamily.ODD_EVEN_REVERSAL,
                new OddEvenReversalRule(AnchorMode.RELATIVE, 4, 0, true, 0, false)));
        // 1st, 4th, 7th, 10th from the sign
        register(defs, new VargaDefinition("Chaturthamsa", 4, VargaFamily.UNIFORM_OFFSET, new UniformOffsetRule(3)));
        // odd-indexed signs count backwards from the 7th
        register(defs, new VargaDefinition("Saptamsa", 7, VargaFamily.ODD_EVEN_REVERSAL,
                new OddEvenReversalRule(AnchorMode.RELATIVE, 1, 0, true, 6, false)));
        register(defs, new VargaDefinition("Navamsa", 9, VargaFamily.ELEMENT_BASED,
                new ElementBasedRule(0, 9, 6, 3)));
        register(defs, new VargaDefinition("Dasamsa", 10, VargaFamily.NATURE_PARITY,
                new NatureParityRule(AnchorMode.RELATIVE, new int[] {0, 8}, new int[] {0, 8}, new int[] {4, 8})));
        register(defs, new VargaDefinition("Dwadasamsa", 12, VargaFamily.UNIFORM_OFFSET, new UniformOffsetRule(1)));
        // fixed start signs by nature: Aries, Leo, Sagittarius
        register(defs, new VargaDefinition("Shodasamsa", 16, VargaFamily.NATURE_PARITY,
                new NatureParityRule(AnchorMode.ABSOLUTE, new int[] {0, 0}, new int[] {4, 4}, new int[] {8, 8})));
        // fixed start signs by nature: Aries, Sagittarius, Leo
        register(defs, new VargaDefinition("Vimsamsa", 20, VargaFamily.NATURE_PARITY,
                new NatureParityRule(AnchorMode.ABSOLUTE, new int[] {0, 0}, new int[] {8, 8}, new int[] {4, 4})));
        register(defs, new VargaDefinition("Chaturvimsamsa", 24, VargaFamily.ELEMENT_BASED,
                new ElementBasedRule(0, 1, 2, 3)));
        register(defs, new VargaDefinition("Bhamsa", 27, VargaFamily.NAKSHATRA_ALIGNED, new NakshatraAlignedRule()));
        register(defs, new VargaDefinition("Trimsamsa", 30, VargaFamily.ODD_EVEN_REVERSAL,
                OddEvenReversalRule.classic()));
        // Aries for even-indexed signs, Libra for odd-indexed
        register(defs, new VargaDefinition("Khavedamsa", 40, VargaFamily.NATURE_PARITY,
                new NatureParityRule(AnchorMode.ABSOLUTE, new int[] {0, 6}, new int[] {0, 6}, new int[] {0, 6})));
        register(defs, new VargaDefinition("Akshavedamsa", 45, VargaFamily.ELEMENT_BASED,
                new ElementBasedRule(0, 1, 2, 3)));
        register(defs, new VargaDefinition("Shashtiamsa", 60, VargaFamily.NATURE_PARITY,
                new NatureParityRule(AnchorMode.RELATIVE, new int[] {0, 0}, new int[] {0, 0}, new int[] {0, 0})));
        DEFINITIONS = Collections.unmodifiableMap(defs);
    }

    private VargaCatalog() {}

    private static void register(Map<Integer, VargaDefinition> defs, VargaDefinition definition) {
        defs.put(definition.getDivisionCount(), definition);
    }

    /**
     * @throws UnsupportedVargaException for any division count outside the catalog
     */
    public static VargaDefinition byDivision(int divisionCount) {
        VargaDefinition definition = DEFINITIONS.get(divisionCount);
        if (definition == null) {
            throw new UnsupportedVargaException("Unsupported divisional chart: D" + divisionCount);
        }
        return definition;
    }

    /** Accepts "D9", "d9" or "9". */
    public static VargaDefinition byCode(String code) {
        if (code == null) {
            throw new UnsupportedVargaException("Divisional chart code is missing");
        }
        String digits = code.trim().toUpperCase().startsWith("D") ? code.trim().substring(1) : code.trim();
        try {
            return byDivision(Integer.parseInt(digits));
        } catch (NumberFormatException e) {
            throw new UnsupportedVargaException("Unsupported divisional chart: " + code);
        }
    }

    public static List<VargaDefinition> all() {
        return List.copyOf(DEFINITIONS.values());
    }
}
