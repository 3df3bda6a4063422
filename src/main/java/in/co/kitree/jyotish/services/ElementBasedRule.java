package in.co.kitree.jyotish.services;

import in.co.kitree.jyotish.pojos.Sign;
import in.co.kitree.jyotish.pojos.VargaFamily;

/**
 * Counting starts from a fixed anchor sign chosen by the base sign's element:
 * {@code (anchor[element] + index) mod 12}.
 */
public final class ElementBasedRule implements VargaRule {

    private final int[] anchors;

    /**
     * @param fire  anchor for Aries, Leo, Sagittarius
     * @param earth anchor for Taurus, Virgo, Capricorn
     * @param air   anchor for Gemini, Libra, Aquarius
     * @param water anchor for Cancer, Scorpio, Pisces
     */
    public ElementBasedRule(int fire, int earth, int air, int water) {
        this.anchors = new int[] {fire, earth, air, water};
    }

    @Override
    public VargaFamily family() {
        return VargaFamily.ELEMENT_BASED;
    }

    @Override
    public int resultSign(int baseSign, int divisionIndex) {
        int anchor = anchors[Sign.of(baseSign).element().ordinal()];
        return Math.floorMod(anchor + divisionIndex, 12);
    }

    @Override
    public void validate(int divisionCount) {
        for (Sign.Element element : Sign.Element.values()) {
            VargaRule.requireSignOffset(element + " anchor", anchors[element.ordinal()]);
        }
    }

    public int anchorFor(Sign.Element element) {
        return anchors[element.ordinal()];
    }
}
