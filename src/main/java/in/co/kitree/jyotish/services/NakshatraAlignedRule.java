package in.co.kitree.jyotish.services;

import in.co.kitree.jyotish.pojos.VargaFamily;

/**
 * {@code (baseSign * 27 + index) mod 12}: the 27 divisions of the zodiac follow the nakshatra sequence.
 */
public final class NakshatraAlignedRule implements VargaRule {

    @Override
    public VargaFamily family() {
        return VargaFamily.NAKSHATRA_ALIGNED;
    }

    @Override
    public int resultSign(int baseSign, int divisionIndex) {
        return Math.floorMod(baseSign * 27 + divisionIndex, 12);
    }

    @Override
    public void validate(int divisionCount) {
        if (divisionCount != 27) {
            throw new UnsupportedVargaException("Nakshatra-aligned rule needs 27 divisions, got " + divisionCount);
        }
    }
}
