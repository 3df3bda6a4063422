package in.co.kitree.jyotish.services;

import in.co.kitree.jyotish.pojos.Sign;
import in.co.kitree.jyotish.pojos.VargaFamily;

/**
 * Start offset looked up by the base sign's nature (movable, fixed, dual) and parity.
 *
 * <p>Parity column 0 is for even-indexed base signs (Aries, Gemini, ...), column 1 for odd-indexed ones.
 * In {@link AnchorMode#RELATIVE} mode the result is {@code baseSign + offset + index}; in
 * {@link AnchorMode#ABSOLUTE} mode it is {@code offset + index}.</p>
 */
public final class NatureParityRule implements VargaRule {

    private final AnchorMode mode;
    private final int[][] offsets;

    public NatureParityRule(AnchorMode mode, int[] movable, int[] fixed, int[] dual) {
        this.mode = mode;
        this.offsets = new int[][] {movable.clone(), fixed.clone(), dual.clone()};
    }

    @Override
    public VargaFamily family() {
        return VargaFamily.NATURE_PARITY;
    }

    @Override
    public int resultSign(int baseSign, int divisionIndex) {
        int offset = offsetFor(Sign.of(baseSign));
        int start = mode == AnchorMode.RELATIVE ? baseSign + offset : offset;
        return Math.floorMod(start + divisionIndex, 12);
    }

    @Override
    public void validate(int divisionCount) {
        for (Sign.Nature nature : Sign.Nature.values()) {
            int[] row = offsets[nature.ordinal()];
            if (row.length != 2) {
                throw new UnsupportedVargaException(nature + " row needs an even and an odd offset");
            }
            VargaRule.requireSignOffset(nature + " even offset", row[0]);
            VargaRule.requireSignOffset(nature + " odd offset", row[1]);
        }
    }

    public int offsetFor(Sign sign) {
        return offsets[sign.nature().ordinal()][sign.isEvenIndexed() ? 0 : 1];
    }

    public AnchorMode getMode() {
        return mode;
    }
}
