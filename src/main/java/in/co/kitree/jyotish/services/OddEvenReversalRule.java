package in.co.kitree.jyotish.services;

import in.co.kitree.jyotish.pojos.Sign;
import in.co.kitree.jyotish.pojos.VargaFamily;

/**
 * Even-indexed and odd-indexed base signs each get their own start sign and direction.
 *
 * <pre>
 *   start  = RELATIVE ? baseSign + startOffset : startOffset
 *   result = (start ± step * index) mod 12
 * </pre>
 * The trimsamsa form is forward from the base sign for even-indexed signs and reverse for odd-indexed ones.
 */
public final class OddEvenReversalRule implements VargaRule {

    private final AnchorMode mode;
    private final int step;
    private final int evenStart;
    private final boolean evenForward;
    private final int oddStart;
    private final boolean oddForward;

    public OddEvenReversalRule(AnchorMode mode, int step,
                               int evenStart, boolean evenForward,
                               int oddStart, boolean oddForward) {
        this.mode = mode;
        this.step = step;
        this.evenStart = evenStart;
        this.evenForward = evenForward;
        this.oddStart = oddStart;
        this.oddForward = oddForward;
    }

    /** Forward for even-indexed signs, reverse for odd-indexed, both from the base sign. */
    public static OddEvenReversalRule classic() {
        return new OddEvenReversalRule(AnchorMode.RELATIVE, 1, 0, true, 0, false);
    }

    @Override
    public VargaFamily family() {
        return VargaFamily.ODD_EVEN_REVERSAL;
    }

    @Override
    public int resultSign(int baseSign, int divisionIndex) {
        boolean even = Sign.of(baseSign).isEvenIndexed();
        int offset = even ? evenStart : oddStart;
        boolean forward = even ? evenForward : oddForward;
        int start = mode == AnchorMode.RELATIVE ? baseSign + offset : offset;
        int move = step * divisionIndex;
        return Math.floorMod(forward ? start + move : start - move, 12);
    }

    @Override
    public void validate(int divisionCount) {
        if (step < 1 || step > 11) {
            throw new UnsupportedVargaException("Reversal step must be 1-11, got " + step);
        }
        VargaRule.requireSignOffset("even-sign start", evenStart);
        VargaRule.requireSignOffset("odd-sign start", oddStart);
    }
}
