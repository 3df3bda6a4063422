package in.co.kitree.jyotish.services;

import in.co.kitree.jyotish.pojos.VargaFamily;

/**
 * Maps a base sign and a division index to the sign it occupies in a divisional chart.
 * Implementations are immutable and carry only the parameters of their own family.
 */
public interface VargaRule {

    /**
     * Where a rule's start sign is measured from.
     */
    enum AnchorMode {
        /** Start sign is the base sign shifted by the offset. */
        RELATIVE,
        /** Start sign is the offset itself, whatever the base sign. */
        ABSOLUTE
    }

    VargaFamily family();

    /**
     * @param baseSign      D1 sign, 0 to 11
     * @param divisionIndex 0 to divisionCount - 1
     * @return result sign, 0 to 11
     */
    int resultSign(int baseSign, int divisionIndex);

    /**
     * Reject parameter sets that do not fit {@code divisionCount}.
     *
     * @throws UnsupportedVargaException when the rule cannot serve that division count
     */
    void validate(int divisionCount);

    static void requireSignOffset(String what, int offset) {
        if (offset < 0 || offset > 11) {
            throw new UnsupportedVargaException(what + " must be a sign index 0-11, got " + offset);
        }
    }
}
