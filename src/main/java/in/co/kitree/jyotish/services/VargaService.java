package in.co.kitree.jyotish.services;

import in.co.kitree.jyotish.pojos.SignPlacement;

/**
 * Projects a D1 position into a divisional chart. Pure and stateless.
 */
public final class VargaService {

    /** Bias that settles a degree sitting on a division edge into the later division. */
    public static final double EDGE_EPSILON = 1e-9;

    private VargaService() {}

    /**
     * {@code floor((degreeInSign + 1e-9) / (30 / N))}, clamped to {@code [0, N-1]}.
     */
    public static int divisionIndex(double degreeInSign, int divisionCount) {
        double width = SignUtils.SIGN_SPAN / divisionCount;
        int index = (int) Math.floor((degreeInSign + EDGE_EPSILON) / width);
        return Math.max(0, Math.min(index, divisionCount - 1));
    }

    public static int resultSign(int baseSign, double degreeInSign, VargaDefinition definition) {
        if (baseSign < 0 || baseSign > 11) {
            throw new InputDomainException("Base sign must be 0-11, got " + baseSign);
        }
        if (Double.isNaN(degreeInSign) || degreeInSign < 0 || degreeInSign >= SignUtils.SIGN_SPAN) {
            throw new InputDomainException("Degree in sign must be within [0, 30), got " + degreeInSign);
        }
        int index = divisionIndex(degreeInSign, definition.getDivisionCount());
        return definition.getRule().resultSign(baseSign, index);
    }

    public static int resultSign(double longitude, VargaDefinition definition) {
        SignPlacement placement = SignUtils.signOf(longitude);
        return resultSign(placement.sign, placement.degreeInSign, definition);
    }
}
