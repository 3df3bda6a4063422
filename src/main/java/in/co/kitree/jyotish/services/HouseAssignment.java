package in.co.kitree.jyotish.services;

/**
 * Whole-sign houses, counted from the chart's own ascendant sign.
 */
public final class HouseAssignment {

    private HouseAssignment() {}

    /**
     * {@code ((bodySign - ascendantSign + 12) mod 12) + 1}.
     */
    public static int houseOf(int bodySign, int ascendantSign) {
        return Math.floorMod(bodySign - ascendantSign, 12) + 1;
    }

    /**
     * Runs on every chart build.
     *
     * @throws IllegalStateException if the ascendant landed anywhere but house 1
     */
    public static void verifyAscendantHouse(String chartCode, int ascendantHouse) {
        if (ascendantHouse != 1) {
            throw new IllegalStateException(chartCode + " ascendant resolved to house " + ascendantHouse);
        }
    }
}
