package in.co.kitree.jyotish.services;

import in.co.kitree.jyotish.pojos.VargaFamily;

/**
 * {@code (baseSign + step * index) mod 12}. Step 1 is the plain dwadasamsa-style progression.
 */
public final class UniformOffsetRule implements VargaRule {

    private final int step;

    public UniformOffsetRule(int step) {
        this.step = step;
    }

    @Override
    public VargaFamily family() {
        return VargaFamily.UNIFORM_OFFSET;
    }

    @Override
    public int resultSign(int baseSign, int divisionIndex) {
        return Math.floorMod(baseSign + step * divisionIndex, 12);
    }

    @Override
    public void validate(int divisionCount) {
        if (step < 1 || step > 11) {
            throw new UnsupportedVargaException("Uniform offset step must be 1-11, got " + step);
        }
    }

    public int getStep() {
        return step;
    }
}
