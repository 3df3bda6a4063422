package in.co.kitree.jyotish.pojos;

public final class SignPlacement {

    /** 0 = Aries ... 11 = Pisces. */
    public final int sign;

    /** Degrees into the sign, in [0, 30). */
    public final double degreeInSign;

    private SignPlacement(int sign, double degreeInSign) {
        this.sign = sign;
        this.degreeInSign = degreeInSign;
    }

    public static SignPlacement of(int sign, double degreeInSign) {
        return new SignPlacement(sign, degreeInSign);
    }

    public Sign asSign() {
        return Sign.of(sign);
    }

    @Override
    public String toString() {
        return String.format("SignPlacement{sign=%d, degreeInSign=%.6f}", sign, degreeInSign);
    }
}
