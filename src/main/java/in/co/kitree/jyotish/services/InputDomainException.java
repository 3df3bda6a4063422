package in.co.kitree.jyotish.services;

/**
 * Input outside its legal range. Raised before any engine runs; values are never clamped.
 */
public class InputDomainException extends JyotishException {

    public static final String CODE = "INVALID_INPUT";

    public InputDomainException(String message) {
        super(CODE, message);
    }
}
