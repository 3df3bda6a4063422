package in.co.kitree.jyotish.services;

public class EphemerisException extends JyotishException {

    public static final String CODE = "EPHEMERIS_FAILURE";

    public EphemerisException(String message) {
        super(CODE, message);
    }

    public EphemerisException(String message, Throwable cause) {
        super(CODE, message, cause);
    }
}
