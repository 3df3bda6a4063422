package in.co.kitree.jyotish.services;

public class UnsupportedVargaException extends JyotishException {

    public static final String CODE = "UNSUPPORTED_VARGA";

    public UnsupportedVargaException(String message) {
        super(CODE, message);
    }
}
