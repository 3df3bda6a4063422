package in.co.kitree.jyotish.services;

/**
 * Base of every failure the engines report. {@link #getErrorCode()} is stable and goes out in JSON responses.
 */
public class JyotishException extends RuntimeException {

    private final String errorCode;

    public JyotishException(String errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    public JyotishException(String errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    public String getErrorCode() {
        return errorCode;
    }
}
