package in.co.kitree.jyotish.services;

/**
 * The root finder found no crossing of the target angle inside its search window,
 * or the Sun does not rise or set at the location on that date.
 */
public class BoundaryNotFoundException extends JyotishException {

    public static final String CODE = "BOUNDARY_NOT_FOUND";

    public BoundaryNotFoundException(String message) {
        super(CODE, message);
    }
}
