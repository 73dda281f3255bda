package at.sv.bruteforcer;

/**
 * Signals that the number of base colors differs from the number of target colors. Raised before any search starts.
 */
public final class MismatchedColors extends RuntimeException {

    public MismatchedColors(String message) {
        super(message);
    }
}
