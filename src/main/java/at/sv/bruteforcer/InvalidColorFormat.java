package at.sv.bruteforcer;

/**
 * Signals that a supplied color is not a six digit hex code.
 */
public final class InvalidColorFormat extends RuntimeException {

    public InvalidColorFormat(String message) {
        super(message);
    }
}
