package WFST;

/**
 * Base of all contract violations reported by the engine.
 */
public class FSTException extends RuntimeException {
    public FSTException(String message) {
        super(message);
    }
}
