package WFST;

/**
 * An operation that needs deterministic, epsilon-free input was given something else.
 */
public class NonDeterministicPreconditionException extends FSTException {
    public NonDeterministicPreconditionException(String message) {
        super(message);
    }
}
