package WFST;

/**
 * Operands were built under different weight algebras.
 */
public class SemiringMismatchException extends FSTException {
    public SemiringMismatchException(String message) {
        super(message);
    }
}
