package WFST;

/**
 * Operands intern their symbols in different symbol tables, so their labels cannot be matched.
 */
public class AlphabetMismatchException extends FSTException {
    public AlphabetMismatchException(String message) {
        super(message);
    }
}
