package WFST.Regex;

import WFST.FSTException;

/**
 * Malformed pattern. No automaton is built when this is thrown.
 */
public class ParseException extends FSTException {
    private final int offset;

    public ParseException(String message, int offset) {
        super(message + " at offset " + offset);
        this.offset = offset;
    }

    /**
     * @return zero-based offset of the offending character in the pattern
     */
    public int getOffset() {
        return offset;
    }
}
