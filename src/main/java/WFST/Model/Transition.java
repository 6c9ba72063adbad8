package WFST.Model;

/**
 * Arc of an automaton. Plain automata carry identity labels (input == output).
 * @param source - source state
 * @param input - input symbol id, SymbolTable.EPSILON for epsilon
 * @param output - output symbol id
 * @param weight - weight in the automaton's semiring
 * @param target - target state
 * @param <W> - weight type
 */
public record Transition<W>(int source, int input, int output, W weight, int target) {

    public boolean isEpsilon() {
        return input == SymbolTable.EPSILON && output == SymbolTable.EPSILON;
    }

    public boolean isIdentity() {
        return input == output;
    }

    /**
     * Both tapes packed into one key; the unit of determinism and minimization.
     */
    public long label() {
        return label(input, output);
    }

    public static long label(int input, int output) {
        return ((long) input << 32) | (output & 0xffffffffL);
    }

    public static int labelInput(long label) {
        return (int) (label >>> 32);
    }

    public static int labelOutput(long label) {
        return (int) label;
    }
}
