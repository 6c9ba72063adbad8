package WFST.Registry;

/**
 * Product-state key for intersection, difference and composition.
 * @param first - state of the left operand
 * @param second - state of the right operand, or -1 for the implicit sink of a complemented operand
 * @param filter - epsilon-filter state (0 when unused)
 */
public record StateTuple(int first, int second, int filter) {

    @Override
    public String toString() {
        return "(" + first + ", " + second + ", " + filter + ")";
    }
}
