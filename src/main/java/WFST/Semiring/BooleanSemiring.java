package WFST.Semiring;

/**
 * OR/AND over booleans. Plain (unweighted) automata live here.
 */
public final class BooleanSemiring implements Semiring<Boolean> {
    static final BooleanSemiring INSTANCE = new BooleanSemiring();

    private BooleanSemiring() {}

    @Override
    public String getName() {
        return "boolean";
    }

    @Override
    public Boolean zero() {
        return Boolean.FALSE;
    }

    @Override
    public Boolean one() {
        return Boolean.TRUE;
    }

    @Override
    public Boolean plus(Boolean a, Boolean b) {
        return a || b;
    }

    @Override
    public Boolean times(Boolean a, Boolean b) {
        return a && b;
    }

    @Override
    public Boolean divide(Boolean a, Boolean b) {
        return a;
    }

    @Override
    public int compare(Boolean a, Boolean b) {
        // true is the better weight
        return Boolean.compare(b, a);
    }

    @Override
    public boolean approxEquals(Boolean a, Boolean b) {
        return a.booleanValue() == b.booleanValue();
    }

    @Override
    public Boolean quantize(Boolean w) {
        return w;
    }

    @Override
    public Boolean parseWeight(String text) {
        String t = text.trim();
        if ("true".equalsIgnoreCase(t) || "1".equals(t)) {
            return Boolean.TRUE;
        }
        if ("false".equalsIgnoreCase(t) || "0".equals(t)) {
            return Boolean.FALSE;
        }
        throw new NumberFormatException("Not a boolean weight: " + text);
    }

    @Override
    public boolean isIdempotent() {
        return true;
    }

    @Override
    public String toString() {
        return getName();
    }
}
