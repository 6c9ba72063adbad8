package WFST.Semiring;

import java.util.Comparator;

/**
 * Weight algebra used by every automaton.
 * plus is commutative and associative with identity zero, times is associative with identity one,
 * and times distributes over plus. Distributivity is assumed, never checked.
 * @param <W> - weight type
 */
public interface Semiring<W> extends Comparator<W> {
    double DEFAULT_DELTA = 1e-6;

    String getName();

    W zero();

    W one();

    W plus(W a, W b);

    W times(W a, W b);

    /**
     * Left division: returns x with times(b, x) == a.
     * Only called with b != zero.
     * @param a - dividend
     * @param b - divisor
     * @return quotient
     */
    W divide(W a, W b);

    /**
     * Natural order. Negative if a is the better (cheaper, more likely) weight.
     */
    @Override
    int compare(W a, W b);

    /**
     * Tolerant equality used wherever weights are compared.
     */
    boolean approxEquals(W a, W b);

    /**
     * Canonical representative of the tolerance class of w.
     * Two weights with equal quantizations are interchangeable for minimization and subset deduplication.
     */
    W quantize(W w);

    /**
     * Parse the text of an inline weight annotation.
     * @throws NumberFormatException if the text is not a weight of this semiring
     */
    W parseWeight(String text);

    /**
     * Whether plus(a, a) == a, i.e., sums are selections. Boolean and tropical are idempotent.
     */
    boolean isIdempotent();

    default boolean isZero(W w) {
        return approxEquals(w, zero());
    }

    static Semiring<Boolean> booleans() {
        return BooleanSemiring.INSTANCE;
    }

    static Semiring<Double> tropical() {
        return new TropicalSemiring(DEFAULT_DELTA);
    }

    static Semiring<Double> probability() {
        return new ProbabilitySemiring(DEFAULT_DELTA);
    }
}
