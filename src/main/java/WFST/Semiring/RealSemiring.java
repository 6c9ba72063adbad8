package WFST.Semiring;

import java.util.Objects;

/**
 * Shared tolerance handling for semirings over doubles.
 */
abstract class RealSemiring implements Semiring<Double> {
    protected final double delta;

    RealSemiring(double delta) {
        if (!(delta > 0.0)) {
            throw new IllegalArgumentException("delta must be positive: " + delta);
        }
        this.delta = delta;
    }

    public double getDelta() {
        return delta;
    }

    @Override
    public boolean approxEquals(Double a, Double b) {
        if (a.isInfinite() || b.isInfinite()) {
            return a.equals(b);
        }
        return Math.abs(a - b) <= delta;
    }

    @Override
    public Double quantize(Double w) {
        if (w.isInfinite() || w.isNaN()) {
            return w;
        }
        double q = Math.round(w / delta) * delta;
        return q == 0.0 ? 0.0 : q; // no negative zero
    }

    /**
     * Exact: weights near zero are still weights, and only zero itself removes a path.
     */
    @Override
    public boolean isZero(Double w) {
        return w.doubleValue() == zero().doubleValue();
    }

    @Override
    public Double parseWeight(String text) {
        String t = text.trim();
        if ("inf".equalsIgnoreCase(t) || "infinity".equalsIgnoreCase(t)) {
            return Double.POSITIVE_INFINITY;
        }
        return Double.parseDouble(t);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        return Double.compare(delta, ((RealSemiring) o).delta) == 0;
    }

    @Override
    public int hashCode() {
        return Objects.hash(getClass(), delta);
    }

    @Override
    public String toString() {
        return getName() + "(delta=" + delta + ")";
    }
}
