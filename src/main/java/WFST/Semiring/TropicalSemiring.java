package WFST.Semiring;

/**
 * min/+ over doubles, zero = +inf, one = 0. Lower weights are better.
 */
public final class TropicalSemiring extends RealSemiring {

    public TropicalSemiring(double delta) {
        super(delta);
    }

    @Override
    public String getName() {
        return "tropical";
    }

    @Override
    public Double zero() {
        return Double.POSITIVE_INFINITY;
    }

    @Override
    public Double one() {
        return 0.0;
    }

    @Override
    public Double plus(Double a, Double b) {
        return Math.min(a, b);
    }

    @Override
    public Double times(Double a, Double b) {
        if (a.isInfinite() && a > 0 || b.isInfinite() && b > 0) {
            return Double.POSITIVE_INFINITY;
        }
        return a + b;
    }

    @Override
    public Double divide(Double a, Double b) {
        if (a == Double.POSITIVE_INFINITY) {
            return Double.POSITIVE_INFINITY;
        }
        return a - b;
    }

    @Override
    public int compare(Double a, Double b) {
        return Double.compare(a, b);
    }

    @Override
    public boolean isIdempotent() {
        return true;
    }
}
