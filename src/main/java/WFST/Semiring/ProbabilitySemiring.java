package WFST.Semiring;

import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;

/**
 * +/x over non-negative doubles, zero = 0, one = 1. Higher weights are better.
 * <p>
 * Probabilities shrink geometrically along paths, so the tolerance is relative: two weights are equal
 * when they differ by at most delta times the larger one, and quantization keeps a fixed number of
 * significant digits. Only an exact 0 is zero.
 */
public final class ProbabilitySemiring extends RealSemiring {
    private final MathContext significantDigits;

    public ProbabilitySemiring(double delta) {
        super(delta);
        int digits = (int) Math.max(1, Math.round(-Math.log10(delta)));
        this.significantDigits = new MathContext(digits, RoundingMode.HALF_EVEN);
    }

    @Override
    public String getName() {
        return "probability";
    }

    @Override
    public Double zero() {
        return 0.0;
    }

    @Override
    public Double one() {
        return 1.0;
    }

    @Override
    public Double plus(Double a, Double b) {
        return a + b;
    }

    @Override
    public Double times(Double a, Double b) {
        return a * b;
    }

    @Override
    public Double divide(Double a, Double b) {
        return a / b;
    }

    @Override
    public int compare(Double a, Double b) {
        return Double.compare(b, a);
    }

    @Override
    public boolean approxEquals(Double a, Double b) {
        if (a.isInfinite() || b.isInfinite()) {
            return a.equals(b);
        }
        return Math.abs(a - b) <= delta * Math.max(Math.abs(a), Math.abs(b));
    }

    @Override
    public Double quantize(Double w) {
        if (w.isInfinite() || w.isNaN()) {
            return w;
        }
        double q = new BigDecimal(w).round(significantDigits).doubleValue();
        return q == 0.0 ? 0.0 : q;
    }

    @Override
    public boolean isIdempotent() {
        return false;
    }
}
