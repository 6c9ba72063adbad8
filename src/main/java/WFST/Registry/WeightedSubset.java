package WFST.Registry;

import java.util.Arrays;

/**
 * Frontier of the subset construction: sorted source states, each with its quantized residual weight.
 * Identity is by set content, never by insertion order.
 */
public final class WeightedSubset {
    private final int[] states;
    private final Object[] residuals;
    private final int hash;

    /**
     * @param states - strictly increasing state ids
     * @param residuals - quantized residual weight per state, parallel to states
     */
    public WeightedSubset(int[] states, Object[] residuals) {
        if (states.length != residuals.length) {
            throw new IllegalArgumentException("states and residuals differ in length");
        }
        for (int i = 1; i < states.length; i++) {
            if (states[i - 1] >= states[i]) {
                throw new IllegalArgumentException("states must be strictly increasing");
            }
        }
        this.states = states;
        this.residuals = residuals;
        this.hash = 31 * Arrays.hashCode(states) + Arrays.hashCode(residuals);
    }

    public int size() {
        return states.length;
    }

    public int state(int i) {
        return states[i];
    }

    public Object residual(int i) {
        return residuals[i];
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof WeightedSubset)) {
            return false;
        }
        WeightedSubset other = (WeightedSubset) o;
        return hash == other.hash && Arrays.equals(states, other.states) && Arrays.equals(residuals, other.residuals);
    }

    @Override
    public int hashCode() {
        return hash;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("{");
        for (int i = 0; i < states.length; i++) {
            if (i > 0) {
                sb.append(", ");
            }
            sb.append(states[i]).append('/').append(residuals[i]);
        }
        return sb.append('}').toString();
    }
}
