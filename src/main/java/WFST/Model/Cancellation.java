package WFST.Model;

/**
 * Bounds a lazy exploration. The exploring loop polls this object between frontier expansions;
 * a host may interrupt from another thread.
 */
public class Cancellation {

    private final int stateThreshold;

    private volatile boolean interrupted;
    private boolean aboveThreshold;

    public Cancellation() {
        this(false, Integer.MAX_VALUE);
    }

    public Cancellation(int stateThreshold) {
        this(false, stateThreshold);
    }

    public Cancellation(boolean interrupted, int stateThreshold) {
        if (stateThreshold < 1) {
            throw new IllegalArgumentException("stateThreshold must be positive: " + stateThreshold);
        }
        this.interrupted = interrupted;
        this.stateThreshold = stateThreshold;
    }

    public static Cancellation unbounded() {
        return new Cancellation();
    }

    public int getStateThreshold() {
        return stateThreshold;
    }

    public boolean isInterrupted() {
        return interrupted;
    }

    public void setInterrupted() {
        this.interrupted = true;
    }

    public boolean isAboveThreshold(int states) {
        this.aboveThreshold |= states > stateThreshold;
        return this.aboveThreshold;
    }

    /**
     * Polled by exploration loops.
     * @param states - number of states produced so far
     * @return whether the exploration has to stop
     */
    public boolean isCancelled(int states) {
        return isInterrupted() | isAboveThreshold(states);
    }

    public String cancelLabel() {
        return this.isInterrupted() ? "interrupted" : "state limit " + stateThreshold;
    }
}
