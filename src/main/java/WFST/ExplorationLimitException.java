package WFST;

import WFST.Model.Cancellation;

/**
 * Thrown when a bounded exploration (subset construction, product, composition) is cancelled,
 * either by an interrupt or because it grew past its state threshold, or when a weighted subset
 * construction can be shown not to terminate.
 */
public class ExplorationLimitException extends FSTException {
    private final int statesExplored;

    public ExplorationLimitException(String operation, Cancellation cancellation, int statesExplored) {
        super(operation + " cancelled (" + cancellation.cancelLabel() + ") after " + statesExplored + " states");
        this.statesExplored = statesExplored;
    }

    public ExplorationLimitException(String message, int statesExplored) {
        super(message);
        this.statesExplored = statesExplored;
    }

    public int getStatesExplored() {
        return statesExplored;
    }
}
