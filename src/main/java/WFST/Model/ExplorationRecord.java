package WFST.Model;

/**
 * Work-queue entry of a lazy exploration: the key being explored and the output state created for it.
 * @param <K> - subset, state pair or filter triple
 */
public record ExplorationRecord<K>(K key, int outputState) {

    @Override
    public String toString() {
        return outputState + ": " + key;
    }
}
