package WFST.Registry;

/**
 * Maps exploration keys (subsets, state pairs, filter triples) to output state ids.
 * @param <K> - key type; must implement value equality
 */
public interface Registry<K> {
    int MISSING_ELEMENT = -1;

    /**
     * Get the output state registered for key.
     * @param key exploration key
     * @return state ID or MISSING_ELEMENT if key was never registered.
     */
    int get(K key);

    /**
     * Register a new key with its (fixed) output state ID.
     * @param key exploration key
     * @param stateID state ID
     */
    void put(K key, int stateID);

    /**
     * @return number of registered keys
     */
    int size();
}
