package WFST.Registry;

import it.unimi.dsi.fastutil.objects.Object2IntMap;
import it.unimi.dsi.fastutil.objects.Object2IntOpenHashMap;

public class AddressRegistry<K> implements Registry<K> {
    private final Object2IntMap<K> key2Address;

    public AddressRegistry() {
        this.key2Address = new Object2IntOpenHashMap<>();
        this.key2Address.defaultReturnValue(MISSING_ELEMENT); // if missing, return MISSING_ELEMENT
    }

    @Override
    public int get(K key) {
        return key2Address.getInt(key);
    }

    @Override
    public void put(K key, int stateID) {
        if (stateID < 0) {
            throw new IllegalArgumentException("Negative state ID: " + stateID);
        }
        this.key2Address.put(key, stateID);
    }

    @Override
    public int size() {
        return key2Address.size();
    }

    @Override
    public String toString() {
        return "AddressRegistry(" + size() + ")";
    }
}
