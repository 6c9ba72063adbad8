package WFST.Model;

import java.util.Collections;
import java.util.List;

import it.unimi.dsi.fastutil.objects.Object2IntMap;
import it.unimi.dsi.fastutil.objects.Object2IntOpenHashMap;
import it.unimi.dsi.fastutil.objects.ObjectArrayList;

/**
 * Session-scoped symbol interner. Symbol ids are dense; id 0 is epsilon, the empty string.
 * Automata combined by binary operations must share one table.
 * Not thread-safe while symbols are still being added.
 */
public class SymbolTable {
    public static final int EPSILON = 0;
    public static final int MISSING_SYMBOL = -1;

    private final Object2IntMap<String> symbol2Id;
    private final ObjectArrayList<String> symbols;

    public SymbolTable() {
        this.symbol2Id = new Object2IntOpenHashMap<>();
        this.symbol2Id.defaultReturnValue(MISSING_SYMBOL);
        this.symbols = new ObjectArrayList<>();
        intern("");
    }

    /**
     * @return id of symbol, adding it if it is new
     */
    public int intern(String symbol) {
        int id = symbol2Id.getInt(symbol);
        if (id == MISSING_SYMBOL) {
            id = symbols.size();
            symbols.add(symbol);
            symbol2Id.put(symbol, id);
        }
        return id;
    }

    /**
     * @return id of symbol or MISSING_SYMBOL
     */
    public int lookup(String symbol) {
        return symbol2Id.getInt(symbol);
    }

    public String symbol(int id) {
        if (id < 0 || id >= symbols.size()) {
            throw new IllegalArgumentException("Unknown symbol id: " + id);
        }
        return symbols.get(id);
    }

    public int size() {
        return symbols.size();
    }

    public List<String> symbols() {
        return Collections.unmodifiableList(symbols);
    }

    @Override
    public String toString() {
        return "SymbolTable" + symbols.subList(1, symbols.size());
    }
}
