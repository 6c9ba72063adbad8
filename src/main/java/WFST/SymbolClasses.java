package WFST;

import WFST.Model.Automaton;
import WFST.Model.SymbolTable;
import WFST.Model.Transition;
import it.unimi.dsi.fastutil.longs.Long2IntMap;
import it.unimi.dsi.fastutil.longs.Long2IntOpenHashMap;
import it.unimi.dsi.fastutil.longs.LongArrayList;
import it.unimi.dsi.fastutil.longs.LongList;
import it.unimi.dsi.fastutil.longs.LongRBTreeSet;
import it.unimi.dsi.fastutil.longs.LongSortedSet;

/**
 * Disjoint label classes of an automaton. Every distinct (input, output) pair in use is one class,
 * so matching a class during exploration is exact on both tapes. Epsilon is not a class.
 */
public final class SymbolClasses {
    public static final int MISSING_CLASS = -1;

    private final LongList labels;
    private final Long2IntMap label2Class;

    private SymbolClasses(LongSortedSet sorted) {
        this.labels = new LongArrayList(sorted);
        this.label2Class = new Long2IntOpenHashMap(labels.size());
        this.label2Class.defaultReturnValue(MISSING_CLASS);
        for (int i = 0; i < labels.size(); i++) {
            label2Class.put(labels.getLong(i), i);
        }
    }

    public static SymbolClasses of(Automaton<?> automaton) {
        final LongSortedSet sorted = new LongRBTreeSet();
        for (Transition<?> t : automaton.getTransitions()) {
            if (!t.isEpsilon()) {
                sorted.add(t.label());
            }
        }
        return new SymbolClasses(sorted);
    }

    public int size() {
        return labels.size();
    }

    public long label(int symbolClass) {
        return labels.getLong(symbolClass);
    }

    /**
     * @return class index of label, or MISSING_CLASS
     */
    public int classOf(long label) {
        return label2Class.get(label);
    }

    public String describe(int symbolClass, SymbolTable symbols) {
        long label = label(symbolClass);
        int in = Transition.labelInput(label);
        int out = Transition.labelOutput(label);
        return in == out ? symbols.symbol(in) : symbols.symbol(in) + ":" + symbols.symbol(out);
    }
}
