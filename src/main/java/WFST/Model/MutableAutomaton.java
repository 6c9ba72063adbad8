package WFST.Model;

import java.util.ArrayList;
import java.util.List;

import WFST.Semiring.Semiring;
import it.unimi.dsi.fastutil.ints.IntArrayList;

/**
 * Arena under construction. Not safe to share between threads; call {@link #freeze()} to obtain an
 * independent immutable {@link Automaton}.
 * @param <W> - weight type
 */
public class MutableAutomaton<W> {
    private final Semiring<W> semiring;
    private final SymbolTable symbols;

    private final List<W> finalWeights = new ArrayList<>();
    private final List<IntArrayList> outgoing = new ArrayList<>();
    private final List<Transition<W>> transitions = new ArrayList<>();
    private int start = -1;

    public MutableAutomaton(Semiring<W> semiring, SymbolTable symbols) {
        this.semiring = semiring;
        this.symbols = symbols;
    }

    public Semiring<W> getSemiring() {
        return semiring;
    }

    public SymbolTable getSymbols() {
        return symbols;
    }

    public int size() {
        return finalWeights.size();
    }

    public int addState() {
        return addState(semiring.zero());
    }

    public int addState(W finalWeight) {
        finalWeights.add(finalWeight);
        outgoing.add(new IntArrayList());
        return finalWeights.size() - 1;
    }

    public int addInitialState() {
        int q = addState();
        setStart(q);
        return q;
    }

    public void setStart(int state) {
        checkState(state);
        this.start = state;
    }

    public int getStart() {
        return start;
    }

    public void setFinal(int state, W weight) {
        checkState(state);
        finalWeights.set(state, weight);
    }

    public W getFinalWeight(int state) {
        checkState(state);
        return finalWeights.get(state);
    }

    public boolean isFinal(int state) {
        return !semiring.isZero(getFinalWeight(state));
    }

    public void addTransition(int source, int input, int output, W weight, int target) {
        checkState(source);
        checkState(target);
        if (input < 0 || input >= symbols.size() || output < 0 || output >= symbols.size()) {
            throw new IllegalArgumentException("Symbol id out of range: " + input + ":" + output);
        }
        outgoing.get(source).add(transitions.size());
        transitions.add(new Transition<>(source, input, output, weight, target));
    }

    public void addTransition(int source, String input, String output, W weight, int target) {
        addTransition(source, symbols.intern(input), symbols.intern(output), weight, target);
    }

    public void addEpsilon(int source, W weight, int target) {
        addTransition(source, SymbolTable.EPSILON, SymbolTable.EPSILON, weight, target);
    }

    public List<Transition<W>> getTransitions(int state) {
        checkState(state);
        IntArrayList idx = outgoing.get(state);
        List<Transition<W>> result = new ArrayList<>(idx.size());
        for (int i = 0; i < idx.size(); i++) {
            result.add(transitions.get(idx.getInt(i)));
        }
        return result;
    }

    /**
     * Copy all states and transitions of other into this arena.
     * @param other - automaton to embed; must share semiring and symbol table
     * @return offset added to other's state ids
     */
    public int embed(Automaton<W> other) {
        int offset = size();
        for (int q = 0; q < other.size(); q++) {
            addState(other.getFinalWeight(q));
        }
        for (Transition<W> t : other.getTransitions()) {
            addTransition(t.source() + offset, t.input(), t.output(), t.weight(), t.target() + offset);
        }
        return offset;
    }

    public Automaton<W> freeze() {
        return freeze(false);
    }

    /**
     * @param minimal - whether the caller guarantees this arena is minimal
     * @return immutable copy; determinism and epsilon-freeness are computed from the arena
     */
    public Automaton<W> freeze(boolean minimal) {
        if (start < 0) {
            throw new IllegalStateException("No start state");
        }
        int n = size();
        int[][] out = new int[n][];
        for (int q = 0; q < n; q++) {
            out[q] = outgoing.get(q).toIntArray();
        }
        @SuppressWarnings("unchecked")
        Transition<W>[] arcs = transitions.toArray(new Transition[0]);
        return new Automaton<>(semiring, symbols, start, new ArrayList<>(finalWeights), arcs, out, minimal);
    }

    private void checkState(int state) {
        if (state < 0 || state >= finalWeights.size()) {
            throw new IllegalArgumentException("No such state: " + state);
        }
    }
}
