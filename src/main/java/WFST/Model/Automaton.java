package WFST.Model;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import WFST.AlphabetMismatchException;
import WFST.SemiringMismatchException;
import WFST.Semiring.Semiring;
import it.unimi.dsi.fastutil.ints.IntRBTreeSet;
import it.unimi.dsi.fastutil.ints.IntSortedSet;
import it.unimi.dsi.fastutil.longs.LongOpenHashSet;
import it.unimi.dsi.fastutil.longs.LongSet;

/**
 * Immutable weighted automaton or transducer. States are arena indices 0..size()-1.
 * Instances own their arena exclusively and may be read concurrently.
 * @param <W> - weight type
 */
public final class Automaton<W> {
    private final Semiring<W> semiring;
    private final SymbolTable symbols;
    private final int start;
    private final List<W> finalWeights;
    private final Transition<W>[] transitions;
    private final int[][] outgoing;

    private final boolean deterministic;
    private final boolean epsilonFree;
    private final boolean minimal;
    private final boolean transducer;

    Automaton(Semiring<W> semiring, SymbolTable symbols, int start, List<W> finalWeights,
              Transition<W>[] transitions, int[][] outgoing, boolean minimal) {
        this.semiring = semiring;
        this.symbols = symbols;
        this.start = start;
        this.finalWeights = Collections.unmodifiableList(finalWeights);
        this.transitions = transitions;
        this.outgoing = outgoing;

        boolean epsFree = true;
        boolean det = true;
        boolean trans = false;
        LongSet seen = new LongOpenHashSet();
        for (int q = 0; q < outgoing.length; q++) {
            seen.clear();
            for (int idx : outgoing[q]) {
                Transition<W> t = transitions[idx];
                if (t.isEpsilon()) {
                    epsFree = false;
                } else if (!seen.add(t.label())) {
                    det = false;
                }
                trans |= !t.isIdentity();
            }
        }
        this.epsilonFree = epsFree;
        this.deterministic = det && epsFree;
        this.transducer = trans;
        this.minimal = minimal && this.deterministic;
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

    public int getStart() {
        return start;
    }

    public W getFinalWeight(int state) {
        return finalWeights.get(state);
    }

    public boolean isFinal(int state) {
        return !semiring.isZero(finalWeights.get(state));
    }

    public List<Transition<W>> getTransitions(int state) {
        int[] idx = outgoing[state];
        List<Transition<W>> result = new ArrayList<>(idx.length);
        for (int i : idx) {
            result.add(transitions[i]);
        }
        return result;
    }

    public List<Transition<W>> getTransitions() {
        return Collections.unmodifiableList(Arrays.asList(transitions));
    }

    public int numTransitions() {
        return transitions.length;
    }

    /**
     * At most one transition per (state, label) and no epsilon transitions.
     * The label of a transducer arc is its (input, output) pair.
     */
    public boolean isDeterministic() {
        return deterministic;
    }

    public boolean isEpsilonFree() {
        return epsilonFree;
    }

    public boolean isMinimal() {
        return minimal;
    }

    public boolean isTransducer() {
        return transducer;
    }

    public IntSortedSet getInputAlphabet() {
        IntSortedSet result = new IntRBTreeSet();
        for (Transition<W> t : transitions) {
            if (t.input() != SymbolTable.EPSILON) {
                result.add(t.input());
            }
        }
        return result;
    }

    public IntSortedSet getOutputAlphabet() {
        IntSortedSet result = new IntRBTreeSet();
        for (Transition<W> t : transitions) {
            if (t.output() != SymbolTable.EPSILON) {
                result.add(t.output());
            }
        }
        return result;
    }

    /**
     * Symbols actually used on either tape, epsilon excluded.
     */
    public IntSortedSet getAlphabet() {
        IntSortedSet result = getInputAlphabet();
        result.addAll(getOutputAlphabet());
        return result;
    }

    /**
     * @throws SemiringMismatchException if other was built under another weight algebra
     * @throws AlphabetMismatchException if other interns its symbols elsewhere
     */
    public void requireCompatible(Automaton<?> other) {
        if (!semiring.equals(other.semiring)) {
            throw new SemiringMismatchException(
                "Cannot combine " + semiring.getName() + " and " + other.semiring.getName() + " automata");
        }
        if (symbols != other.symbols) {
            throw new AlphabetMismatchException("Operands use different symbol tables");
        }
    }

    /**
     * Flat, ordered view of all arcs: by source state, then insertion order.
     * Output symbols are null for plain automata.
     */
    public List<ExportedTransition<W>> exportTransitions() {
        List<ExportedTransition<W>> result = new ArrayList<>(transitions.length);
        for (int q = 0; q < size(); q++) {
            for (int idx : outgoing[q]) {
                Transition<W> t = transitions[idx];
                String out = transducer ? symbols.symbol(t.output()) : null;
                result.add(new ExportedTransition<>(q, symbols.symbol(t.input()), out, t.target(), t.weight()));
            }
        }
        return result;
    }

    public MutableAutomaton<W> toMutable() {
        MutableAutomaton<W> copy = new MutableAutomaton<>(semiring, symbols);
        copy.embed(this);
        copy.setStart(start);
        return copy;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append("Automaton[").append(semiring.getName()).append(", ").append(size()).append(" states, start ")
            .append(start).append("]\n");
        for (ExportedTransition<W> t : exportTransitions()) {
            sb.append(t.source()).append('\t').append(t.target()).append('\t').append(label(t.input()));
            if (t.output() != null) {
                sb.append('\t').append(label(t.output()));
            }
            sb.append('\t').append(t.weight()).append('\n');
        }
        for (int q = 0; q < size(); q++) {
            if (isFinal(q)) {
                sb.append(q).append('\t').append(getFinalWeight(q)).append('\n');
            }
        }
        return sb.toString();
    }

    private static String label(String symbol) {
        return symbol.isEmpty() ? "@0@" : symbol;
    }
}
