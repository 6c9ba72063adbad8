package WFST;

import java.util.BitSet;

import WFST.Model.Automaton;
import WFST.Model.MutableAutomaton;
import WFST.Model.Transition;
import WFST.Semiring.Semiring;
import it.unimi.dsi.fastutil.ints.IntArrayList;

public class FSTTrim {

    private FSTTrim() {}

    /**
     * Keep only states that are reachable from the start and can reach a final state.
     * The start state is always kept, so the empty language trims to one non-final state.
     * @param automaton - original automaton
     * @return trimmed copy; state order is preserved
     */
    public static <W> Automaton<W> trim(Automaton<W> automaton) {
        final BitSet states = accessibleStates(automaton);
        states.and(coaccessibleStates(automaton));
        states.set(automaton.getStart());

        final int[] mapping = new int[automaton.size()];
        final MutableAutomaton<W> out = new MutableAutomaton<>(automaton.getSemiring(), automaton.getSymbols());
        for (int q = states.nextSetBit(0); q >= 0; q = states.nextSetBit(q + 1)) {
            mapping[q] = out.addState(automaton.getFinalWeight(q));
        }
        out.setStart(mapping[automaton.getStart()]);
        for (int q = states.nextSetBit(0); q >= 0; q = states.nextSetBit(q + 1)) {
            for (Transition<W> t : automaton.getTransitions(q)) {
                if (states.get(t.target())) {
                    out.addTransition(mapping[q], t.input(), t.output(), t.weight(), mapping[t.target()]);
                }
            }
        }
        return out.freeze(automaton.isMinimal());
    }

    /**
     * States reachable from the start over transitions of non-zero weight.
     */
    public static <W> BitSet accessibleStates(Automaton<W> automaton) {
        final Semiring<W> sr = automaton.getSemiring();
        final BitSet seen = new BitSet(automaton.size());
        final IntArrayList stack = new IntArrayList();
        seen.set(automaton.getStart());
        stack.push(automaton.getStart());
        while (!stack.isEmpty()) {
            int q = stack.popInt();
            for (Transition<W> t : automaton.getTransitions(q)) {
                if (!sr.isZero(t.weight()) && !seen.get(t.target())) {
                    seen.set(t.target());
                    stack.push(t.target());
                }
            }
        }
        return seen;
    }

    /**
     * States from which a final state is reachable over transitions of non-zero weight.
     */
    public static <W> BitSet coaccessibleStates(Automaton<W> automaton) {
        final Semiring<W> sr = automaton.getSemiring();
        final int n = automaton.size();
        final IntArrayList[] predecessors = new IntArrayList[n];
        for (int q = 0; q < n; q++) {
            predecessors[q] = new IntArrayList();
        }
        for (Transition<W> t : automaton.getTransitions()) {
            if (!sr.isZero(t.weight())) {
                predecessors[t.target()].add(t.source());
            }
        }
        final BitSet seen = new BitSet(n);
        final IntArrayList stack = new IntArrayList();
        for (int q = 0; q < n; q++) {
            if (automaton.isFinal(q)) {
                seen.set(q);
                stack.push(q);
            }
        }
        while (!stack.isEmpty()) {
            int q = stack.popInt();
            for (int i = 0; i < predecessors[q].size(); i++) {
                int p = predecessors[q].getInt(i);
                if (!seen.get(p)) {
                    seen.set(p);
                    stack.push(p);
                }
            }
        }
        return seen;
    }

    /**
     * Reverse every path: the result reads (and writes) each string backwards with the same weight.
     * A fresh start state has epsilon arcs, weighted with the old final weights, to every old final state;
     * the old start state becomes the only final state.
     */
    public static <W> Automaton<W> reverse(Automaton<W> automaton) {
        final Semiring<W> sr = automaton.getSemiring();
        final MutableAutomaton<W> out = new MutableAutomaton<>(sr, automaton.getSymbols());
        for (int q = 0; q < automaton.size(); q++) {
            out.addState();
        }
        out.setFinal(automaton.getStart(), sr.one());
        final int start = out.addInitialState();
        for (int q = 0; q < automaton.size(); q++) {
            if (automaton.isFinal(q)) {
                out.addEpsilon(start, automaton.getFinalWeight(q), q);
            }
        }
        for (Transition<W> t : automaton.getTransitions()) {
            out.addTransition(t.target(), t.input(), t.output(), t.weight(), t.source());
        }
        return out.freeze();
    }
}
