package WFST;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

import WFST.Model.Automaton;
import WFST.Model.Cancellation;
import WFST.Model.ExplorationRecord;
import WFST.Model.MutableAutomaton;
import WFST.Model.SymbolTable;
import WFST.Model.Transition;
import WFST.Registry.AddressRegistry;
import WFST.Registry.Registry;
import WFST.Registry.StateTuple;
import WFST.Semiring.Semiring;
import it.unimi.dsi.fastutil.ints.Int2ObjectMap;
import it.unimi.dsi.fastutil.ints.Int2ObjectOpenHashMap;

/**
 * Composition of two transducers: the output tape of the first is matched against the input tape of
 * the second.
 * <p>
 * Epsilon moves are sequenced by a three-state filter so that every pair of paths is counted once:
 * <ul>
 *     <li>0: free. Matched moves and simultaneous epsilon moves stay here.</li>
 *     <li>1: the first operand moved alone on an output epsilon; only it may keep moving alone.</li>
 *     <li>2: the second operand moved alone on an input epsilon; only it may keep moving alone.</li>
 * </ul>
 */
public class Composer {
    private static final Logger LOGGER = Logger.getLogger("WFST");
    private static final long STATES_EXPLORED_PERIOD = 10000L;

    static final int FREE = 0;
    static final int LEFT_MOVED = 1;
    static final int RIGHT_MOVED = 2;

    private final Cancellation cancellation;

    public Composer(Cancellation cancellation) {
        this.cancellation = cancellation;
    }

    public static <W> Automaton<W> compose(Automaton<W> a, Automaton<W> b) {
        return compose(a, b, new Cancellation());
    }

    /**
     * @param a - applied first
     * @param b - applied to the output of a
     * @param cancellation - bound on the number of output states, and interrupt flag
     * @return relation x:z for every x:y of a and y:z of b, weighted by the product, trimmed
     * @throws ExplorationLimitException if the exploration is cancelled
     */
    public static <W> Automaton<W> compose(Automaton<W> a, Automaton<W> b, Cancellation cancellation) {
        return new Composer(cancellation).run(a, b);
    }

    public <W> Automaton<W> run(Automaton<W> a, Automaton<W> b) {
        a.requireCompatible(b);
        final Semiring<W> sr = a.getSemiring();
        final MutableAutomaton<W> out = new MutableAutomaton<>(sr, a.getSymbols());
        final Registry<StateTuple> registry = new AddressRegistry<>();
        final Deque<ExplorationRecord<StateTuple>> queue = new ArrayDeque<>();
        final InputIndex<W> indexB = new InputIndex<>(b);

        StateTuple init = new StateTuple(a.getStart(), b.getStart(), FREE);
        int initOut = out.addState(sr.times(a.getFinalWeight(init.first()), b.getFinalWeight(init.second())));
        out.setStart(initOut);
        registry.put(init, initOut);
        queue.add(new ExplorationRecord<>(init, initOut));

        long statesExplored = 0;
        while (!queue.isEmpty()) {
            if (cancellation.isCancelled(out.size())) {
                throw new ExplorationLimitException("Composition", cancellation, out.size());
            }
            ExplorationRecord<StateTuple> curr = queue.poll();
            StateTuple s = curr.key();
            int filter = s.filter();

            for (Transition<W> ta : a.getTransitions(s.first())) {
                if (ta.output() != SymbolTable.EPSILON) {
                    for (Transition<W> tb : indexB.get(s.second(), ta.output())) {
                        emit(out, registry, queue, a, b, curr.outputState(),
                            new StateTuple(ta.target(), tb.target(), FREE),
                            ta.input(), tb.output(), sr.times(ta.weight(), tb.weight()));
                    }
                    continue;
                }
                if (filter == FREE || filter == LEFT_MOVED) {
                    emit(out, registry, queue, a, b, curr.outputState(),
                        new StateTuple(ta.target(), s.second(), LEFT_MOVED),
                        ta.input(), SymbolTable.EPSILON, ta.weight());
                }
                if (filter == FREE) {
                    for (Transition<W> tb : indexB.get(s.second(), SymbolTable.EPSILON)) {
                        emit(out, registry, queue, a, b, curr.outputState(),
                            new StateTuple(ta.target(), tb.target(), FREE),
                            ta.input(), tb.output(), sr.times(ta.weight(), tb.weight()));
                    }
                }
            }
            if (filter == FREE || filter == RIGHT_MOVED) {
                for (Transition<W> tb : indexB.get(s.second(), SymbolTable.EPSILON)) {
                    emit(out, registry, queue, a, b, curr.outputState(),
                        new StateTuple(s.first(), tb.target(), RIGHT_MOVED),
                        SymbolTable.EPSILON, tb.output(), tb.weight());
                }
            }

            statesExplored++;
            if (statesExplored % STATES_EXPLORED_PERIOD == 0 && LOGGER.isLoggable(Level.FINE)) {
                LOGGER.fine("Composition explored " + statesExplored + " states - "
                    + queue.size() + " left in queue");
            }
        }
        LOGGER.fine(() -> "Composed " + a.size() + " x " + b.size() + " states into " + out.size());
        return FSTTrim.trim(out.freeze());
    }

    private static <W> void emit(MutableAutomaton<W> out, Registry<StateTuple> registry,
                                 Deque<ExplorationRecord<StateTuple>> queue, Automaton<W> a, Automaton<W> b,
                                 int source, StateTuple succ, int input, int output, W weight) {
        final Semiring<W> sr = a.getSemiring();
        if (sr.isZero(weight)) {
            return;
        }
        int outSucc = registry.get(succ);
        if (outSucc == Registry.MISSING_ELEMENT) {
            outSucc = out.addState(sr.times(a.getFinalWeight(succ.first()), b.getFinalWeight(succ.second())));
            registry.put(succ, outSucc);
            queue.add(new ExplorationRecord<>(succ, outSucc));
        }
        out.addTransition(source, input, output, weight, outSucc);
    }

    /**
     * Transitions of the second operand grouped by input symbol, built per state on first use.
     */
    private static final class InputIndex<W> {
        private final Automaton<W> automaton;
        private final Int2ObjectMap<Int2ObjectMap<List<Transition<W>>>> byState = new Int2ObjectOpenHashMap<>();

        InputIndex(Automaton<W> automaton) {
            this.automaton = automaton;
        }

        List<Transition<W>> get(int state, int input) {
            Int2ObjectMap<List<Transition<W>>> byInput = byState.get(state);
            if (byInput == null) {
                byInput = new Int2ObjectOpenHashMap<>();
                for (Transition<W> t : automaton.getTransitions(state)) {
                    List<Transition<W>> list = byInput.get(t.input());
                    if (list == null) {
                        list = new ArrayList<>();
                        byInput.put(t.input(), list);
                    }
                    list.add(t);
                }
                byState.put(state, byInput);
            }
            List<Transition<W>> result = byInput.get(input);
            return result == null ? Collections.emptyList() : result;
        }
    }
}
