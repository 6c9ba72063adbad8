package WFST;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.logging.Logger;

import WFST.Model.Automaton;
import WFST.Model.Cancellation;
import WFST.Model.ExplorationRecord;
import WFST.Model.MutableAutomaton;
import WFST.Model.Transition;
import WFST.Registry.AddressRegistry;
import WFST.Registry.Registry;
import WFST.Registry.StateTuple;
import WFST.Semiring.Semiring;
import it.unimi.dsi.fastutil.longs.Long2ObjectMap;
import it.unimi.dsi.fastutil.longs.Long2ObjectOpenHashMap;

/**
 * Intersection and difference by lazy exploration of reachable state pairs.
 * Both operands must be deterministic: each pair then has at most one successor per label.
 */
public final class ProductConstruction {
    private static final Logger LOGGER = Logger.getLogger("WFST");
    private static final int SINK = -1;

    private ProductConstruction() {}

    /**
     * Weights are multiplied along paths and at final states.
     */
    public static <W> Automaton<W> intersect(Automaton<W> a, Automaton<W> b, Cancellation cancellation) {
        return explore(a, b, false, cancellation);
    }

    /**
     * Strings of a that b does not accept, with their weight in a. b is completed with an implicit sink.
     */
    public static <W> Automaton<W> difference(Automaton<W> a, Automaton<W> b, Cancellation cancellation) {
        return explore(a, b, true, cancellation);
    }

    private static <W> Automaton<W> explore(Automaton<W> a, Automaton<W> b, boolean complementB,
                                            Cancellation cancellation) {
        a.requireCompatible(b);
        final String op = complementB ? "Difference" : "Intersection";
        if (!a.isDeterministic() || !b.isDeterministic()) {
            throw new NonDeterministicPreconditionException(
                op + " requires deterministic, epsilon-free operands; determinize them first");
        }
        final Semiring<W> sr = a.getSemiring();
        final MutableAutomaton<W> out = new MutableAutomaton<>(sr, a.getSymbols());
        final Registry<StateTuple> registry = new AddressRegistry<>();
        final Deque<ExplorationRecord<StateTuple>> queue = new ArrayDeque<>();
        final Long2ObjectMap<Transition<W>>[] indexB = index(b);

        StateTuple init = new StateTuple(a.getStart(), b.getStart(), 0);
        int initOut = out.addState(finalWeight(a, b, init, complementB));
        out.setStart(initOut);
        registry.put(init, initOut);
        queue.add(new ExplorationRecord<>(init, initOut));

        while (!queue.isEmpty()) {
            if (cancellation.isCancelled(out.size())) {
                throw new ExplorationLimitException(op, cancellation, out.size());
            }
            ExplorationRecord<StateTuple> curr = queue.poll();
            StateTuple pair = curr.key();
            for (Transition<W> ta : a.getTransitions(pair.first())) {
                Transition<W> tb = pair.second() == SINK ? null : indexB[pair.second()].get(ta.label());
                StateTuple succ;
                W weight;
                if (tb != null) {
                    succ = new StateTuple(ta.target(), tb.target(), 0);
                    weight = complementB ? ta.weight() : sr.times(ta.weight(), tb.weight());
                } else if (complementB) {
                    succ = new StateTuple(ta.target(), SINK, 0);
                    weight = ta.weight();
                } else {
                    continue;
                }
                int outSucc = registry.get(succ);
                if (outSucc == Registry.MISSING_ELEMENT) {
                    outSucc = out.addState(finalWeight(a, b, succ, complementB));
                    registry.put(succ, outSucc);
                    queue.add(new ExplorationRecord<>(succ, outSucc));
                }
                out.addTransition(curr.outputState(), ta.input(), ta.output(), weight, outSucc);
            }
        }
        LOGGER.fine(() -> op + " explored " + out.size() + " state pairs");
        return FSTTrim.trim(out.freeze());
    }

    private static <W> W finalWeight(Automaton<W> a, Automaton<W> b, StateTuple pair, boolean complementB) {
        W fa = a.getFinalWeight(pair.first());
        if (complementB) {
            return pair.second() == SINK || !b.isFinal(pair.second()) ? fa : a.getSemiring().zero();
        }
        return a.getSemiring().times(fa, b.getFinalWeight(pair.second()));
    }

    @SuppressWarnings("unchecked")
    private static <W> Long2ObjectMap<Transition<W>>[] index(Automaton<W> automaton) {
        final Long2ObjectMap<Transition<W>>[] result = new Long2ObjectMap[automaton.size()];
        for (int q = 0; q < automaton.size(); q++) {
            result[q] = new Long2ObjectOpenHashMap<>();
            for (Transition<W> t : automaton.getTransitions(q)) {
                result[q].put(t.label(), t);
            }
        }
        return result;
    }
}
