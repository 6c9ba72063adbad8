package WFST;

import java.util.ArrayDeque;
import java.util.Arrays;
import java.util.Deque;
import java.util.logging.Level;
import java.util.logging.Logger;

import WFST.Model.Automaton;
import WFST.Model.Cancellation;
import WFST.Model.ExplorationRecord;
import WFST.Model.MutableAutomaton;
import WFST.Model.Transition;
import WFST.Registry.AddressRegistry;
import WFST.Registry.Registry;
import WFST.Registry.WeightedSubset;
import WFST.Semiring.Semiring;
import it.unimi.dsi.fastutil.ints.Int2ObjectMap;
import it.unimi.dsi.fastutil.ints.Int2ObjectOpenHashMap;
import it.unimi.dsi.fastutil.ints.Int2ObjectRBTreeMap;
import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.objects.Object2IntMap;
import it.unimi.dsi.fastutil.objects.Object2IntOpenHashMap;

/**
 * Weighted subset construction. Each output state stands for a frontier of input states paired with
 * residual weights; frontiers are explored lazily from a FIFO work queue, so only reachable frontiers
 * are ever built. Transducers are determinized over their (input, output) label pairs.
 * <p>
 * Weighted automata without the twins property have no finite deterministic equivalent: the same set of
 * states keeps coming back with new residual weights. Unweighted subsets are bounded by 2^n for n input
 * states, so once the output outgrows that bound the construction stops with an
 * {@link ExplorationLimitException} naming the state set that recurs most often.
 */
public class Determinizer {
    private static final Logger LOGGER = Logger.getLogger("WFST");
    private static final long STATES_EXPLORED_PERIOD = 10000L;

    private final Cancellation cancellation;

    public Determinizer(Cancellation cancellation) {
        this.cancellation = cancellation;
    }

    public static <W> Automaton<W> determinize(Automaton<W> automaton) {
        return determinize(automaton, new Cancellation());
    }

    /**
     * @param automaton - any automaton
     * @param cancellation - bound on the number of output states, and interrupt flag
     * @return deterministic, epsilon-free equivalent
     * @throws ExplorationLimitException if the exploration is cancelled
     */
    public static <W> Automaton<W> determinize(Automaton<W> automaton, Cancellation cancellation) {
        return new Determinizer(cancellation).run(automaton);
    }

    public <W> Automaton<W> run(Automaton<W> automaton) {
        if (automaton.isDeterministic()) {
            return automaton;
        }
        return new Run<>(automaton, cancellation).explore();
    }

    private static final class Run<W> {
        private final Automaton<W> nfa;
        private final Semiring<W> sr;
        private final Cancellation cancellation;
        private final SymbolClasses classes;
        private final Int2ObjectMap<Int2ObjectMap<W>> closures = new Int2ObjectOpenHashMap<>();
        // distinct residual vectors seen per state set
        private final Object2IntMap<IntArrayList> variants = new Object2IntOpenHashMap<>();
        private final long subsetBound;
        private IntArrayList mostVaried;

        Run(Automaton<W> nfa, Cancellation cancellation) {
            this.nfa = nfa;
            this.sr = nfa.getSemiring();
            this.cancellation = cancellation;
            this.classes = SymbolClasses.of(nfa);
            this.subsetBound = nfa.size() < Long.SIZE - 1 ? 1L << nfa.size() : Long.MAX_VALUE;
        }

        Automaton<W> explore() {
            final MutableAutomaton<W> out = new MutableAutomaton<>(sr, nfa.getSymbols());
            final Registry<WeightedSubset> registry = new AddressRegistry<>();
            final Deque<ExplorationRecord<WeightedSubset>> queue = new ArrayDeque<>();

            Int2ObjectMap<W> initWeights = new Int2ObjectOpenHashMap<>();
            initWeights.put(nfa.getStart(), sr.one());
            WeightedSubset init = toSubset(closure(initWeights));
            int initOut = out.addState(finalWeight(init));
            out.setStart(initOut);
            registry.put(init, initOut);
            countVariant(init, out.size());
            queue.add(new ExplorationRecord<>(init, initOut));

            long statesExplored = 0;
            while (!queue.isEmpty()) {
                if (cancellation.isCancelled(out.size())) {
                    throw new ExplorationLimitException("Determinization", cancellation, out.size());
                }
                ExplorationRecord<WeightedSubset> curr = queue.poll();
                WeightedSubset inState = curr.key();
                int outState = curr.outputState();

                for (Int2ObjectMap.Entry<Int2ObjectMap<W>> e : successors(inState).int2ObjectEntrySet()) {
                    Int2ObjectMap<W> succWeights = closure(e.getValue());
                    W total = sr.zero();
                    for (W w : succWeights.values()) {
                        total = sr.plus(total, w);
                    }
                    if (sr.isZero(total)) {
                        continue;
                    }
                    Int2ObjectMap<W> residuals = new Int2ObjectOpenHashMap<>(succWeights.size());
                    for (Int2ObjectMap.Entry<W> s : succWeights.int2ObjectEntrySet()) {
                        residuals.put(s.getIntKey(), sr.divide(s.getValue(), total));
                    }
                    WeightedSubset succ = toSubset(residuals);
                    int outSucc = registry.get(succ);
                    if (outSucc == Registry.MISSING_ELEMENT) {
                        // add new state to output and to queue
                        outSucc = out.addState(finalWeight(succ));
                        registry.put(succ, outSucc);
                        countVariant(succ, out.size());
                        queue.add(new ExplorationRecord<>(succ, outSucc));
                    }
                    long label = classes.label(e.getIntKey());
                    out.addTransition(outState, Transition.labelInput(label), Transition.labelOutput(label), total, outSucc);
                }
                statesExplored++;
                if (statesExplored % STATES_EXPLORED_PERIOD == 0 && LOGGER.isLoggable(Level.FINE)) {
                    LOGGER.fine("Determinization explored " + statesExplored + " frontiers - "
                        + queue.size() + " left in queue - " + out.size() + " states added");
                }
            }
            LOGGER.fine(() -> "Determinized " + nfa.size() + " states into " + out.size());
            return out.freeze();
        }

        private void countVariant(WeightedSubset subset, int outputStates) {
            final IntArrayList stateSet = new IntArrayList(subset.size());
            for (int i = 0; i < subset.size(); i++) {
                stateSet.add(subset.state(i));
            }
            int count = variants.getInt(stateSet) + 1;
            variants.put(stateSet, count);
            if (mostVaried == null || count > variants.getInt(mostVaried)) {
                mostVaried = stateSet;
            }
            if (outputStates > subsetBound) {
                throw new ExplorationLimitException("Determinization of " + nfa.size() + " states produced "
                    + outputStates + " frontiers, more than 2^" + nfa.size() + ": the automaton lacks the twins "
                    + "property (states " + mostVaried + " recur with " + variants.getInt(mostVaried)
                    + " different residual weights)", outputStates);
            }
        }

        /**
         * Weighted successors of a frontier, grouped by symbol class (sorted for a stable state order).
         */
        @SuppressWarnings("unchecked")
        private Int2ObjectMap<Int2ObjectMap<W>> successors(WeightedSubset subset) {
            final Int2ObjectMap<Int2ObjectMap<W>> bySymbol = new Int2ObjectRBTreeMap<>();
            for (int i = 0; i < subset.size(); i++) {
                W residual = (W) subset.residual(i);
                for (Transition<W> t : nfa.getTransitions(subset.state(i))) {
                    if (t.isEpsilon()) {
                        continue;
                    }
                    W v = sr.times(residual, t.weight());
                    if (sr.isZero(v)) {
                        continue;
                    }
                    Int2ObjectMap<W> targets = bySymbol.get(classes.classOf(t.label()));
                    if (targets == null) {
                        targets = new Int2ObjectOpenHashMap<>();
                        bySymbol.put(classes.classOf(t.label()), targets);
                    }
                    W old = targets.get(t.target());
                    targets.put(t.target(), old == null ? v : sr.plus(old, v));
                }
            }
            return bySymbol;
        }

        private Int2ObjectMap<W> closure(Int2ObjectMap<W> weights) {
            if (nfa.isEpsilonFree()) {
                return weights;
            }
            final Int2ObjectMap<W> result = new Int2ObjectOpenHashMap<>();
            for (Int2ObjectMap.Entry<W> e : weights.int2ObjectEntrySet()) {
                Int2ObjectMap<W> reach = closures.get(e.getIntKey());
                if (reach == null) {
                    reach = ShortestDistance.epsilonClosure(nfa, e.getIntKey());
                    closures.put(e.getIntKey(), reach);
                }
                for (Int2ObjectMap.Entry<W> r : reach.int2ObjectEntrySet()) {
                    W v = sr.times(e.getValue(), r.getValue());
                    W old = result.get(r.getIntKey());
                    result.put(r.getIntKey(), old == null ? v : sr.plus(old, v));
                }
            }
            return result;
        }

        private WeightedSubset toSubset(Int2ObjectMap<W> weights) {
            final int[] states = weights.keySet().toIntArray();
            Arrays.sort(states);
            int n = 0;
            for (int q : states) {
                if (!sr.isZero(weights.get(q))) {
                    states[n++] = q;
                }
            }
            final int[] kept = Arrays.copyOf(states, n);
            final Object[] residuals = new Object[n];
            for (int i = 0; i < n; i++) {
                residuals[i] = sr.quantize(weights.get(kept[i]));
            }
            return new WeightedSubset(kept, residuals);
        }

        @SuppressWarnings("unchecked")
        private W finalWeight(WeightedSubset subset) {
            W result = sr.zero();
            for (int i = 0; i < subset.size(); i++) {
                result = sr.plus(result, sr.times((W) subset.residual(i), nfa.getFinalWeight(subset.state(i))));
            }
            return result;
        }
    }
}
