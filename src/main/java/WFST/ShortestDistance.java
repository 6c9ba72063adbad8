package WFST;

import java.util.function.Predicate;

import WFST.Model.Automaton;
import WFST.Model.Transition;
import WFST.Semiring.Semiring;
import it.unimi.dsi.fastutil.ints.Int2ObjectMap;
import it.unimi.dsi.fastutil.ints.Int2ObjectOpenHashMap;
import it.unimi.dsi.fastutil.ints.IntArrayFIFOQueue;
import it.unimi.dsi.fastutil.ints.IntOpenHashSet;
import it.unimi.dsi.fastutil.ints.IntSet;

/**
 * Generic single-source shortest distance (semiring sum over all paths), computed by queue-based relaxation.
 * Converges for idempotent semirings without negative cycles and, up to the semiring tolerance, for
 * probability weights whose cycles have weight below one.
 */
public final class ShortestDistance {
    public static final int DEFAULT_MAX_RELAXATIONS = 1_000_000;

    private ShortestDistance() {}

    /**
     * @param automaton - graph to walk
     * @param sources - start states with their initial weights
     * @param arcFilter - which transitions may be followed
     * @param maxRelaxations - bound on weight updates before giving up
     * @return distance from the sources to every reached state (sources included)
     * @throws FSTException if the distances did not converge within maxRelaxations
     */
    public static <W> Int2ObjectMap<W> distances(Automaton<W> automaton,
                                                  Int2ObjectMap<W> sources,
                                                  Predicate<Transition<W>> arcFilter,
                                                  int maxRelaxations) {
        final Semiring<W> sr = automaton.getSemiring();
        final Int2ObjectMap<W> d = new Int2ObjectOpenHashMap<>();
        final Int2ObjectMap<W> r = new Int2ObjectOpenHashMap<>();
        final IntArrayFIFOQueue queue = new IntArrayFIFOQueue();
        final IntSet queued = new IntOpenHashSet();

        for (Int2ObjectMap.Entry<W> e : sources.int2ObjectEntrySet()) {
            d.put(e.getIntKey(), e.getValue());
            r.put(e.getIntKey(), e.getValue());
            queue.enqueue(e.getIntKey());
            queued.add(e.getIntKey());
        }

        int relaxations = 0;
        while (!queue.isEmpty()) {
            int q = queue.dequeueInt();
            queued.remove(q);
            W residual = r.get(q);
            r.put(q, sr.zero());
            if (sr.isZero(residual)) {
                continue;
            }
            for (Transition<W> t : automaton.getTransitions(q)) {
                if (!arcFilter.test(t)) {
                    continue;
                }
                W v = sr.times(residual, t.weight());
                if (sr.isZero(v)) {
                    continue;
                }
                int target = t.target();
                W old = d.getOrDefault(target, sr.zero());
                W updated = sr.plus(old, v);
                if (!d.containsKey(target) || !sr.approxEquals(old, updated)) {
                    if (++relaxations > maxRelaxations) {
                        throw new FSTException("Shortest distance did not converge within "
                            + maxRelaxations + " relaxations");
                    }
                    d.put(target, updated);
                    r.put(target, sr.plus(r.getOrDefault(target, sr.zero()), v));
                    if (queued.add(target)) {
                        queue.enqueue(target);
                    }
                }
            }
        }
        return d;
    }

    public static <W> Int2ObjectMap<W> distances(Automaton<W> automaton, int source, Predicate<Transition<W>> arcFilter) {
        Int2ObjectMap<W> sources = new Int2ObjectOpenHashMap<>();
        sources.put(source, automaton.getSemiring().one());
        return distances(automaton, sources, arcFilter, DEFAULT_MAX_RELAXATIONS);
    }

    /**
     * Weights of epsilon paths from state to every state reachable over epsilon transitions.
     */
    public static <W> Int2ObjectMap<W> epsilonClosure(Automaton<W> automaton, int state) {
        return distances(automaton, state, Transition::isEpsilon);
    }

    /**
     * Semiring sum of the weights of all accepting paths.
     */
    public static <W> W totalWeight(Automaton<W> automaton) {
        final Semiring<W> sr = automaton.getSemiring();
        Int2ObjectMap<W> d = distances(automaton, automaton.getStart(), t -> true);
        W total = sr.zero();
        for (Int2ObjectMap.Entry<W> e : d.int2ObjectEntrySet()) {
            total = sr.plus(total, sr.times(e.getValue(), automaton.getFinalWeight(e.getIntKey())));
        }
        return total;
    }
}
