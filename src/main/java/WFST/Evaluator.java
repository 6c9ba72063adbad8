package WFST;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashSet;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Optional;
import java.util.PriorityQueue;
import java.util.Set;
import java.util.logging.Logger;

import WFST.Model.Automaton;
import WFST.Model.Path;
import WFST.Model.SymbolTable;
import WFST.Model.Transition;
import WFST.Semiring.Semiring;
import it.unimi.dsi.fastutil.ints.Int2ObjectMap;
import it.unimi.dsi.fastutil.ints.Int2ObjectOpenHashMap;
import it.unimi.dsi.fastutil.ints.IntSortedSet;

/**
 * Running automata on inputs. String inputs are tokenized against the input alphabet by longest match;
 * list inputs are taken symbol by symbol.
 * <p>
 * {@link #apply} and {@link #analyze} treat {@link FlagDiacritics flag diacritic} symbols as reading no input.
 * By default they obey the flags: paths whose flags conflict are dropped, and flag symbols are left out
 * of the reported paths.
 */
public final class Evaluator {
    private static final Logger LOGGER = Logger.getLogger("WFST");
    public static final int DEFAULT_MAX_STEPS = 100_000;

    private Evaluator() {}

    /**
     * Split input into symbols of the automaton's input alphabet, longest match first. Characters that
     * start no known symbol become one-character symbols of their own.
     */
    public static List<String> tokenize(Automaton<?> automaton, String input) {
        final SymbolTable symbols = automaton.getSymbols();
        final IntSortedSet alphabet = automaton.getInputAlphabet();
        final List<String> known = new ArrayList<>(alphabet.size());
        for (int id : alphabet) {
            known.add(symbols.symbol(id));
        }
        known.sort(Comparator.comparingInt(String::length).reversed());

        final List<String> result = new ArrayList<>();
        int pos = 0;
        while (pos < input.length()) {
            String match = null;
            for (String s : known) {
                if (input.startsWith(s, pos)) {
                    match = s;
                    break;
                }
            }
            if (match == null) {
                match = new String(Character.toChars(input.codePointAt(pos)));
            }
            result.add(match);
            pos += match.length();
        }
        return result;
    }

    public static <W> boolean accepts(Automaton<W> automaton, String input) {
        return accepts(automaton, tokenize(automaton, input));
    }

    /**
     * Whether some accepting path reads input (on the input tape, for transducers).
     */
    public static <W> boolean accepts(Automaton<W> automaton, List<String> input) {
        return !automaton.getSemiring().isZero(weight(automaton, input));
    }

    public static <W> W weight(Automaton<W> automaton, String input) {
        return weight(automaton, tokenize(automaton, input));
    }

    /**
     * Semiring sum of the weights of all accepting paths reading input.
     * @return zero if input is rejected
     */
    public static <W> W weight(Automaton<W> automaton, List<String> input) {
        final Semiring<W> sr = automaton.getSemiring();
        Int2ObjectMap<W> frontier = new Int2ObjectOpenHashMap<>();
        frontier.put(automaton.getStart(), sr.one());
        frontier = inputEpsilonClosure(automaton, frontier);
        for (String symbol : input) {
            int id = automaton.getSymbols().lookup(symbol);
            if (id == SymbolTable.MISSING_SYMBOL || id == SymbolTable.EPSILON) {
                return sr.zero();
            }
            final Int2ObjectMap<W> next = new Int2ObjectOpenHashMap<>();
            for (Int2ObjectMap.Entry<W> e : frontier.int2ObjectEntrySet()) {
                for (Transition<W> t : automaton.getTransitions(e.getIntKey())) {
                    if (t.input() != id) {
                        continue;
                    }
                    W v = sr.times(e.getValue(), t.weight());
                    W old = next.get(t.target());
                    next.put(t.target(), old == null ? v : sr.plus(old, v));
                }
            }
            if (next.isEmpty()) {
                return sr.zero();
            }
            frontier = inputEpsilonClosure(automaton, next);
        }
        W total = sr.zero();
        for (Int2ObjectMap.Entry<W> e : frontier.int2ObjectEntrySet()) {
            total = sr.plus(total, sr.times(e.getValue(), automaton.getFinalWeight(e.getIntKey())));
        }
        return total;
    }

    private static <W> Int2ObjectMap<W> inputEpsilonClosure(Automaton<W> automaton, Int2ObjectMap<W> frontier) {
        return ShortestDistance.distances(automaton, frontier, t -> t.input() == SymbolTable.EPSILON,
            ShortestDistance.DEFAULT_MAX_RELAXATIONS);
    }

    public static <W> Iterable<Path<W>> apply(Automaton<W> automaton, String input, int maxSteps) {
        return apply(automaton, tokenize(automaton, input), maxSteps, true);
    }

    public static <W> Iterable<Path<W>> apply(Automaton<W> automaton, String input, int maxSteps,
                                              boolean obeyFlags) {
        return apply(automaton, tokenize(automaton, input), maxSteps, obeyFlags);
    }

    public static <W> Iterable<Path<W>> apply(Automaton<W> automaton, List<String> input, int maxSteps) {
        return apply(automaton, input, maxSteps, true);
    }

    /**
     * Outputs of the transducer for input, lazily, best weight first. Each distinct output is reported once,
     * with the weight of its best path. The search stops silently after maxSteps expansions.
     * @param obeyFlags - drop paths with conflicting flag diacritics and hide the flags; otherwise flags
     *                  are reported like ordinary symbols
     */
    public static <W> Iterable<Path<W>> apply(Automaton<W> automaton, List<String> input, int maxSteps,
                                              boolean obeyFlags) {
        final int[] ids = new int[input.size()];
        for (int i = 0; i < ids.length; i++) {
            ids[i] = automaton.getSymbols().lookup(input.get(i));
            if (ids[i] == SymbolTable.MISSING_SYMBOL || ids[i] == SymbolTable.EPSILON) {
                return Collections.emptyList();
            }
        }
        return () -> new PathSearch<>(automaton, ids, maxSteps, false, obeyFlags);
    }

    public static <W> Iterable<Path<W>> analyze(Automaton<W> automaton, String output, int maxSteps) {
        return analyze(automaton, output, maxSteps, true);
    }

    public static <W> Iterable<Path<W>> analyze(Automaton<W> automaton, String output, int maxSteps,
                                                boolean obeyFlags) {
        Automaton<W> inverse = Operations.invert(automaton);
        return apply(inverse, tokenize(inverse, output), maxSteps, obeyFlags);
    }

    /**
     * Inverse application: inputs that the transducer maps to output.
     */
    public static <W> Iterable<Path<W>> analyze(Automaton<W> automaton, List<String> output, int maxSteps) {
        return apply(Operations.invert(automaton), output, maxSteps, true);
    }

    /**
     * Best accepting path by the semiring order.
     * @return empty if no final state is reachable within the default step bound
     */
    public static <W> Optional<Path<W>> shortestPath(Automaton<W> automaton) {
        Iterator<Path<W>> paths = new PathSearch<>(automaton, null, DEFAULT_MAX_STEPS, true, false);
        return paths.hasNext() ? Optional.of(paths.next()) : Optional.empty();
    }

    /**
     * Up to limit distinct (input, output) pairs of the relation, best weight first.
     */
    public static <W> List<Path<W>> words(Automaton<W> automaton, int limit) {
        if (limit < 0) {
            throw new IllegalArgumentException("Negative limit: " + limit);
        }
        final List<Path<W>> result = new ArrayList<>();
        Iterator<Path<W>> paths = new PathSearch<>(automaton, null, DEFAULT_MAX_STEPS, true, false);
        while (result.size() < limit && paths.hasNext()) {
            result.add(paths.next());
        }
        return result;
    }

    public static <W> W totalWeight(Automaton<W> automaton) {
        return ShortestDistance.totalWeight(automaton);
    }

    /**
     * Symbols collected along a search branch, shared between branches.
     */
    private record Trail(int symbol, Trail previous) {
        static Trail push(Trail trail, int symbol) {
            return symbol == SymbolTable.EPSILON ? trail : new Trail(symbol, trail);
        }

        static List<String> toList(Trail trail, SymbolTable symbols) {
            final List<String> result = new ArrayList<>();
            for (Trail t = trail; t != null; t = t.previous) {
                result.add(symbols.symbol(t.symbol));
            }
            Collections.reverse(result);
            return result;
        }
    }

    /**
     * Search node. A complete node has already been multiplied by its state's final weight.
     */
    private record Node<W>(int state, int position, Trail input, Trail output, W weight,
                           FlagDiacritics.Settings flags, boolean complete, long order) { }

    /**
     * Best-first enumeration of accepting paths. With input == null every path is a candidate; otherwise
     * the input tape must spell input, flag diacritics on the input tape excepted. Ties are broken by
     * insertion order.
     */
    private static final class PathSearch<W> implements Iterator<Path<W>> {
        private final Automaton<W> automaton;
        private final Semiring<W> sr;
        private final int[] input;
        private final int maxSteps;
        private final boolean keyByInput;
        private final boolean obeyFlags;
        private final Int2ObjectMap<FlagDiacritics.Flag> flags = new Int2ObjectOpenHashMap<>();
        private final PriorityQueue<Node<W>> queue;
        private final Set<List<String>> reported = new HashSet<>();
        private Path<W> next;
        private long order;
        private int steps;

        PathSearch(Automaton<W> automaton, int[] input, int maxSteps, boolean keyByInput, boolean obeyFlags) {
            this.automaton = automaton;
            this.sr = automaton.getSemiring();
            this.input = input;
            this.maxSteps = maxSteps;
            this.keyByInput = keyByInput;
            this.obeyFlags = obeyFlags;
            this.queue = new PriorityQueue<>((x, y) -> {
                int c = sr.compare(x.weight(), y.weight());
                return c != 0 ? c : Long.compare(x.order(), y.order());
            });
            queue.add(new Node<>(automaton.getStart(), 0, null, null, sr.one(), FlagDiacritics.Settings.EMPTY,
                false, order++));
            if (input != null) {
                for (int id : automaton.getAlphabet()) {
                    FlagDiacritics.Flag flag = FlagDiacritics.parse(automaton.getSymbols().symbol(id));
                    if (flag != null) {
                        flags.put(id, flag);
                    }
                }
            }
        }

        @Override
        public boolean hasNext() {
            if (next == null) {
                next = advance();
            }
            return next != null;
        }

        @Override
        public Path<W> next() {
            if (!hasNext()) {
                throw new NoSuchElementException();
            }
            Path<W> result = next;
            next = null;
            return result;
        }

        private Path<W> advance() {
            while (!queue.isEmpty()) {
                if (steps++ >= maxSteps) {
                    LOGGER.fine(() -> "Path search stopped after " + maxSteps + " steps");
                    queue.clear();
                    return null;
                }
                Node<W> node = queue.poll();
                if (node.complete()) {
                    Path<W> path = new Path<>(Trail.toList(node.input(), automaton.getSymbols()),
                        Trail.toList(node.output(), automaton.getSymbols()), node.weight());
                    List<String> key = keyByInput ? List.of(path.inputString(), path.outputString())
                        : path.output();
                    if (reported.add(key)) {
                        return path;
                    }
                    continue;
                }
                expand(node);
            }
            return null;
        }

        private void expand(Node<W> node) {
            int q = node.state();
            if (automaton.isFinal(q) && (input == null || node.position() == input.length)) {
                queue.add(new Node<>(q, node.position(), node.input(), node.output(),
                    sr.times(node.weight(), automaton.getFinalWeight(q)), node.flags(), true, order++));
            }
            for (Transition<W> t : automaton.getTransitions(q)) {
                int position = node.position();
                FlagDiacritics.Settings settings = node.flags();
                FlagDiacritics.Flag flag = flags.get(t.input());
                if (flag != null) {
                    if (obeyFlags) {
                        settings = flag.apply(settings);
                        if (settings == null) {
                            continue;
                        }
                    }
                } else if (input != null && t.input() != SymbolTable.EPSILON) {
                    if (position == input.length || input[position] != t.input()) {
                        continue;
                    }
                    position++;
                }
                W w = sr.times(node.weight(), t.weight());
                if (sr.isZero(w)) {
                    continue;
                }
                boolean hidden = obeyFlags && flag != null;
                Trail in = hidden ? node.input() : Trail.push(node.input(), t.input());
                Trail out = obeyFlags && flags.containsKey(t.output()) ? node.output()
                    : Trail.push(node.output(), t.output());
                queue.add(new Node<>(t.target(), position, in, out, w, settings, false, order++));
            }
        }
    }
}
