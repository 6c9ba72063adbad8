package WFST;

import java.util.Collection;
import java.util.List;

import WFST.Model.Automaton;
import WFST.Model.Cancellation;
import WFST.Model.MutableAutomaton;
import WFST.Model.SymbolTable;
import WFST.Model.Transition;
import WFST.Regex.AST;
import WFST.Semiring.Semiring;

/**
 * Construction algebra. Every operation builds a new arena; operands are never modified.
 * Binary operations require operands sharing one semiring and one symbol table.
 */
public final class Operations {

    private Operations() {}

    /**
     * Two states, one arc reading (and writing) symbol.
     */
    public static <W> Automaton<W> symbol(Semiring<W> sr, SymbolTable symbols, String symbol) {
        return pair(sr, symbols, symbol, symbol);
    }

    /**
     * Two states, one arc reading input and writing output. Either side may be the empty string.
     */
    public static <W> Automaton<W> pair(Semiring<W> sr, SymbolTable symbols, String input, String output) {
        final MutableAutomaton<W> out = new MutableAutomaton<>(sr, symbols);
        int s = out.addInitialState();
        int f = out.addState(sr.one());
        out.addTransition(s, input, output, sr.one(), f);
        return out.freeze();
    }

    /**
     * Two states, one arc per member symbol.
     */
    public static <W> Automaton<W> symbolClass(Semiring<W> sr, SymbolTable symbols, Collection<String> members) {
        final MutableAutomaton<W> out = new MutableAutomaton<>(sr, symbols);
        int s = out.addInitialState();
        int f = out.addState(sr.one());
        for (String m : members) {
            out.addTransition(s, m, m, sr.one(), f);
        }
        return out.freeze();
    }

    public static <W> Automaton<W> emptyString(Semiring<W> sr, SymbolTable symbols) {
        return emptyString(sr, symbols, sr.one());
    }

    /**
     * Accepts only the empty string, with the given weight.
     */
    public static <W> Automaton<W> emptyString(Semiring<W> sr, SymbolTable symbols, W weight) {
        final MutableAutomaton<W> out = new MutableAutomaton<>(sr, symbols);
        int s = out.addInitialState();
        out.setFinal(s, weight);
        return out.freeze();
    }

    /**
     * Accepts nothing.
     */
    public static <W> Automaton<W> emptyLanguage(Semiring<W> sr, SymbolTable symbols) {
        final MutableAutomaton<W> out = new MutableAutomaton<>(sr, symbols);
        out.addInitialState();
        return out.freeze();
    }

    /**
     * New start state with epsilon arcs of weight one to both operand starts; finals are kept.
     */
    public static <W> Automaton<W> union(Automaton<W> a, Automaton<W> b) {
        a.requireCompatible(b);
        final Semiring<W> sr = a.getSemiring();
        final MutableAutomaton<W> out = new MutableAutomaton<>(sr, a.getSymbols());
        int start = out.addInitialState();
        int offA = out.embed(a);
        int offB = out.embed(b);
        out.addEpsilon(start, sr.one(), a.getStart() + offA);
        out.addEpsilon(start, sr.one(), b.getStart() + offB);
        return out.freeze();
    }

    /**
     * Every final state of a gets an epsilon arc, carrying its final weight, to the start of b.
     */
    public static <W> Automaton<W> concatenate(Automaton<W> a, Automaton<W> b) {
        a.requireCompatible(b);
        final Semiring<W> sr = a.getSemiring();
        final MutableAutomaton<W> out = new MutableAutomaton<>(sr, a.getSymbols());
        int offA = out.embed(a);
        int offB = out.embed(b);
        out.setStart(a.getStart() + offA);
        for (int q = 0; q < a.size(); q++) {
            if (a.isFinal(q)) {
                out.addEpsilon(q + offA, a.getFinalWeight(q), b.getStart() + offB);
                out.setFinal(q + offA, sr.zero());
            }
        }
        return out.freeze();
    }

    /**
     * Kleene star: a fresh final start state (the skip path, weight one) with an epsilon arc into a;
     * finals of a loop back to it carrying their final weight.
     */
    public static <W> Automaton<W> star(Automaton<W> a) {
        final Semiring<W> sr = a.getSemiring();
        final MutableAutomaton<W> out = new MutableAutomaton<>(sr, a.getSymbols());
        int start = out.addInitialState();
        out.setFinal(start, sr.one());
        int off = out.embed(a);
        out.addEpsilon(start, sr.one(), a.getStart() + off);
        return loopBackAndFreeze(a, out, off, start);
    }

    /**
     * One or more repetitions: like star, but the loop state is not reachable without passing through a,
     * so there is no skip path.
     */
    public static <W> Automaton<W> plus(Automaton<W> a) {
        final Semiring<W> sr = a.getSemiring();
        final MutableAutomaton<W> out = new MutableAutomaton<>(sr, a.getSymbols());
        int off = out.embed(a);
        out.setStart(a.getStart() + off);
        int loop = out.addState(sr.one());
        out.addEpsilon(loop, sr.one(), a.getStart() + off);
        return loopBackAndFreeze(a, out, off, loop);
    }

    private static <W> Automaton<W> loopBackAndFreeze(Automaton<W> a, MutableAutomaton<W> out, int off, int loop) {
        final Semiring<W> sr = a.getSemiring();
        for (int q = 0; q < a.size(); q++) {
            if (a.isFinal(q)) {
                out.addEpsilon(q + off, a.getFinalWeight(q), loop);
                out.setFinal(q + off, sr.zero());
            }
        }
        return out.freeze();
    }

    /**
     * Zero or one occurrence.
     */
    public static <W> Automaton<W> optional(Automaton<W> a) {
        return union(a, emptyString(a.getSemiring(), a.getSymbols()));
    }

    /**
     * a{min,max}; max may be AST.UNBOUNDED.
     */
    public static <W> Automaton<W> repeat(Automaton<W> a, int min, int max) {
        if (min < 0 || (max != AST.UNBOUNDED && max < min)) {
            throw new IllegalArgumentException("Bad repetition bounds {" + min + "," + max + "}");
        }
        Automaton<W> result = emptyString(a.getSemiring(), a.getSymbols());
        for (int i = 0; i < min; i++) {
            result = concatenate(result, a);
        }
        if (max == AST.UNBOUNDED) {
            return concatenate(result, star(a));
        }
        // a{0,k} as (a (a (...)?)?)? so that every count has exactly one path
        Automaton<W> tail = emptyString(a.getSemiring(), a.getSymbols());
        for (int i = min; i < max; i++) {
            tail = optional(concatenate(a, tail));
        }
        return concatenate(result, tail);
    }

    /**
     * Swap input and output tapes.
     */
    public static <W> Automaton<W> invert(Automaton<W> a) {
        return relabel(a, Tape.SWAP);
    }

    /**
     * Identity automaton over the input side.
     */
    public static <W> Automaton<W> projectInput(Automaton<W> a) {
        return relabel(a, Tape.INPUT);
    }

    /**
     * Identity automaton over the output side.
     */
    public static <W> Automaton<W> projectOutput(Automaton<W> a) {
        return relabel(a, Tape.OUTPUT);
    }

    /**
     * Relation pairing every string of upper with every string of lower: upper:ε followed by ε:lower.
     * @throws IllegalArgumentException if either operand is a transducer
     */
    public static <W> Automaton<W> crossProduct(Automaton<W> upper, Automaton<W> lower) {
        upper.requireCompatible(lower);
        if (upper.isTransducer() || lower.isTransducer()) {
            throw new IllegalArgumentException("Cross product is defined on plain automata only");
        }
        return concatenate(relabel(upper, Tape.INPUT_TO_EPSILON), relabel(lower, Tape.EPSILON_TO_OUTPUT));
    }

    public static <W> Automaton<W> reverse(Automaton<W> a) {
        return FSTTrim.reverse(a);
    }

    public static <W> Automaton<W> trim(Automaton<W> a) {
        return FSTTrim.trim(a);
    }

    public static <W> Automaton<W> intersect(Automaton<W> a, Automaton<W> b) {
        return ProductConstruction.intersect(a, b, new Cancellation());
    }

    public static <W> Automaton<W> difference(Automaton<W> a, Automaton<W> b) {
        return ProductConstruction.difference(a, b, new Cancellation());
    }

    public static <W> Automaton<W> compose(Automaton<W> a, Automaton<W> b) {
        return Composer.compose(a, b);
    }

    /**
     * Acceptor for a finite list of words, one symbol per character, determinized and minimized.
     */
    public static <W> Automaton<W> fromStrings(Semiring<W> sr, SymbolTable symbols, Collection<String> words) {
        final MutableAutomaton<W> out = new MutableAutomaton<>(sr, symbols);
        int start = out.addInitialState();
        for (String word : words) {
            int q = start;
            for (int i = 0; i < word.length(); ) {
                int cp = word.codePointAt(i);
                i += Character.charCount(cp);
                int next = out.addState();
                String sym = new String(Character.toChars(cp));
                out.addTransition(q, sym, sym, sr.one(), next);
                q = next;
            }
            out.setFinal(q, sr.one());
        }
        return Minimizer.minimize(Determinizer.determinize(out.freeze()));
    }

    /**
     * Acceptor for a finite list of symbol sequences (multichar symbols allowed).
     */
    public static <W> Automaton<W> fromSymbolSequences(Semiring<W> sr, SymbolTable symbols,
                                                       Collection<List<String>> sequences) {
        final MutableAutomaton<W> out = new MutableAutomaton<>(sr, symbols);
        int start = out.addInitialState();
        for (List<String> sequence : sequences) {
            int q = start;
            for (String sym : sequence) {
                int next = out.addState();
                out.addTransition(q, sym, sym, sr.one(), next);
                q = next;
            }
            out.setFinal(q, sr.one());
        }
        return Minimizer.minimize(Determinizer.determinize(out.freeze()));
    }

    private enum Tape {
        SWAP, INPUT, OUTPUT, INPUT_TO_EPSILON, EPSILON_TO_OUTPUT;

        int input(Transition<?> t) {
            return switch (this) {
                case SWAP, OUTPUT -> t.output();
                case INPUT, INPUT_TO_EPSILON -> t.input();
                case EPSILON_TO_OUTPUT -> SymbolTable.EPSILON;
            };
        }

        int output(Transition<?> t) {
            return switch (this) {
                case SWAP, INPUT -> t.input();
                case OUTPUT, EPSILON_TO_OUTPUT -> t.output();
                case INPUT_TO_EPSILON -> SymbolTable.EPSILON;
            };
        }
    }

    private static <W> Automaton<W> relabel(Automaton<W> a, Tape tape) {
        final MutableAutomaton<W> out = new MutableAutomaton<>(a.getSemiring(), a.getSymbols());
        for (int q = 0; q < a.size(); q++) {
            out.addState(a.getFinalWeight(q));
        }
        out.setStart(a.getStart());
        for (Transition<W> t : a.getTransitions()) {
            out.addTransition(t.source(), tape.input(t), tape.output(t), t.weight(), t.target());
        }
        return out.freeze();
    }
}
