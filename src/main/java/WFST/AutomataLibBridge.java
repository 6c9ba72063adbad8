package WFST;

import java.util.ArrayList;
import java.util.List;

import WFST.Model.Automaton;
import WFST.Model.MutableAutomaton;
import WFST.Model.SymbolTable;
import WFST.Model.Transition;
import WFST.Semiring.Semiring;
import net.automatalib.alphabet.Alphabet;
import net.automatalib.alphabet.impl.Alphabets;
import net.automatalib.automaton.fsa.impl.CompactDFA;
import net.automatalib.automaton.fsa.impl.CompactNFA;

/**
 * Conversion between unweighted acceptors and AutomataLib's compact automata. Weights are dropped on export:
 * a state is accepting iff its final weight is not zero, and zero-weight transitions are left out.
 */
public final class AutomataLibBridge {

    private AutomataLibBridge() {}

    /**
     * @param automaton - epsilon-free acceptor
     * @return NFA over the symbol strings of the automaton's alphabet, same state numbering
     */
    public static <W> CompactNFA<String> toCompactNFA(Automaton<W> automaton) {
        return toCompactNFA(automaton, alphabetOf(automaton));
    }

    /**
     * @param alphabet - alphabet of the result; must contain every symbol the automaton reads
     */
    public static <W> CompactNFA<String> toCompactNFA(Automaton<W> automaton, Alphabet<String> alphabet) {
        requireEpsilonFreeAcceptor(automaton);
        requireCovered(automaton, alphabet);
        final CompactNFA<String> nfa = new CompactNFA<>(alphabet, automaton.size());
        for (int q = 0; q < automaton.size(); q++) {
            nfa.addState(automaton.isFinal(q));
        }
        nfa.setInitial(automaton.getStart(), true);
        final Semiring<W> sr = automaton.getSemiring();
        for (Transition<W> t : automaton.getTransitions()) {
            if (!sr.isZero(t.weight())) {
                nfa.addTransition(t.source(), automaton.getSymbols().symbol(t.input()), t.target());
            }
        }
        return nfa;
    }

    /**
     * @param automaton - deterministic acceptor
     * @return partial DFA over the symbol strings of the automaton's alphabet, same state numbering
     */
    public static <W> CompactDFA<String> toCompactDFA(Automaton<W> automaton) {
        return toCompactDFA(automaton, alphabetOf(automaton));
    }

    /**
     * @param alphabet - alphabet of the result; must contain every symbol the automaton reads
     */
    public static <W> CompactDFA<String> toCompactDFA(Automaton<W> automaton, Alphabet<String> alphabet) {
        requireEpsilonFreeAcceptor(automaton);
        requireCovered(automaton, alphabet);
        if (!automaton.isDeterministic()) {
            throw new NonDeterministicPreconditionException("toCompactDFA requires a deterministic automaton");
        }
        final CompactDFA<String> dfa = new CompactDFA<>(alphabet, automaton.size());
        for (int q = 0; q < automaton.size(); q++) {
            dfa.addState(automaton.isFinal(q));
        }
        dfa.setInitialState(automaton.getStart());
        final Semiring<W> sr = automaton.getSemiring();
        for (Transition<W> t : automaton.getTransitions()) {
            if (!sr.isZero(t.weight())) {
                dfa.setTransition(t.source(), automaton.getSymbols().symbol(t.input()), Integer.valueOf(t.target()));
            }
        }
        return dfa;
    }

    /**
     * Import an AutomataLib NFA as an acceptor with weight one everywhere. Input symbols are named by
     * {@link String#valueOf(Object)}; several initial states are joined under a fresh start state.
     */
    public static <I, W> Automaton<W> fromCompactNFA(CompactNFA<I> nfa, Semiring<W> semiring, SymbolTable symbols) {
        final MutableAutomaton<W> out = new MutableAutomaton<>(semiring, symbols);
        for (int q = 0; q < nfa.size(); q++) {
            out.addState(nfa.isAccepting(q) ? semiring.one() : semiring.zero());
        }
        final int start = out.addInitialState();
        for (Integer init : nfa.getInitialStates()) {
            out.addEpsilon(start, semiring.one(), init);
        }
        final Alphabet<I> alphabet = nfa.getInputAlphabet();
        for (int q = 0; q < nfa.size(); q++) {
            for (I symbol : alphabet) {
                String name = String.valueOf(symbol);
                for (Integer target : nfa.getTransitions(q, symbol)) {
                    out.addTransition(q, name, name, semiring.one(), target);
                }
            }
        }
        return out.freeze();
    }

    private static Alphabet<String> alphabetOf(Automaton<?> automaton) {
        final List<String> names = new ArrayList<>();
        for (int id : automaton.getInputAlphabet()) {
            names.add(automaton.getSymbols().symbol(id));
        }
        return Alphabets.fromCollection(names);
    }

    private static void requireCovered(Automaton<?> automaton, Alphabet<String> alphabet) {
        for (int id : automaton.getInputAlphabet()) {
            String symbol = automaton.getSymbols().symbol(id);
            if (!alphabet.containsSymbol(symbol)) {
                throw new IllegalArgumentException("Symbol " + symbol + " is missing from the target alphabet");
            }
        }
    }

    private static void requireEpsilonFreeAcceptor(Automaton<?> automaton) {
        if (automaton.isTransducer()) {
            throw new IllegalArgumentException("AutomataLib export is defined on plain automata only");
        }
        if (!automaton.isEpsilonFree()) {
            throw new IllegalArgumentException("AutomataLib export requires an epsilon-free automaton");
        }
    }
}
