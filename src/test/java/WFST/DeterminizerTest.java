package WFST;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import WFST.Model.Automaton;
import WFST.Model.Cancellation;
import WFST.Model.MutableAutomaton;
import WFST.Model.SymbolTable;
import WFST.Semiring.Semiring;

public class DeterminizerTest {

  @Test
  void testUnweighted() {
    SymbolTable symbols = new SymbolTable();
    Automaton<Boolean> nfa = Compiler.compile("a | ab | (a|b)*c", Semiring.booleans(), symbols);
    Assertions.assertFalse(nfa.isDeterministic());
    Automaton<Boolean> dfa = Determinizer.determinize(nfa);
    Assertions.assertTrue(dfa.isDeterministic());
    Assertions.assertTrue(dfa.isEpsilonFree());
    for (String w : CompilerTest.wordsUpTo(4, "a", "b", "c")) {
      Assertions.assertEquals(Evaluator.accepts(nfa, w), Evaluator.accepts(dfa, w), w);
    }
  }

  @Test
  void testAlreadyDeterministicIsReturned() {
    SymbolTable symbols = new SymbolTable();
    Automaton<Boolean> dfa = Determinizer.determinize(Compiler.compile("ab|c", Semiring.booleans(), symbols));
    Assertions.assertSame(dfa, Determinizer.determinize(dfa));
  }

  @Test
  void testTropicalResiduals() {
    Automaton<Double> nfa = Compiler.compile("a<1>b | a<2>c | a<5>b", Semiring.tropical(), new SymbolTable());
    Automaton<Double> dfa = Determinizer.determinize(nfa);
    Assertions.assertTrue(dfa.isDeterministic());
    Assertions.assertEquals(1.0, Evaluator.weight(dfa, "ab"), 1e-9);
    Assertions.assertEquals(2.0, Evaluator.weight(dfa, "ac"), 1e-9);
    Assertions.assertEquals(Double.POSITIVE_INFINITY, Evaluator.weight(dfa, "a"));
    Assertions.assertEquals(1, dfa.getTransitions(dfa.getStart()).size());
  }

  @Test
  void testStopsWithoutTwinsProperty() {
    // after a^k the two branches differ by k, so no two frontiers are ever equal
    Automaton<Double> nfa = Compiler.compile("(a<1>)*b | (a<2>)*c", Semiring.tropical(), new SymbolTable());
    ExplorationLimitException e = Assertions.assertThrows(ExplorationLimitException.class,
        () -> Determinizer.determinize(nfa, new Cancellation(50000)));
    Assertions.assertTrue(e.getStatesExplored() <= (1L << nfa.size()) + 1, e.getMessage());
    Assertions.assertTrue(e.getMessage().contains("twins"), e.getMessage());

    // equal cycle weights keep the residuals fixed
    Automaton<Double> twins = Compiler.compile("(a<1>)*b | (a<1>)*c", Semiring.tropical(), new SymbolTable());
    Automaton<Double> dfa = Determinizer.determinize(twins, new Cancellation(50000));
    Assertions.assertTrue(dfa.isDeterministic());
    Assertions.assertEquals(2.0, Evaluator.weight(dfa, "aab"), 1e-9);
    Assertions.assertEquals(3.0, Evaluator.weight(dfa, "aaac"), 1e-9);
  }

  @Test
  void testProbabilitySumsAmbiguousPaths() {
    Automaton<Double> nfa = Compiler.compile("a<0.5>b | a<0.25>b | a<0.25>c", Semiring.probability(),
        new SymbolTable());
    Automaton<Double> dfa = Determinizer.determinize(nfa);
    Assertions.assertEquals(0.75, Evaluator.weight(dfa, "ab"), 1e-9);
    Assertions.assertEquals(0.25, Evaluator.weight(dfa, "ac"), 1e-9);
    Assertions.assertEquals(1.0, Evaluator.totalWeight(dfa), 1e-9);
  }

  @Test
  void testTransducerPairLabels() {
    SymbolTable symbols = new SymbolTable();
    Automaton<Boolean> nfa = Compiler.compile("a:x b | a:x c | a:y b", Semiring.booleans(), symbols);
    Automaton<Boolean> dfa = Determinizer.determinize(nfa);
    Assertions.assertTrue(dfa.isDeterministic());
    Assertions.assertTrue(dfa.isTransducer());
    // a:x and a:y are different labels
    Assertions.assertEquals(2, dfa.getTransitions(dfa.getStart()).size());
    Assertions.assertEquals(CompilerTest.outputs(Evaluator.apply(nfa, "ab", 100)).size(),
        CompilerTest.outputs(Evaluator.apply(dfa, "ab", 100)).size());
  }

  @Test
  void testStateLimit() {
    SymbolTable symbols = new SymbolTable();
    // the minimal DFA of this pattern has 2^9 states
    Automaton<Boolean> nfa = Compiler.compile("(a|b)*a(a|b){8}", Semiring.booleans(), symbols);
    ExplorationLimitException e = Assertions.assertThrows(ExplorationLimitException.class,
        () -> Determinizer.determinize(nfa, new Cancellation(10)));
    Assertions.assertTrue(e.getStatesExplored() > 10);
    Assertions.assertTrue(e.getMessage().contains("state limit 10"), e.getMessage());

    Automaton<Boolean> dfa = Determinizer.determinize(nfa, new Cancellation(1000));
    Assertions.assertEquals(512, Minimizer.minimize(dfa).size());
  }

  @Test
  void testInterrupted() {
    Automaton<Boolean> nfa = Compiler.compile("a|ab", Semiring.booleans(), new SymbolTable());
    Cancellation cancellation = new Cancellation();
    cancellation.setInterrupted();
    ExplorationLimitException e = Assertions.assertThrows(ExplorationLimitException.class,
        () -> new Determinizer(cancellation).run(nfa));
    Assertions.assertTrue(e.getMessage().contains("interrupted"), e.getMessage());
  }

  @Test
  void testFinalWeightThroughEpsilon() {
    MutableAutomaton<Double> m = new MutableAutomaton<>(Semiring.tropical(), new SymbolTable());
    int s = m.addInitialState();
    int f = m.addState(0.5);
    m.addEpsilon(s, 1.0, f);
    Automaton<Double> dfa = Determinizer.determinize(m.freeze());
    Assertions.assertEquals(1, dfa.size());
    Assertions.assertEquals(1.5, dfa.getFinalWeight(dfa.getStart()), 1e-9);
  }
}
