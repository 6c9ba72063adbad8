package WFST;

import java.util.List;
import java.util.Set;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import WFST.Model.Automaton;
import WFST.Model.SymbolTable;
import WFST.Regex.AST;
import WFST.Semiring.Semiring;

public class OperationsTest {

  @Test
  void testInvertAndProject() {
    SymbolTable symbols = new SymbolTable();
    Automaton<Boolean> rel = Compiler.compile("a:x b:y | c", Semiring.booleans(), symbols);
    Automaton<Boolean> inv = Operations.invert(rel);
    Assertions.assertEquals(List.of("ab"), CompilerTest.outputs(Evaluator.apply(inv, "xy", 100)));
    Assertions.assertEquals(List.of("c"), CompilerTest.outputs(Evaluator.apply(inv, "c", 100)));

    Automaton<Boolean> upper = Operations.projectInput(rel);
    Assertions.assertFalse(upper.isTransducer());
    Assertions.assertTrue(Evaluator.accepts(upper, "ab"));
    Assertions.assertFalse(Evaluator.accepts(upper, "xy"));

    Automaton<Boolean> lower = Operations.projectOutput(rel);
    Assertions.assertFalse(lower.isTransducer());
    Assertions.assertTrue(Evaluator.accepts(lower, "xy"));
    Assertions.assertTrue(Evaluator.accepts(lower, "c"));
    Assertions.assertFalse(Evaluator.accepts(lower, "ab"));
  }

  @Test
  void testCrossProduct() {
    SymbolTable symbols = new SymbolTable();
    Automaton<Boolean> upper = Compiler.compile("ab", Semiring.booleans(), symbols);
    Automaton<Boolean> lower = Compiler.compile("c|dd", Semiring.booleans(), symbols);
    Automaton<Boolean> cross = Operations.crossProduct(upper, lower);
    Assertions.assertTrue(cross.isTransducer());
    Assertions.assertEquals(Set.of("c", "dd"), Set.copyOf(CompilerTest.outputs(Evaluator.apply(cross, "ab", 100))));
    Assertions.assertEquals(List.of(), CompilerTest.outputs(Evaluator.apply(cross, "a", 100)));

    Automaton<Boolean> transducer = Compiler.compile("a:b", Semiring.booleans(), symbols);
    Assertions.assertThrows(IllegalArgumentException.class, () -> Operations.crossProduct(transducer, lower));
    Assertions.assertThrows(IllegalArgumentException.class, () -> Operations.crossProduct(upper, transducer));
  }

  @Test
  void testEmptyLanguageAndEmptyString() {
    SymbolTable symbols = new SymbolTable();
    Automaton<Double> none = Operations.emptyLanguage(Semiring.tropical(), symbols);
    Assertions.assertEquals(1, none.size());
    Assertions.assertFalse(Evaluator.accepts(none, ""));
    Assertions.assertEquals(Double.POSITIVE_INFINITY, Evaluator.totalWeight(none));

    Automaton<Double> eps = Operations.emptyString(Semiring.tropical(), symbols, 2.5);
    Assertions.assertEquals(2.5, Evaluator.weight(eps, ""), 1e-9);
    Assertions.assertFalse(Evaluator.accepts(eps, "a"));

    Automaton<Double> both = Operations.union(none, eps);
    Assertions.assertEquals(2.5, Evaluator.totalWeight(both), 1e-9);
  }

  @Test
  void testRepeatBounds() {
    Automaton<Boolean> a = Operations.symbol(Semiring.booleans(), new SymbolTable(), "a");
    Assertions.assertThrows(IllegalArgumentException.class, () -> Operations.repeat(a, 2, 1));
    Assertions.assertThrows(IllegalArgumentException.class, () -> Operations.repeat(a, -1, 1));

    Automaton<Boolean> atLeastTwo = Operations.repeat(a, 2, AST.UNBOUNDED);
    Automaton<Boolean> zero = Operations.repeat(a, 0, 0);
    for (int n = 0; n < 6; n++) {
      String w = "a".repeat(n);
      Assertions.assertEquals(n >= 2, Evaluator.accepts(atLeastTwo, w), w);
      Assertions.assertEquals(n == 0, Evaluator.accepts(zero, w), w);
    }
  }

  @Test
  void testSymbolClass() {
    Automaton<Double> digits = Operations.symbolClass(Semiring.probability(), new SymbolTable(),
        List.of("0", "1", "2"));
    Assertions.assertTrue(digits.isDeterministic());
    Assertions.assertEquals(3, digits.numTransitions());
    Assertions.assertEquals(1.0, Evaluator.weight(digits, "1"), 1e-9);
    Assertions.assertEquals(0.0, Evaluator.weight(digits, "3"), 1e-9);
  }

  @Test
  void testFromStrings() {
    Automaton<Boolean> words = Operations.fromStrings(Semiring.booleans(), new SymbolTable(),
        List.of("cat", "car", "cat", "cart"));
    Assertions.assertTrue(words.isDeterministic());
    Assertions.assertTrue(words.isMinimal());
    Assertions.assertTrue(Evaluator.accepts(words, "cat"));
    Assertions.assertTrue(Evaluator.accepts(words, "cart"));
    Assertions.assertFalse(Evaluator.accepts(words, "ca"));
    Assertions.assertFalse(Evaluator.accepts(words, "carts"));
    // c a {t, r(t)?}: t and the final t share their target
    Assertions.assertEquals(5, words.size());
    Assertions.assertEquals(3, Evaluator.words(words, 10).size());

    Automaton<Boolean> none = Operations.fromStrings(Semiring.booleans(), new SymbolTable(), List.of());
    Assertions.assertTrue(Evaluator.words(none, 10).isEmpty());
  }

  @Test
  void testFromSymbolSequences() {
    Automaton<Boolean> seq = Operations.fromSymbolSequences(Semiring.booleans(), new SymbolTable(),
        List.of(List.of("ab", "c"), List.of("ab"), List.of()));
    Assertions.assertEquals(List.of("ab", "c"), Evaluator.tokenize(seq, "abc"));
    Assertions.assertTrue(Evaluator.accepts(seq, "abc"));
    Assertions.assertTrue(Evaluator.accepts(seq, "ab"));
    Assertions.assertTrue(Evaluator.accepts(seq, ""));
    Assertions.assertFalse(Evaluator.accepts(seq, List.of("a", "b")));
  }

  @Test
  void testReverseViaOperations() {
    Automaton<Boolean> a = Compiler.compile("abc", Semiring.booleans(), new SymbolTable());
    Automaton<Boolean> r = Operations.trim(Operations.reverse(a));
    Assertions.assertTrue(Evaluator.accepts(r, "cba"));
    Assertions.assertFalse(Evaluator.accepts(r, "abc"));
  }
}
