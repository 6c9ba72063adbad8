package WFST;

import java.util.ArrayList;
import java.util.List;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import WFST.Model.Automaton;
import WFST.Model.Cancellation;
import WFST.Model.Path;
import WFST.Model.SymbolTable;
import WFST.Regex.ParseException;
import WFST.Semiring.Semiring;

public class CompilerTest {

  static List<String> wordsUpTo(int length, String... alphabet) {
    List<String> result = new ArrayList<>();
    result.add("");
    int from = 0;
    for (int len = 1; len <= length; len++) {
      int to = result.size();
      for (int i = from; i < to; i++) {
        for (String a : alphabet) {
          result.add(result.get(i) + a);
        }
      }
      from = to;
    }
    return result;
  }

  static <W> List<String> outputs(Iterable<Path<W>> paths) {
    List<String> result = new ArrayList<>();
    for (Path<W> p : paths) {
      result.add(p.outputString());
    }
    return result;
  }

  @Test
  void testStarThenSymbol() {
    Automaton<Boolean> a = Compiler.compile("a*b", Semiring.booleans(), new SymbolTable());
    for (String w : List.of("b", "ab", "aab", "aaaab")) {
      Assertions.assertTrue(Evaluator.accepts(a, w), w);
    }
    for (String w : List.of("", "a", "ba", "abb")) {
      Assertions.assertFalse(Evaluator.accepts(a, w), w);
    }
  }

  @Test
  void testStarOfUnion() {
    Automaton<Boolean> a = Compiler.compile("(a|b)*", Semiring.booleans(), new SymbolTable());
    for (String w : wordsUpTo(4, "a", "b")) {
      Assertions.assertTrue(Evaluator.accepts(a, w), w);
    }
    Assertions.assertFalse(Evaluator.accepts(a, "abc"));
    Assertions.assertFalse(Evaluator.accepts(a, List.of("a", "c")));
  }

  @Test
  void testUnionIsLanguageUnion() {
    SymbolTable symbols = new SymbolTable();
    Compiler<Boolean> compiler = new Compiler<>(Semiring.booleans(), symbols);
    List<String> patterns = List.of("a*b", "(ab)+", "b?a{1,2}", "[ab]b*", "()");
    for (String p : patterns) {
      for (String q : patterns) {
        Automaton<Boolean> pa = compiler.compile(p);
        Automaton<Boolean> qa = compiler.compile(q);
        Automaton<Boolean> union = compiler.compile("(" + p + ")|(" + q + ")");
        Automaton<Boolean> algebra = Operations.union(pa, qa);
        for (String w : wordsUpTo(4, "a", "b")) {
          boolean expected = Evaluator.accepts(pa, w) || Evaluator.accepts(qa, w);
          Assertions.assertEquals(expected, Evaluator.accepts(union, w), p + " | " + q + " on " + w);
          Assertions.assertEquals(expected, Evaluator.accepts(algebra, w), p + " | " + q + " on " + w);
        }
      }
    }
  }

  @Test
  void testTropicalShortestPath() {
    Automaton<Double> a = Compiler.compile("a<1> | a a <2>", Semiring.tropical(), new SymbolTable());
    Path<Double> best = Evaluator.shortestPath(a).orElseThrow();
    Assertions.assertEquals("a", best.inputString());
    Assertions.assertEquals(1.0, best.weight(), 1e-9);
    Assertions.assertEquals(1.0, Evaluator.weight(a, "a"), 1e-9);
    Assertions.assertEquals(2.0, Evaluator.weight(a, "aa"), 1e-9);
    Assertions.assertEquals(Double.POSITIVE_INFINITY, Evaluator.weight(a, "aaa"));
  }

  @Test
  void testWeightsMultiplyAlongPaths() {
    Automaton<Double> tropical = Compiler.compile("a<1>b<2>", Semiring.tropical(), new SymbolTable());
    Assertions.assertEquals(3.0, Evaluator.weight(tropical, "ab"), 1e-9);

    Automaton<Double> loop = Compiler.compile("(a<1>)*", Semiring.tropical(), new SymbolTable());
    Assertions.assertEquals(0.0, Evaluator.weight(loop, ""), 1e-9);
    Assertions.assertEquals(3.0, Evaluator.weight(loop, "aaa"), 1e-9);

    Automaton<Double> prob = Compiler.compile("a<0.5> | a<0.25>", Semiring.probability(), new SymbolTable());
    Assertions.assertEquals(0.75, Evaluator.weight(prob, "a"), 1e-9);
  }

  @Test
  void testComposeChains() {
    Automaton<Boolean> a = Compiler.compile("a:x @ x:y", Semiring.booleans(), new SymbolTable());
    Assertions.assertEquals(List.of("y"), outputs(Evaluator.apply(a, "a", 1000)));
    Assertions.assertTrue(outputs(Evaluator.apply(a, "x", 1000)).isEmpty());
  }

  @Test
  void testComposeWithIdentity() {
    SymbolTable symbols = new SymbolTable();
    Compiler<Boolean> compiler = new Compiler<>(Semiring.booleans(), symbols);
    Automaton<Boolean> relation = compiler.compile("a:b | c:d");
    Automaton<Boolean> composed = compiler.compile("(a:b | c:d) @ [bd]");
    for (String input : List.of("a", "c", "b")) {
      Assertions.assertEquals(outputs(Evaluator.apply(relation, input, 1000)),
          outputs(Evaluator.apply(composed, input, 1000)), input);
    }
    Assertions.assertEquals(List.of("b"), outputs(Evaluator.apply(composed, "a", 1000)));
  }

  @Test
  void testIntersectionAndDifference() {
    SymbolTable symbols = new SymbolTable();
    Compiler<Boolean> compiler = new Compiler<>(Semiring.booleans(), symbols);
    Automaton<Boolean> both = compiler.compile("(a|b)* & a*");
    Automaton<Boolean> minus = compiler.compile("(a|b)* - a*");
    for (String w : wordsUpTo(4, "a", "b")) {
      boolean onlyA = !w.contains("b");
      Assertions.assertEquals(onlyA, Evaluator.accepts(both, w), w);
      Assertions.assertEquals(!onlyA, Evaluator.accepts(minus, w), w);
    }

    Automaton<Double> weighted = Compiler.compile("a<1> & a<2>", Semiring.tropical(), new SymbolTable());
    Assertions.assertEquals(3.0, Evaluator.weight(weighted, "a"), 1e-9);
  }

  @Test
  void testRepetitionBounds() {
    SymbolTable symbols = new SymbolTable();
    Compiler<Boolean> compiler = new Compiler<>(Semiring.booleans(), symbols);
    Automaton<Boolean> between = compiler.compile("a{2,3}");
    Automaton<Boolean> atLeast = compiler.compile("a{2,}");
    Automaton<Boolean> plus = compiler.compile("a+");
    Automaton<Boolean> none = compiler.compile("a{0}");
    for (int n = 0; n < 6; n++) {
      String w = "a".repeat(n);
      Assertions.assertEquals(n >= 2 && n <= 3, Evaluator.accepts(between, w), w);
      Assertions.assertEquals(n >= 2, Evaluator.accepts(atLeast, w), w);
      Assertions.assertEquals(n >= 1, Evaluator.accepts(plus, w), w);
      Assertions.assertEquals(n == 0, Evaluator.accepts(none, w), w);
    }
  }

  @Test
  void testBoundedRepetitionHasOnePathPerCount() {
    Automaton<Double> a = Compiler.compile("(a<1>){0,3}", Semiring.probability(), new SymbolTable());
    for (int n = 0; n <= 3; n++) {
      Assertions.assertEquals(1.0, Evaluator.weight(a, "a".repeat(n)), 1e-9);
    }
  }

  @Test
  void testCrossProduct() {
    Automaton<Boolean> a = Compiler.compile("(ab):(xyz)", Semiring.booleans(), new SymbolTable());
    Assertions.assertTrue(a.isTransducer());
    Assertions.assertEquals(List.of("xyz"), outputs(Evaluator.apply(a, "ab", 1000)));

    Automaton<Boolean> deletion = Compiler.compile("a:''", Semiring.booleans(), new SymbolTable());
    Assertions.assertEquals(List.of(""), outputs(Evaluator.apply(deletion, "a", 1000)));
  }

  @Test
  void testMultiCharSymbols() {
    Automaton<Boolean> a = Compiler.compile("cat('+Pl':s | '+Sg':'')", Semiring.booleans(), new SymbolTable());
    Assertions.assertEquals(List.of("c", "a", "t", "+Pl"), Evaluator.tokenize(a, "cat+Pl"));
    Assertions.assertEquals(List.of("cats"), outputs(Evaluator.apply(a, "cat+Pl", 1000)));
    Assertions.assertEquals(List.of("cat"), outputs(Evaluator.apply(a, "cat+Sg", 1000)));
    Assertions.assertEquals(List.of("cat+Pl"), outputs(Evaluator.analyze(a, "cats", 1000)));
    Assertions.assertEquals(List.of("cat+Sg"), outputs(Evaluator.analyze(a, "cat", 1000)));
  }

  @Test
  void testCompileMinimal() {
    Compiler<Boolean> compiler = new Compiler<>(Semiring.booleans(), new SymbolTable());
    Automaton<Boolean> a = compiler.compileMinimal("(a|b)*a(a|b)");
    Assertions.assertTrue(a.isMinimal());
    Assertions.assertEquals(4, a.size());
    for (String w : wordsUpTo(4, "a", "b")) {
      Assertions.assertEquals(w.length() >= 2 && w.charAt(w.length() - 2) == 'a', Evaluator.accepts(a, w), w);
    }
  }

  @Test
  void testErrors() {
    ParseException e = Assertions.assertThrows(ParseException.class,
        () -> Compiler.compile("a<0.5>", Semiring.booleans(), new SymbolTable()));
    Assertions.assertEquals(2, e.getOffset());
    Assertions.assertThrows(ParseException.class,
        () -> Compiler.compile("(a|b", Semiring.tropical(), new SymbolTable()));

    SymbolTable symbols = new SymbolTable();
    Automaton<Double> tropical = Compiler.compile("a", Semiring.tropical(), symbols);
    Automaton<Double> otherTable = Compiler.compile("a", Semiring.tropical(), new SymbolTable());
    Automaton<Double> prob = Compiler.compile("a", Semiring.probability(), symbols);
    Assertions.assertThrows(AlphabetMismatchException.class, () -> Operations.union(tropical, otherTable));
    Assertions.assertThrows(AlphabetMismatchException.class, () -> Composer.compose(tropical, otherTable));
    Assertions.assertThrows(SemiringMismatchException.class, () -> Operations.concatenate(tropical, prob));
  }

  @Test
  void testCancelledComposition() {
    SymbolTable symbols = new SymbolTable();
    Compiler<Boolean> compiler = new Compiler<>(Semiring.booleans(), symbols, new Cancellation(3));
    Assertions.assertThrows(ExplorationLimitException.class, () -> compiler.compile("(a:b)* @ (b:c)*"));
  }

  @Test
  void testIntersectionOfNonDeterminizableOperandStops() {
    ExplorationLimitException e = Assertions.assertThrows(ExplorationLimitException.class,
        () -> Compiler.compile("((a<1>)*b | (a<2>)*c) & [abc]*", Semiring.tropical(), new SymbolTable()));
    Assertions.assertTrue(e.getMessage().contains("twins"), e.getMessage());
    Assertions.assertThrows(ExplorationLimitException.class,
        () -> Compiler.compile("[abc]* - ((a<1>)*b | (a<2>)*c)", Semiring.tropical(), new SymbolTable()));
  }
}
