package WFST.Semiring;

import java.util.List;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

public class SemiringTest {

  private static <W> void assertAxioms(Semiring<W> sr, List<W> samples) {
    for (W a : samples) {
      Assertions.assertTrue(sr.approxEquals(a, sr.plus(a, sr.zero())), sr + " plus identity " + a);
      Assertions.assertTrue(sr.approxEquals(a, sr.times(a, sr.one())), sr + " times identity " + a);
      Assertions.assertTrue(sr.isZero(sr.times(a, sr.zero())), sr + " zero annihilates " + a);
      for (W b : samples) {
        Assertions.assertTrue(sr.approxEquals(sr.plus(a, b), sr.plus(b, a)), sr + " plus commutes");
        if (!sr.isZero(b)) {
          Assertions.assertTrue(sr.approxEquals(a, sr.times(b, sr.divide(a, b))), sr + " left division");
        }
        for (W c : samples) {
          Assertions.assertTrue(sr.approxEquals(sr.times(a, sr.plus(b, c)),
              sr.plus(sr.times(a, b), sr.times(a, c))), sr + " distributivity");
        }
      }
    }
  }

  @Test
  void testBooleanAxioms() {
    Semiring<Boolean> sr = Semiring.booleans();
    assertAxioms(sr, List.of(true, false));
    Assertions.assertTrue(sr.isIdempotent());
    Assertions.assertSame(sr, Semiring.booleans());
    Assertions.assertTrue(sr.compare(true, false) < 0);
    Assertions.assertEquals("boolean", sr.toString());
  }

  @Test
  void testTropicalAxioms() {
    Semiring<Double> sr = Semiring.tropical();
    assertAxioms(sr, List.of(0.0, 1.5, 3.0, Double.POSITIVE_INFINITY));
    Assertions.assertEquals(1.0, sr.plus(1.0, 2.0));
    Assertions.assertEquals(3.0, sr.times(1.0, 2.0));
    Assertions.assertEquals(Double.POSITIVE_INFINITY, sr.times(1.0, sr.zero()));
    Assertions.assertTrue(sr.compare(1.0, 2.0) < 0);
    Assertions.assertTrue(sr.isIdempotent());
  }

  @Test
  void testProbabilityAxioms() {
    Semiring<Double> sr = Semiring.probability();
    assertAxioms(sr, List.of(0.0, 0.25, 0.5, 1.0));
    Assertions.assertEquals(0.75, sr.plus(0.25, 0.5));
    Assertions.assertEquals(0.125, sr.times(0.25, 0.5));
    Assertions.assertTrue(sr.compare(0.9, 0.1) < 0);
    Assertions.assertFalse(sr.isIdempotent());
  }

  @Test
  void testTolerance() {
    Semiring<Double> sr = Semiring.tropical();
    Assertions.assertTrue(sr.approxEquals(0.3, 0.1 + 0.2));
    Assertions.assertFalse(sr.approxEquals(0.3, 0.3001));
    Assertions.assertEquals(sr.quantize(0.3), sr.quantize(0.1 + 0.2));
    Assertions.assertEquals(0.0, sr.quantize(-1e-9));
    Assertions.assertEquals(Double.POSITIVE_INFINITY, sr.quantize(Double.POSITIVE_INFINITY));
    Assertions.assertTrue(sr.isZero(Double.POSITIVE_INFINITY));
    Assertions.assertFalse(sr.isZero(1e300));

    TropicalSemiring coarse = new TropicalSemiring(0.1);
    Assertions.assertTrue(coarse.approxEquals(1.0, 1.05));
    Assertions.assertEquals(0.1, coarse.getDelta());
    Assertions.assertThrows(IllegalArgumentException.class, () -> new TropicalSemiring(0.0));
  }

  @Test
  void testProbabilityToleranceIsRelative() {
    Semiring<Double> sr = Semiring.probability();
    Assertions.assertFalse(sr.isZero(1e-7));
    Assertions.assertFalse(sr.isZero(Double.MIN_VALUE));
    Assertions.assertTrue(sr.isZero(0.0));
    Assertions.assertTrue(sr.isZero(-0.0));
    Assertions.assertFalse(sr.approxEquals(1e-7, 2e-7));
    Assertions.assertFalse(sr.approxEquals(0.0, 1e-9));
    Assertions.assertTrue(sr.approxEquals(1e-9, 1e-9 + 1e-17));
    Assertions.assertTrue(sr.approxEquals(1000.0, 1000.0005));
    Assertions.assertNotEquals(sr.quantize(1e-8), sr.quantize(0.0));
    Assertions.assertEquals(sr.quantize(0.3), sr.quantize(0.1 + 0.2));
    Assertions.assertEquals(1.23457e-8, sr.quantize(1.234567e-8), 1e-20);
    Assertions.assertEquals(0.0, sr.quantize(-0.0));
  }

  @Test
  void testEquality() {
    Assertions.assertEquals(Semiring.tropical(), Semiring.tropical());
    Assertions.assertEquals(Semiring.tropical().hashCode(), Semiring.tropical().hashCode());
    Assertions.assertNotEquals(Semiring.tropical(), Semiring.probability());
    Assertions.assertNotEquals(Semiring.tropical(), new TropicalSemiring(0.5));
  }

  @Test
  void testParseWeight() {
    Assertions.assertEquals(2.5, Semiring.tropical().parseWeight(" 2.5 "));
    Assertions.assertEquals(Double.POSITIVE_INFINITY, Semiring.tropical().parseWeight("inf"));
    Assertions.assertEquals(-1.0, Semiring.probability().parseWeight("-1"));
    Assertions.assertTrue(Semiring.booleans().parseWeight("1"));
    Assertions.assertFalse(Semiring.booleans().parseWeight("false"));
    Assertions.assertThrows(NumberFormatException.class, () -> Semiring.tropical().parseWeight("abc"));
    Assertions.assertThrows(NumberFormatException.class, () -> Semiring.booleans().parseWeight("0.5"));
  }
}
