package edu.isi.wdfa;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Set;

import org.junit.Test;

import static edu.isi.wdfa.TestWeightedDFA.abCounter;
import static edu.isi.wdfa.TestWeightedDFA.chars;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

public class TestIntersect {

  static final WeightCombiner<Integer, Integer, Integer> ADD = new WeightCombiner<Integer, Integer, Integer>() {
    public Integer combine(Integer a, Integer b) { return a + b; }
  };

  static final WeightCombiner<Integer, Integer, MultiCount> BOTH = new WeightCombiner<Integer, Integer, MultiCount>() {
    public MultiCount combine(Integer a, Integer b) { return MultiCount.of(a, b); }
  };

  /** counts 'c', tracking the parity of the 'c's read so far */
  static WeightedDFA<Integer, Character, Integer> cCounter() {
    return WeightedDFA.build(new IntRange(0, 1), new CharRange('a', 'c'),
        new TransitionFunction<Integer, Character, Integer>() {
          public Pair<Integer, Integer> transition(Integer s, Character c) {
            if (c == 'c')
              return new Pair<Integer, Integer>(1 - s, 1);
            return new Pair<Integer, Integer>(s, 0);
          }
        });
  }

  @Test
  public void testRawProductCoversEveryPair() throws IncompatibleAlphabetException {
    WeightedDFA<Pair<Integer, Integer>, Character, Integer> raw = Intersect.rawIntersection(ADD, abCounter(), cCounter());
    assertEquals(8, raw.getNumStates());
    assertEquals(new Pair<Integer, Integer>(0, 0), raw.getInitialState());
    assertEquals(new Pair<Pair<Integer, Integer>, Pair<Integer, Integer>>(
        new Pair<Integer, Integer>(0, 0), new Pair<Integer, Integer>(3, 1)), raw.labelBounds());
    Pair<Integer, Integer> s = new Pair<Integer, Integer>(1, 0);
    assertEquals(new Pair<Pair<Integer, Integer>, Integer>(new Pair<Integer, Integer>(0, 1), 1), raw.transition(s, 'c'));
    assertEquals(new Pair<Pair<Integer, Integer>, Integer>(new Pair<Integer, Integer>(2, 0), 1), raw.transition(s, 'b'));
    // the unreachable state of abCounter survives in the raw product
    assertEquals(Integer.valueOf(5 + 1), raw.weight(new Pair<Integer, Integer>(3, 0), 'c'));
  }

  @Test
  public void testIntersectionPrunes() throws IncompatibleAlphabetException {
    WeightedDFA<Integer, Character, Integer> product = Intersect.intersection(ADD, abCounter(), cCounter());
    // {0,1,2} x {0,1}
    assertEquals(6, product.getNumStates());
    assertEquals(new Pair<Integer, Integer>(1, 6), product.labelBounds());
  }

  @Test
  public void testProductCombinesTransductions() throws IncompatibleAlphabetException {
    WeightedDFA<Integer, Character, Integer> ab = abCounter();
    WeightedDFA<Integer, Character, Integer> c = cCounter();
    WeightedDFA<Integer, Character, Integer> sum = Intersect.intersection(ADD, ab, c);
    WeightedDFA<Integer, Character, MultiCount> both = Intersect.intersection(BOTH, ab, c);
    SumMonoid sm = new SumMonoid();
    for (String w : TestPruneUnreachable.WORDS) {
      List<Character> word = chars(w);
      int abs = ab.transduce(word, sm);
      int cs = c.transduce(word, sm);
      assertEquals(Integer.valueOf(abs + cs), sum.transduce(word, sm));
      MultiCountMonoid mcm = new MultiCountMonoid();
      assertEquals(MultiCount.of(abs, cs), mcm.append(MultiCount.zeros(2), both.transduce(word, mcm)));
    }
  }

  @Test
  public void testProbabilityProduct() throws IncompatibleAlphabetException {
    WeightedDFA<Integer, Character, Double> model = TestWeightedDFA.unigramModel();
    WeightCombiner<Double, Double, Double> times = new WeightCombiner<Double, Double, Double>() {
      public Double combine(Double a, Double b) { return a * b; }
    };
    WeightedDFA<Integer, Character, Double> squared = Intersect.intersection(times, model, model);
    assertEquals(1, squared.getNumStates());
    RealSemiring real = new RealSemiring();
    double p = model.transduceSemiring(chars("abca"), real);
    assertEquals(p * p, squared.transduceSemiring(chars("abca"), real), 1e-15);
  }

  @Test
  public void testMismatchedAlphabetsAreRejected() {
    WeightedDFA<Integer, Character, Integer> wider = WeightedDFA.build(new IntRange(0, 0), new CharRange('a', 'd'),
        new TransitionFunction<Integer, Character, Integer>() {
          public Pair<Integer, Integer> transition(Integer s, Character c) {
            return new Pair<Integer, Integer>(0, 0);
          }
        });
    try {
      Intersect.intersection(ADD, abCounter(), wider);
      fail("intersected automata over a..c and a..d");
    }
    catch (IncompatibleAlphabetException e) {
      assertTrue(e.getMessage().contains("must match"));
    }
  }

  @Test
  public void testAlphabetsDifferingInsideTheBoundsAreRejected() {
    ListSpace<String> abc = new ListSpace<String>(Arrays.asList("a", "b", "c"));
    ListSpace<String> axc = new ListSpace<String>(Arrays.asList("a", "x", "c"));
    assertEquals(abc.bounds(), axc.bounds());
    List<Set<String>> onlyB = Collections.singletonList(Collections.singleton("b"));
    List<Set<String>> onlyX = Collections.singletonList(Collections.singleton("x"));
    try {
      Intersect.intersection(ADD, NgramCounter.countNgrams(abc, onlyB), NgramCounter.countNgrams(axc, onlyX));
      fail("intersected automata over [a, b, c] and [a, x, c]");
    }
    catch (IncompatibleAlphabetException e) {
      assertTrue(e.getMessage().contains("must match"));
    }
  }

  @Test
  public void testProductTooLargeToIndex() throws IncompatibleAlphabetException {
    final int n = 50000;
    TransitionFunction<Integer, Character, Integer> stay = new TransitionFunction<Integer, Character, Integer>() {
      public Pair<Integer, Integer> transition(Integer s, Character c) {
        return new Pair<Integer, Integer>(s, 0);
      }
    };
    WeightedDFA<Integer, Character, Integer> big = WeightedDFA.build(new IntRange(1, n), new CharRange('a', 'a'), stay);
    try {
      Intersect.rawIntersection(ADD, big, big);
      fail("built a product of " + n + " by " + n + " states");
    }
    catch (IllegalArgumentException e) {
      assertTrue(e.getMessage().contains("too large"));
    }
  }
}
