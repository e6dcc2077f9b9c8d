package edu.isi.wdfa;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import org.junit.Test;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;

public class TestWeightAlgebras {

  @Test
  public void testSumMonoid() {
    SumMonoid sm = new SumMonoid();
    assertEquals(Integer.valueOf(0), sm.identity());
    assertEquals(Integer.valueOf(7), sm.concat(Arrays.asList(1, 2, 4)));
    assertEquals(Integer.valueOf(0), sm.concat(Collections.<Integer>emptyList()));
  }

  @Test
  public void testListMonoidLeavesArgumentsAlone() {
    ListMonoid<String> lm = new ListMonoid<String>();
    List<String> a = Arrays.asList("x", "y");
    List<String> b = Arrays.asList("z");
    assertEquals(Arrays.asList("x", "y", "z"), lm.append(a, b));
    assertEquals(2, a.size());
    assertEquals(a, lm.append(lm.identity(), a));
  }

  @Test
  public void testMultiCountAddPadsShorter() {
    MultiCountMonoid mcm = new MultiCountMonoid();
    assertEquals(MultiCount.of(3, 2, 5), mcm.append(MultiCount.of(1, 2), MultiCount.of(2, 0, 5)));
    assertEquals(MultiCount.of(1, 2), mcm.append(mcm.identity(), MultiCount.of(1, 2)));
    assertEquals(MultiCount.of(1, 2), mcm.append(MultiCount.of(1, 2), mcm.identity()));
  }

  @Test
  public void testMultiCountConcat() {
    MultiCount m = MultiCount.concat(MultiCount.of(4), MultiCount.of(0, 9));
    assertEquals(3, m.size());
    assertEquals(9, m.get(2));
    assertArrayEquals(new int[] { 4, 0, 9 }, m.toArray());
    assertEquals("4 0 9", m.toString());
  }

  @Test
  public void testMultiCountIsImmutable() {
    int[] raw = { 1, 2 };
    MultiCount m = MultiCount.of(raw);
    raw[0] = 7;
    m.toArray()[1] = 7;
    assertEquals(MultiCount.of(1, 2), m);
  }

  @Test
  public void testSemiringIdentities() {
    RealSemiring real = new RealSemiring();
    assertEquals(Double.valueOf(0.75), real.plus(real.ZERO(), real.times(real.ONE(), 0.75)));
    TropicalSemiring trop = new TropicalSemiring();
    assertEquals(Double.valueOf(2.0), trop.plus(trop.ZERO(), trop.times(trop.ONE(), 2.0)));
    assertEquals(Double.valueOf(1.0), trop.plus(3.0, 1.0));
    BooleanSemiring bool = new BooleanSemiring();
    assertEquals(Boolean.TRUE, bool.plus(bool.ZERO(), bool.times(bool.ONE(), true)));
    assertEquals(Boolean.FALSE, bool.times(true, false));
  }
}
