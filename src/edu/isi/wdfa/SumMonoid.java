package edu.isi.wdfa;

// integers under addition. The weight type of counting automata
public class SumMonoid extends Monoid<Integer> {
	public Integer identity() { return 0; }
	public Integer append(Integer a, Integer b) { return a + b; }
}
