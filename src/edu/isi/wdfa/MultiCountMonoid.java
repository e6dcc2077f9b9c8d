package edu.isi.wdfa;

// count vectors under element-wise addition; the shorter vector is padded with zeros
public class MultiCountMonoid extends Monoid<MultiCount> {
	public MultiCount identity() { return MultiCount.EMPTY; }
	public MultiCount append(MultiCount a, MultiCount b) { return MultiCount.add(a, b); }
}
