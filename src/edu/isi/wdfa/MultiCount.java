package edu.isi.wdfa;

import java.util.Arrays;

/**
 * An immutable vector of counts, one per pattern of a multi-pattern counter.
 * Appended element-wise by {@link MultiCountMonoid}; joined end to end by
 * {@link #concat}, which is how counters are combined in a product.
 */
public class MultiCount {
	public static final MultiCount EMPTY = new MultiCount(new int[0]);

	private final int[] counts;
	private MultiCount(int[] c) { counts = c; }

	public static MultiCount of(int... c) {
		return new MultiCount(c.clone());
	}
	// n counts of 0
	public static MultiCount zeros(int n) {
		return new MultiCount(new int[n]);
	}
	public int size() { return counts.length; }
	public int get(int i) { return counts[i]; }
	public int[] toArray() { return counts.clone(); }

	public static MultiCount add(MultiCount a, MultiCount b) {
		if (a.size() < b.size())
			return add(b, a);
		if (b.size() == 0)
			return a;
		int[] ret = a.counts.clone();
		for (int i = 0; i < b.counts.length; i++)
			ret[i] += b.counts[i];
		return new MultiCount(ret);
	}
	// a's counts followed by b's
	public static MultiCount concat(MultiCount a, MultiCount b) {
		int[] ret = new int[a.size() + b.size()];
		System.arraycopy(a.counts, 0, ret, 0, a.size());
		System.arraycopy(b.counts, 0, ret, a.size(), b.size());
		return new MultiCount(ret);
	}

	public boolean equals(Object o) {
		if (!(o instanceof MultiCount))
			return false;
		return Arrays.equals(counts, ((MultiCount)o).counts);
	}
	public int hashCode() { return Arrays.hashCode(counts); }
	public String toString() {
		StringBuffer sb = new StringBuffer();
		for (int i = 0; i < counts.length; i++) {
			if (i > 0)
				sb.append(" ");
			sb.append(counts[i]);
		}
		return sb.toString();
	}
}
