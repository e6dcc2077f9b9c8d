package edu.isi.wdfa;

// the contiguous integers lo..hi, inclusive
public class IntRange extends IndexSpace<Integer> {
	private final int lo;
	private final int hi;
	public IntRange(int lo, int hi) {
		if (hi < lo)
			throw new IllegalArgumentException("Empty integer range "+lo+".."+hi);
		if ((long)hi - (long)lo >= Integer.MAX_VALUE)
			throw new IllegalArgumentException("Integer range "+lo+".."+hi+" too large to index");
		this.lo = lo;
		this.hi = hi;
	}
	public int size() { return hi - lo + 1; }
	public int index(Integer t) {
		if (!contains(t))
			throw new IndexOutOfBoundsException(t+" outside of "+this);
		return t - lo;
	}
	public Integer get(int i) {
		checkPosition(i);
		return lo + i;
	}
	public boolean contains(Integer t) {
		return t != null && t >= lo && t <= hi;
	}
	public boolean equals(Object o) {
		if (!(o instanceof IntRange))
			return false;
		IntRange r = (IntRange)o;
		return r.lo == lo && r.hi == hi;
	}
	public int hashCode() { return 31*lo + hi; }
}
