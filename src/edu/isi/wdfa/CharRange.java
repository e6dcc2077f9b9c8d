package edu.isi.wdfa;

// the contiguous characters lo..hi, inclusive. Handy alphabet for plain strings
public class CharRange extends IndexSpace<Character> {
	private final char lo;
	private final char hi;
	public CharRange(char lo, char hi) {
		if (hi < lo)
			throw new IllegalArgumentException("Empty character range "+lo+".."+hi);
		this.lo = lo;
		this.hi = hi;
	}
	public int size() { return hi - lo + 1; }
	public int index(Character t) {
		if (!contains(t))
			throw new IndexOutOfBoundsException("'"+t+"' outside of "+this);
		return t - lo;
	}
	public Character get(int i) {
		checkPosition(i);
		return (char)(lo + i);
	}
	public boolean contains(Character t) {
		return t != null && t >= lo && t <= hi;
	}
	public boolean equals(Object o) {
		if (!(o instanceof CharRange))
			return false;
		CharRange r = (CharRange)o;
		return r.lo == lo && r.hi == hi;
	}
	public int hashCode() { return 31*lo + hi; }
}
