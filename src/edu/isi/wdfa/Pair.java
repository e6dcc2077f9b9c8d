package edu.isi.wdfa;

// immutable pair; used for bounds, transitions, and product state labels
public class Pair<A, B> {
	private final A _a;
	private final B _b;
	public A l() { return _a; }
	public B r() { return _b; }
	public Pair (A a, B b) {_a = a; _b = b; }
	public String toString() { return "<"+_a+", "+_b+">"; }
	public boolean equals(Object o) {
		if (!(o instanceof Pair))
			return false;
		Pair p = (Pair)o;
		return (_a == null ? p._a == null : _a.equals(p._a)) &&
			(_b == null ? p._b == null : _b.equals(p._b));
	}
	public int hashCode() {
		int ha = _a == null ? 0 : _a.hashCode();
		int hb = _b == null ? 0 : _b.hashCode();
		return 31*ha + hb;
	}
}
