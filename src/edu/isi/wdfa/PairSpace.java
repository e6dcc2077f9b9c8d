package edu.isi.wdfa;

// cartesian product of two spaces in row-major order: (a, b) sits at index(a)*|B| + index(b).
// labels of a raw product automaton
public class PairSpace<A, B> extends IndexSpace<Pair<A, B>> {
	private final IndexSpace<A> left;
	private final IndexSpace<B> right;
	public PairSpace(IndexSpace<A> left, IndexSpace<B> right) {
		if ((long)left.size() * (long)right.size() > Integer.MAX_VALUE)
			throw new IllegalArgumentException("Product of "+left+" and "+right+" too large to index");
		this.left = left;
		this.right = right;
	}
	public int size() { return left.size() * right.size(); }
	public int index(Pair<A, B> p) {
		if (p == null)
			throw new IndexOutOfBoundsException("null outside of "+this);
		return left.index(p.l()) * right.size() + right.index(p.r());
	}
	public Pair<A, B> get(int i) {
		checkPosition(i);
		return new Pair<A, B>(left.get(i / right.size()), right.get(i % right.size()));
	}
	public boolean contains(Pair<A, B> p) {
		return p != null && left.contains(p.l()) && right.contains(p.r());
	}
	public boolean equals(Object o) {
		if (!(o instanceof PairSpace))
			return false;
		PairSpace s = (PairSpace)o;
		return left.equals(s.left) && right.equals(s.right);
	}
	public int hashCode() { return 31*left.hashCode() + right.hashCode(); }
}
