package edu.isi.wdfa;

/**
 * A finite, totally ordered set of values with a dense zero-based index.
 * Automaton state labels and alphabet symbols are both drawn from index
 * spaces, which lets transition tables live in flat arrays.
 * <p>
 * Implementations must be immutable, non-empty, and must throw
 * {@link IndexOutOfBoundsException} from {@link #index} for values outside the
 * space and from {@link #get} for indices outside <code>0..size()-1</code>.
 */
public abstract class IndexSpace<T> {
	/** number of values in the space */
	public abstract int size();
	/** position of t, from 0 (the minimum) to size()-1 (the maximum) */
	public abstract int index(T t);
	/** value at position i */
	public abstract T get(int i);
	public abstract boolean contains(T t);

	public T first() { return get(0); }
	public T last() { return get(size()-1); }
	/** inclusive (min, max) */
	public Pair<T, T> bounds() { return new Pair<T, T>(first(), last()); }

	protected void checkPosition(int i) {
		if (i < 0 || i >= size())
			throw new IndexOutOfBoundsException("Position "+i+" outside of "+this);
	}
	public String toString() { return "["+first()+".."+last()+"]"; }
}
