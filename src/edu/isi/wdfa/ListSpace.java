package edu.isi.wdfa;

import gnu.trove.TObjectIntHashMap;

import java.util.ArrayList;
import java.util.List;

// an explicit list of distinct values, ordered as given. Used for segment inventories
public class ListSpace<T> extends IndexSpace<T> {
	private final ArrayList<T> values;
	// value -> position
	private final TObjectIntHashMap positions;
	public ListSpace(List<T> vals) {
		if (vals.isEmpty())
			throw new IllegalArgumentException("Empty list space");
		values = new ArrayList<T>(vals);
		positions = new TObjectIntHashMap();
		for (int i = 0; i < values.size(); i++) {
			T v = values.get(i);
			if (v == null)
				throw new IllegalArgumentException("Null member at position "+i);
			if (positions.containsKey(v))
				throw new IllegalArgumentException("Duplicate member "+v);
			positions.put(v, i);
		}
	}
	public int size() { return values.size(); }
	public int index(T t) {
		if (!contains(t))
			throw new IndexOutOfBoundsException(t+" not in "+this);
		return positions.get(t);
	}
	public T get(int i) {
		checkPosition(i);
		return values.get(i);
	}
	public boolean contains(T t) {
		return t != null && positions.containsKey(t);
	}
	public List<T> values() {
		return new ArrayList<T>(values);
	}
	public boolean equals(Object o) {
		if (!(o instanceof ListSpace))
			return false;
		return values.equals(((ListSpace)o).values);
	}
	public int hashCode() { return values.hashCode(); }
}
