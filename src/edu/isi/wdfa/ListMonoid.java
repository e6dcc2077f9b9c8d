package edu.isi.wdfa;

import java.util.ArrayList;
import java.util.List;

// lists under concatenation. Arguments are never modified
public class ListMonoid<T> extends Monoid<List<T>> {
	public List<T> identity() { return new ArrayList<T>(); }
	public List<T> append(List<T> a, List<T> b) {
		ArrayList<T> ret = new ArrayList<T>(a.size() + b.size());
		ret.addAll(a);
		ret.addAll(b);
		return ret;
	}
}
