package edu.isi.wdfa;

// boolean is or, and, false, true. A path weight says whether every step was allowed
public class BooleanSemiring extends Semiring<Boolean> {
	public Boolean plus(Boolean a, Boolean b) {
		return a || b;
	}
	public Boolean times(Boolean a, Boolean b) {
		return a && b;
	}
	public Boolean ZERO() { return false; }
	public Boolean ONE() { return true; }
}
