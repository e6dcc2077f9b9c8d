package edu.isi.wdfa;

// tropical is min, +, +INF, 0
public class TropicalSemiring extends Semiring<Double> {
	public Double plus(Double a, Double b) {
		return Math.min(a, b);
	}
	public Double times(Double a, Double b) {
		return a+b;
	}
	public Double ZERO() { return Double.POSITIVE_INFINITY; }
	public Double ONE() { return 0.0; }
}
