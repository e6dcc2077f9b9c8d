package edu.isi.wdfa;

// real is +, *, 0, 1
// plain doubles, so long paths of small probabilities can underflow
public class RealSemiring extends Semiring<Double> {
	public Double plus(Double a, Double b) {
		return a+b;
	}
	public Double times(Double a, Double b) {
		return a*b;
	}
	public Double ZERO() { return 0.0; }
	public Double ONE() { return 1.0; }
}
