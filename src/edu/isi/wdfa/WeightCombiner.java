package edu.isi.wdfa;

// combines the weights of synchronized transitions in a product automaton
public interface WeightCombiner<W1, W2, W3> {
	public W3 combine(W1 a, W2 b);
}
