package edu.isi.wdfa;

// rewrites a single transition weight; see WeightedDFA.mapWeights
public interface WeightMap<W1, W2> {
	public W2 map(W1 w);
}
