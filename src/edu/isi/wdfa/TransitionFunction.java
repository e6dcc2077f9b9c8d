package edu.isi.wdfa;

/**
 * Supplies the table of an automaton built with
 * {@link WeightedDFA#build}. Called once for every (state, symbol) pair;
 * returns the successor state and the weight of the transition.
 */
public interface TransitionFunction<L, S, W> {
	public Pair<L, W> transition(L state, S symbol);
}
