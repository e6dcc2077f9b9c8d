package edu.isi.wdfa;

import gnu.trove.TIntHashSet;
import gnu.trove.TIntStack;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * A weighted deterministic finite automaton with a total transition table.
 * <p>
 * States are labeled by values of an {@link IndexSpace} of type L and read
 * symbols of an {@link IndexSpace} of type S. Every (state, symbol) pair has
 * exactly one transition, carrying a successor state and a weight W. There is
 * no set of accepting states: whatever a caller wants to observe (a match, a
 * count, a probability) is carried by the weights. The initial state is the
 * first label of the label space.
 * <p>
 * Automata are immutable. Every operation that changes an automaton returns a
 * new one with its own table, so an automaton may be shared between threads
 * for transduction.
 */
public class WeightedDFA<L, S, W> {

	private final IndexSpace<L> labels;
	private final IndexSpace<S> alphabet;
	// both indexed by labelIndex * |S| + symbolIndex
	// successor label index
	final int[] successors;
	final Object[] weights;

	// arrays are taken over, not copied
	WeightedDFA(IndexSpace<L> labels, IndexSpace<S> alphabet, int[] successors, Object[] weights) {
		this.labels = labels;
		this.alphabet = alphabet;
		this.successors = successors;
		this.weights = weights;
	}

	/**
	 * Builds the dense table of an automaton by calling f for every state and
	 * symbol, in label order, then symbol order.
	 *
	 * @throws IndexOutOfBoundsException if f returns a successor outside of labels
	 * @throws IllegalArgumentException if the table is too large to index
	 */
	public static <L, S, W> WeightedDFA<L, S, W> build(IndexSpace<L> labels, IndexSpace<S> alphabet,
			TransitionFunction<L, S, W> f) {
		int nstates = labels.size();
		int nsyms = alphabet.size();
		int ncells = cellCount(nstates, nsyms);
		int[] succ = new int[ncells];
		Object[] ws = new Object[ncells];
		for (int s = 0; s < nstates; s++) {
			L state = labels.get(s);
			for (int c = 0; c < nsyms; c++) {
				Pair<L, W> t = f.transition(state, alphabet.get(c));
				succ[s*nsyms+c] = labels.index(t.l());
				ws[s*nsyms+c] = t.r();
			}
		}
		return new WeightedDFA<L, S, W>(labels, alphabet, succ, ws);
	}

	// size of a table over nstates states and nsyms symbols; must fit in an array
	static int cellCount(long nstates, int nsyms) {
		long ncells = nstates * nsyms;
		if (ncells > Integer.MAX_VALUE)
			throw new IllegalArgumentException("Table of "+nstates+" states by "+nsyms+" symbols too large to index");
		return (int)ncells;
	}

	public IndexSpace<L> getLabels() { return labels; }
	public IndexSpace<S> getAlphabet() { return alphabet; }
	public int getNumStates() { return labels.size(); }
	public L getInitialState() { return labels.first(); }

	/** inclusive (min, max) of the state labels */
	public Pair<L, L> labelBounds() { return labels.bounds(); }
	/** inclusive (min, max) of the alphabet */
	public Pair<S, S> alphabetBounds() { return alphabet.bounds(); }

	private int cell(L state, S symbol) {
		return labels.index(state)*alphabet.size() + alphabet.index(symbol);
	}

	W weightAt(int cell) {
		return (W)weights[cell];
	}

	/**
	 * The successor and weight of reading symbol in state.
	 *
	 * @throws IndexOutOfBoundsException if state or symbol is out of bounds
	 */
	public Pair<L, W> transition(L state, S symbol) {
		int c = cell(state, symbol);
		return new Pair<L, W>(labels.get(successors[c]), weightAt(c));
	}
	public L advanceState(L state, S symbol) {
		return labels.get(successors[cell(state, symbol)]);
	}
	public W weight(L state, S symbol) {
		return weightAt(cell(state, symbol));
	}

	/** same topology, every weight replaced by f(weight) */
	public <V> WeightedDFA<L, S, V> mapWeights(WeightMap<W, V> f) {
		Object[] ws = new Object[weights.length];
		for (int i = 0; i < weights.length; i++)
			ws[i] = f.map(weightAt(i));
		return new WeightedDFA<L, S, V>(labels, alphabet, successors.clone(), ws);
	}

	/**
	 * Restrict to the states reachable from the initial state. Kept states are
	 * renumbered from 1 in their original label order; the initial state
	 * therefore stays first. Weights are unchanged.
	 */
	public WeightedDFA<Integer, S, W> pruneUnreachable() {
		boolean debug = false;
		int nstates = labels.size();
		int nsyms = alphabet.size();

		// depth first from the initial state; mark before pushing so cycles terminate
		TIntHashSet reached = new TIntHashSet();
		TIntStack readyStates = new TIntStack();
		reached.add(0);
		readyStates.push(0);
		while (readyStates.size() > 0) {
			int curr = readyStates.pop();
			for (int c = 0; c < nsyms; c++) {
				int next = successors[curr*nsyms+c];
				if (!reached.contains(next)) {
					reached.add(next);
					readyStates.push(next);
				}
			}
		}

		// old index -> new label, in original order
		int[] newLabels = new int[nstates];
		int numKept = 0;
		for (int s = 0; s < nstates; s++) {
			if (reached.contains(s))
				newLabels[s] = ++numKept;
		}
		int[] oldIndices = new int[numKept];
		for (int s = 0; s < nstates; s++) {
			if (newLabels[s] > 0)
				oldIndices[newLabels[s]-1] = s;
		}
		if (debug) Debug.debug(debug, "Kept "+numKept+" of "+nstates+" states");

		int[] succ = new int[numKept*nsyms];
		Object[] ws = new Object[numKept*nsyms];
		for (int s = 0; s < numKept; s++) {
			int old = oldIndices[s];
			for (int c = 0; c < nsyms; c++) {
				// new labels start at 1, their indices at 0
				succ[s*nsyms+c] = newLabels[successors[old*nsyms+c]] - 1;
				ws[s*nsyms+c] = weights[old*nsyms+c];
			}
		}
		return new WeightedDFA<Integer, S, W>(new IntRange(1, numKept), alphabet, succ, ws);
	}

	/** the weights met while reading input from the initial state, in order */
	public List<W> transitionWeights(List<S> input) {
		ArrayList<W> ret = new ArrayList<W>(input.size());
		int nsyms = alphabet.size();
		int state = 0;
		for (S c : input) {
			int cell = state*nsyms + alphabet.index(c);
			ret.add(weightAt(cell));
			state = successors[cell];
		}
		return ret;
	}

	/** monoid append of the path weights; the identity for empty input */
	public W transduce(List<S> input, Monoid<W> m) {
		return m.concat(transitionWeights(input));
	}

	/**
	 * Semiring value of the single path read by input: the product of its
	 * weights from ONE, added once to ZERO.
	 */
	public W transduceSemiring(List<S> input, Semiring<W> sr) {
		W prod = sr.ONE();
		for (W w : transitionWeights(input))
			prod = sr.times(prod, w);
		return sr.plus(sr.ZERO(), prod);
	}

	public boolean equals(Object o) {
		if (!(o instanceof WeightedDFA))
			return false;
		WeightedDFA d = (WeightedDFA)o;
		return labels.equals(d.labels) && alphabet.equals(d.alphabet) &&
			Arrays.equals(successors, d.successors) && Arrays.equals(weights, d.weights);
	}
	public int hashCode() {
		return 31*Arrays.hashCode(successors) + Arrays.hashCode(weights);
	}

	// one line per transition: state symbol -> successor / weight
	public String toString() {
		StringBuffer sb = new StringBuffer();
		sb.append("WDFA: "+labels.size()+" states over "+alphabet+"\n");
		int nsyms = alphabet.size();
		for (int s = 0; s < labels.size(); s++) {
			for (int c = 0; c < nsyms; c++) {
				int cell = s*nsyms+c;
				sb.append(labels.get(s)+" "+alphabet.get(c)+" -> "+labels.get(successors[cell])+" / "+weights[cell]+"\n");
			}
		}
		return sb.toString();
	}
}
