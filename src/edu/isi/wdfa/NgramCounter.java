package edu.isi.wdfa;

import java.util.Collection;
import java.util.List;

/**
 * Builds automata counting occurrences of class n-grams: sequences of n
 * symbol classes matched against n consecutive symbols of the input.
 * <p>
 * A counter's state is a bitmask of n-1 bits. Bit b (1-based, stored as
 * <code>1 &lt;&lt; (b-1)</code>) is set when the symbols read so far end in a
 * match of classes 1..b. Reading c sets bit b of the successor if c is in class
 * b and either b is 1 or bit b-1 was set; the transition weighs 1 exactly when
 * it completes a match of all n classes, 0 otherwise. Transducing a word with
 * {@link SumMonoid} then gives the number of matches.
 */
public class NgramCounter {

	// masks are ints
	public static final int MAX_CLASSES = 31;

	/**
	 * Counter for one sequence of classes. The raw table has 2^(n-1) states
	 * and is pruned before being returned.
	 *
	 * @throws IllegalArgumentException unless 1 &lt;= n &lt;= {@link #MAX_CLASSES},
	 * or if the raw table over the alphabet is too large to index
	 */
	public static <S> WeightedDFA<Integer, S, Integer> countNgrams(IndexSpace<S> alphabet,
			List<? extends Collection<S>> classes) {
		boolean debug = false;
		final int n = classes.size();
		if (n < 1 || n > MAX_CLASSES)
			throw new IllegalArgumentException("Can only count 1 to "+MAX_CLASSES+" classes, not "+n);
		final IndexSpace<S> sigma = alphabet;
		// inClass[i][c]: symbol c is a member of class i+1
		final boolean[][] inClass = new boolean[n][alphabet.size()];
		for (int i = 0; i < n; i++) {
			for (S c : classes.get(i)) {
				if (alphabet.contains(c))
					inClass[i][alphabet.index(c)] = true;
				else if (debug) Debug.debug(debug, "Ignoring "+c+" in class "+(i+1)+"; not in "+alphabet);
			}
		}
		WeightedDFA<Integer, S, Integer> raw = WeightedDFA.build(new IntRange(0, (1 << (n-1)) - 1), alphabet,
				new TransitionFunction<Integer, S, Integer>() {
			public Pair<Integer, Integer> transition(Integer s, S c) {
				int ci = sigma.index(c);
				int ns = 0;
				for (int b = 1; b <= n-1; b++) {
					if ((b == 1 || (s & (1 << (b-2))) != 0) && inClass[b-1][ci])
						ns |= 1 << (b-1);
				}
				boolean isfinal = (n == 1 || (s & (1 << (n-2))) != 0) && inClass[n-1][ci];
				return new Pair<Integer, Integer>(ns, isfinal ? 1 : 0);
			}
		});
		return raw.pruneUnreachable();
	}

	/**
	 * One automaton counting several patterns at once: transducing a word with
	 * {@link MultiCountMonoid} gives the count of each pattern, in order.
	 * Built as the product of the single-pattern counters. Every transition
	 * carries one count per pattern, but empty input gives the empty vector;
	 * pad with {@link MultiCount#zeros} where a fixed width is needed.
	 */
	public static <S> WeightedDFA<Integer, S, MultiCount> multiCounter(IndexSpace<S> alphabet,
			List<? extends List<? extends Collection<S>>> patterns) {
		if (patterns.isEmpty())
			throw new IllegalArgumentException("Need at least one pattern to count");
		WeightMap<Integer, MultiCount> single = new WeightMap<Integer, MultiCount>() {
			public MultiCount map(Integer w) { return MultiCount.of(w); }
		};
		WeightCombiner<MultiCount, MultiCount, MultiCount> join = new WeightCombiner<MultiCount, MultiCount, MultiCount>() {
			public MultiCount combine(MultiCount a, MultiCount b) { return MultiCount.concat(a, b); }
		};
		WeightedDFA<Integer, S, MultiCount> ret = countNgrams(alphabet, patterns.get(0)).mapWeights(single);
		for (int i = 1; i < patterns.size(); i++) {
			WeightedDFA<Integer, S, MultiCount> next = countNgrams(alphabet, patterns.get(i)).mapWeights(single);
			try {
				ret = Intersect.intersection(join, ret, next);
			}
			catch (IncompatibleAlphabetException e) {
				// every counter here reads the same alphabet
				throw new IllegalStateException("Counters over "+alphabet+" disagree on their alphabet", e);
			}
		}
		return ret;
	}
}
