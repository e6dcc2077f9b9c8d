package edu.isi.wdfa;

// synchronized product of two automata reading the same alphabet
public class Intersect {

	/**
	 * The full product over every pair of states. From (s1, s2) on c it moves
	 * to (advance1(s1,c), advance2(s2,c)) with weight f(w1, w2). Most of these
	 * states are usually unreachable; see {@link #intersection}.
	 *
	 * @throws IncompatibleAlphabetException if the alphabets differ in any member
	 * @throws IllegalArgumentException if the product table is too large to index
	 */
	public static <L1, L2, S, W1, W2, W3> WeightedDFA<Pair<L1, L2>, S, W3> rawIntersection(
			WeightCombiner<W1, W2, W3> f, WeightedDFA<L1, S, W1> a, WeightedDFA<L2, S, W2> b)
			throws IncompatibleAlphabetException {
		boolean debug = false;
		if (!a.getAlphabet().equals(b.getAlphabet()))
			throw new IncompatibleAlphabetException("Segment ranges must match: "+
					a.getAlphabet()+" vs. "+b.getAlphabet());
		int na = a.getNumStates();
		int nb = b.getNumStates();
		int nsyms = a.getAlphabet().size();
		int ncells = WeightedDFA.cellCount((long)na*nb, nsyms);
		PairSpace<L1, L2> labels = new PairSpace<L1, L2>(a.getLabels(), b.getLabels());
		if (debug) Debug.debug(debug, "Crossing "+na+" and "+nb+" states");
		int[] succ = new int[ncells];
		Object[] ws = new Object[ncells];
		for (int s1 = 0; s1 < na; s1++) {
			for (int s2 = 0; s2 < nb; s2++) {
				int s = s1*nb + s2;
				for (int c = 0; c < nsyms; c++) {
					int cella = s1*nsyms + c;
					int cellb = s2*nsyms + c;
					succ[s*nsyms+c] = a.successors[cella]*nb + b.successors[cellb];
					ws[s*nsyms+c] = f.combine(a.weightAt(cella), b.weightAt(cellb));
				}
			}
		}
		return new WeightedDFA<Pair<L1, L2>, S, W3>(labels, a.getAlphabet(), succ, ws);
	}

	/** the product restricted to the states reachable from (initial1, initial2) */
	public static <L1, L2, S, W1, W2, W3> WeightedDFA<Integer, S, W3> intersection(
			WeightCombiner<W1, W2, W3> f, WeightedDFA<L1, S, W1> a, WeightedDFA<L2, S, W2> b)
			throws IncompatibleAlphabetException {
		return rawIntersection(f, a, b).pruneUnreachable();
	}
}
