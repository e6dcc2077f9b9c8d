package edu.isi.wdfa;

import java.util.List;

// an associative append with an identity. Subclasses do the operations.
// used to accumulate weights in plain transduction
public abstract class Monoid<W> {
	public abstract W identity();
	// must be associative, with identity() on either side a no-op
	public abstract W append(W a, W b);

	// fold of the whole list, identity if empty
	public W concat(List<W> ws) {
		W acc = identity();
		for (W w : ws)
			acc = append(acc, w);
		return acc;
	}
}
