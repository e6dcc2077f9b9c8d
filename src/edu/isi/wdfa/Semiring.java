package edu.isi.wdfa;
// the general semiring. Subclasses do the operations
// plus and times are associative, ZERO and ONE their identities, and times distributes over plus
public abstract class Semiring<W> {
	public abstract W plus(W a, W b);
	public abstract W times(W a, W b);
	public abstract W ZERO();
	public abstract W ONE();
}
