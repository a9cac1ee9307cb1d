package cfg.grammar;

import java.io.Serializable;

/**
 * A non terminal symbol, named by an uppercase letter.
 *
 * The augmented start non terminal <code>S'</code> of an LR automaton shares the letter of the start
 * non terminal but is distinct from every symbol of the grammar.
 */
public final class NonTerminal extends Symbol implements Serializable {

	/**
	 * Is this the synthetic start symbol of an augmented grammar?
	 */
	public final boolean augmented;

	public NonTerminal(char name) {
		this(name, false);
	}

	private NonTerminal(char name, boolean augmented) {
		super(name);
		this.augmented = augmented;
	}

	/**
	 * Create the augmented start non terminal for the passed start non terminal
	 */
	public static NonTerminal augmentedStart(NonTerminal start){
		return new NonTerminal(start.value, true);
	}

	@Override
	public Kind kind() {
		return Kind.NONTERMINAL;
	}

	@Override
	public String toString() {
		return augmented ? value + "'" : String.valueOf(value);
	}

	@Override
	public int hashCode() {
		return augmented ? -super.hashCode() : super.hashCode();
	}

	@Override
	public boolean equals(Object obj) {
		return super.equals(obj) && ((NonTerminal)obj).augmented == augmented;
	}

	@Override
	public int compareTo(Symbol o) {
		int cmp = super.compareTo(o);
		if (cmp != 0 || !(o instanceof NonTerminal)){
			return cmp;
		}
		return Boolean.compare(augmented, ((NonTerminal)o).augmented);
	}
}
