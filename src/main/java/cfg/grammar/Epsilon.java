package cfg.grammar;

/**
 * The empty word
 */
public final class Epsilon extends Symbol {

	public static final Epsilon INSTANCE = new Epsilon();

	private Epsilon() {
		super(EPSILON_CHAR);
	}

	@Override
	public Kind kind() {
		return Kind.EPSILON;
	}

	@Override
	public String toString() {
		return "ε";
	}
}
