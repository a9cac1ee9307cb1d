package cfg.grammar;

/**
 * Marks the end of the input (<code>$</code>)
 */
public final class EndMarker extends Symbol {

	public static final EndMarker INSTANCE = new EndMarker();

	private EndMarker() {
		super(END_MARKER_CHAR);
	}

	@Override
	public Kind kind() {
		return Kind.END_MARKER;
	}
}
