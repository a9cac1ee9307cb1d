package cfg.grammar;

import java.io.Serializable;

/**
 * A terminal symbol, a single character of the input alphabet
 */
public final class Terminal extends Symbol implements Serializable {

	public Terminal(char value) {
		super(value);
	}

	@Override
	public Kind kind() {
		return Kind.TERMINAL;
	}
}
