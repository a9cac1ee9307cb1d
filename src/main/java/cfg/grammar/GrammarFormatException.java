package cfg.grammar;

import cfg.CFGException;

/**
 * Thrown when grammar text is malformed: a missing separator, a left hand side that isn't a single
 * non terminal or a production count that doesn't match the supplied lines.
 */
public class GrammarFormatException extends CFGException {

	/**
	 * 1-based number of the offending input line, -1 if the error isn't tied to a single line
	 */
	public final int line;

	public GrammarFormatException(int line, String message) {
		super(line < 0 ? message : String.format("Error at line %d: %s", line, message));
		this.line = line;
	}

	public GrammarFormatException(String message) {
		this(-1, message);
	}
}
