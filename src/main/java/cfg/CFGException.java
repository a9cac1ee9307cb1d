package cfg;

/**
 * Base class of the exceptions thrown by this library
 */
public class CFGException extends RuntimeException {

	public CFGException(String message) {
		super(message);
	}

	public CFGException(String message, Throwable cause) {
		super(message, cause);
	}
}
