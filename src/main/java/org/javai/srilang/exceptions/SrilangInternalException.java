package org.javai.srilang.exceptions;

/**
 * Base class for errors that indicate a defect in the compiler itself.
 *
 * <p>These are never caused by the contract source and must abort compilation
 * rather than be reported as a user error.</p>
 */
public class SrilangInternalException extends RuntimeException {

	public SrilangInternalException(String message) {
		super(message);
	}

	public SrilangInternalException(String message, Throwable cause) {
		super(message, cause);
	}

	@Override
	public String getMessage() {
		return super.getMessage() + " Please create an issue.";
	}
}
