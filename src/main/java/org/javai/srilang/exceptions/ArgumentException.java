package org.javai.srilang.exceptions;

import org.javai.srilang.ast.SriNode;

/**
 * A builtin function was called with invalid arguments.
 */
public class ArgumentException extends SrilangException {

	public ArgumentException(String message) {
		super(message);
	}

	public ArgumentException(String message, SriNode node) {
		super(message, node);
	}

	public ArgumentException(String message, ErrorLocation location) {
		super(message, location);
	}

	@Override
	protected ArgumentException relocated(ErrorLocation newLocation) {
		return new ArgumentException(detail(), newLocation);
	}
}
