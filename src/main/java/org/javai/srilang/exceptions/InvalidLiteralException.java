package org.javai.srilang.exceptions;

import org.javai.srilang.ast.SriNode;

/**
 * A literal value is out of range or malformed.
 */
public class InvalidLiteralException extends SrilangException {

	public InvalidLiteralException(String message) {
		super(message);
	}

	public InvalidLiteralException(String message, SriNode node) {
		super(message, node);
	}

	public InvalidLiteralException(String message, ErrorLocation location) {
		super(message, location);
	}

	@Override
	protected InvalidLiteralException relocated(ErrorLocation newLocation) {
		return new InvalidLiteralException(detail(), newLocation);
	}
}
