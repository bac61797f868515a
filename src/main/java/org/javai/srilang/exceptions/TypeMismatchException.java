package org.javai.srilang.exceptions;

import org.javai.srilang.ast.SriNode;

/**
 * An operation between literals of incompatible types.
 */
public class TypeMismatchException extends SrilangException {

	public TypeMismatchException(String message) {
		super(message);
	}

	public TypeMismatchException(String message, SriNode node) {
		super(message, node);
	}

	public TypeMismatchException(String message, ErrorLocation location) {
		super(message, location);
	}

	@Override
	protected TypeMismatchException relocated(ErrorLocation newLocation) {
		return new TypeMismatchException(detail(), newLocation);
	}
}
