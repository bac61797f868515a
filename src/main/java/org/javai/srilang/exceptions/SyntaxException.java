package org.javai.srilang.exceptions;

import org.javai.srilang.ast.SriNode;

/**
 * Invalid syntax, or syntax that is valid Python but not valid srilang.
 */
public class SyntaxException extends SrilangException {

	public SyntaxException(String message) {
		super(message);
	}

	public SyntaxException(String message, SriNode node) {
		super(message, node);
	}

	public SyntaxException(String message, ErrorLocation location) {
		super(message, location);
	}

	@Override
	protected SyntaxException relocated(ErrorLocation newLocation) {
		return new SyntaxException(detail(), newLocation);
	}
}
