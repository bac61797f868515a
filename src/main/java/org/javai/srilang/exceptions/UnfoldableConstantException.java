package org.javai.srilang.exceptions;

import org.javai.srilang.ast.SriNode;

/**
 * A {@code constant} declaration whose initializer does not reduce to a literal.
 */
public class UnfoldableConstantException extends SrilangException {

	public UnfoldableConstantException(String message) {
		super(message);
	}

	public UnfoldableConstantException(String message, SriNode node) {
		super(message, node);
	}

	public UnfoldableConstantException(String message, ErrorLocation location) {
		super(message, location);
	}

	@Override
	protected UnfoldableConstantException relocated(ErrorLocation newLocation) {
		return new UnfoldableConstantException(detail(), newLocation);
	}
}
