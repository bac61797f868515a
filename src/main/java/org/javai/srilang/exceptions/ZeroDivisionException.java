package org.javai.srilang.exceptions;

import org.javai.srilang.ast.SriNode;

/**
 * Second operand of a division or modulo operation was zero.
 */
public class ZeroDivisionException extends SrilangException {

	public ZeroDivisionException(String message) {
		super(message);
	}

	public ZeroDivisionException(String message, SriNode node) {
		super(message, node);
	}

	public ZeroDivisionException(String message, ErrorLocation location) {
		super(message, location);
	}

	@Override
	protected ZeroDivisionException relocated(ErrorLocation newLocation) {
		return new ZeroDivisionException(detail(), newLocation);
	}
}
