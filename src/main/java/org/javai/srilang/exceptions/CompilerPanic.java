package org.javai.srilang.exceptions;

/**
 * Unexpected internal state during compilation, for example a broken syntax tree.
 */
public class CompilerPanic extends SrilangInternalException {

	public CompilerPanic(String message) {
		super(message);
	}

	public CompilerPanic(String message, Throwable cause) {
		super(message, cause);
	}
}
