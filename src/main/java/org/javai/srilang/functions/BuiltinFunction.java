package org.javai.srilang.functions;

/**
 * A function the language provides without a declaration.
 */
public interface BuiltinFunction {

	/**
	 * The name the function is called by in contract source.
	 */
	String name();
}
