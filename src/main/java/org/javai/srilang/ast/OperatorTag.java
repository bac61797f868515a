package org.javai.srilang.ast;

/**
 * An operator held as a plain value in an operation node.
 */
public interface OperatorTag {

	/**
	 * Name used for the operator in dict trees, e.g. {@code Add}.
	 */
	String astType();

	/**
	 * Human readable name used in diagnostics.
	 */
	String description();
}
