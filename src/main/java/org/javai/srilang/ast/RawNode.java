package org.javai.srilang.ast;

import java.util.List;

/**
 * One node of the generic parse tree produced by the front end, before it is
 * converted into typed variants by {@link NodeFactory}.
 *
 * <p>Field values are {@code null}, another {@code RawNode}, a {@link List}
 * of such values, a {@link String}, a {@link java.math.BigInteger}, a
 * {@link java.math.BigDecimal} or a {@link Boolean}. Operators are raw nodes
 * with no fields, e.g. {@code {"ast_type": "Add"}}.</p>
 */
public interface RawNode {

	String astType();

	/**
	 * Span attributes present on this raw node; absent components are {@code null}.
	 */
	SourceSpan span();

	/**
	 * Names of all non-span fields present, in input order.
	 */
	List<String> fieldNames();

	Object get(String fieldName);
}
