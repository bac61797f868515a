package org.javai.srilang.ast;

/**
 * Representation of a plain-value node field.
 */
public enum ValueType {
	/** {@link java.math.BigInteger} */
	INTEGER,
	/** {@link java.math.BigDecimal} */
	DECIMAL,
	/** {@link String} */
	STRING,
	/** {@code byte[]} */
	BYTES,
	/** {@link Boolean}, {@code null} for {@code None} */
	BOOLEAN,
	/** {@link Integer} flags and counters such as {@code simple} or {@code level} */
	SMALL_INTEGER,
	UNARY_OPERATOR,
	BINARY_OPERATOR,
	BOOL_OPERATOR,
	COMPARE_OPERATOR
}
