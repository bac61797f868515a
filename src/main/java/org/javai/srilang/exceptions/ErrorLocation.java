package org.javai.srilang.exceptions;

import org.javai.srilang.ast.SourceSpan;
import org.javai.srilang.ast.SriNode;

/**
 * Where in the contract source an error was detected.
 *
 * @param lineno one-based line, or {@code null} when unknown
 * @param colOffset zero-based column, or {@code null} when unknown
 * @param sourceCode full source text the position refers to, or {@code null}
 */
public record ErrorLocation(Integer lineno, Integer colOffset, String sourceCode) {

	public static final ErrorLocation UNKNOWN = new ErrorLocation(null, null, null);

	public static ErrorLocation of(SriNode node) {
		if (node == null) {
			return UNKNOWN;
		}
		SourceSpan span = node.span();
		return new ErrorLocation(span.lineno(), span.colOffset(), span.fullSourceCode());
	}

	public boolean isKnown() {
		return lineno != null;
	}
}
