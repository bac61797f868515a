package org.javai.srilang.ast;

/**
 * Source offsets of a node. Every component may be {@code null} when the
 * front end did not supply it.
 *
 * @param lineno one-based start line
 * @param colOffset zero-based start column
 * @param endLineno one-based end line
 * @param endColOffset zero-based end column
 * @param src compact {@code start:length:source_id} reference
 * @param fullSourceCode the complete source the node was parsed from
 * @param nodeSourceCode the exact source text of this node
 */
public record SourceSpan(
		Integer lineno,
		Integer colOffset,
		Integer endLineno,
		Integer endColOffset,
		String src,
		String fullSourceCode,
		String nodeSourceCode
) {

	public static final SourceSpan NONE = new SourceSpan(null, null, null, null, null, null, null);

	public static SourceSpan at(int lineno, int colOffset) {
		return new SourceSpan(lineno, colOffset, null, null, null, null, null);
	}

	public static SourceSpan of(int lineno, int colOffset, int endLineno, int endColOffset) {
		return new SourceSpan(lineno, colOffset, endLineno, endColOffset, null, null, null);
	}

	public boolean hasPosition() {
		return lineno != null;
	}

	/**
	 * Fill every missing component from {@code parent}.
	 */
	public SourceSpan inheritFrom(SourceSpan parent) {
		if (parent == null) {
			return this;
		}
		return new SourceSpan(
				lineno != null ? lineno : parent.lineno,
				colOffset != null ? colOffset : parent.colOffset,
				endLineno != null ? endLineno : parent.endLineno,
				endColOffset != null ? endColOffset : parent.endColOffset,
				src != null ? src : parent.src,
				fullSourceCode != null ? fullSourceCode : parent.fullSourceCode,
				nodeSourceCode != null ? nodeSourceCode : parent.nodeSourceCode);
	}

	public SourceSpan withSource(String fullSourceCode) {
		return new SourceSpan(lineno, colOffset, endLineno, endColOffset, src, fullSourceCode, nodeSourceCode);
	}
}
