package org.javai.srilang.ast;

import java.util.Objects;

/**
 * Outcome of trying to reduce a node to a literal.
 *
 * <p>{@link Unfoldable} is not an error: it means the node is not (yet) a
 * compile-time literal and should be left in place. Errors in the contract
 * are thrown as {@link org.javai.srilang.exceptions.SrilangException}.</p>
 */
public sealed interface FoldResult {

	record Folded(SriNode node) implements FoldResult {
		public Folded {
			Objects.requireNonNull(node, "node must not be null");
		}
	}

	record Unfoldable(String reason) implements FoldResult {
	}

	static FoldResult folded(SriNode node) {
		return new Folded(node);
	}

	static FoldResult unfoldable(String reason) {
		return new Unfoldable(reason);
	}

	default boolean isFolded() {
		return this instanceof Folded;
	}
}
