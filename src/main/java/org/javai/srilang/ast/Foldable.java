package org.javai.srilang.ast;

/**
 * Implemented by node variants that have a literal-evaluation rule.
 * Variants that do not implement it always evaluate to
 * {@link FoldResult.Unfoldable}.
 */
public interface Foldable {

	FoldResult tryEvaluate();
}
