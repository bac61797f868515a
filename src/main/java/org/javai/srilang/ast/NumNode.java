package org.javai.srilang.ast;

/**
 * Numeric literal refinement shared by integers, decimals and hex values.
 */
public abstract sealed class NumNode<V> extends ConstantNode<V> permits IntNode, DecimalNode, HexNode {

	NumNode(SriNode parent, SourceSpan span) {
		super(parent, span);
	}
}
