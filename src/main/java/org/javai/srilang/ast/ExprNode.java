package org.javai.srilang.ast;

/**
 * An expression used as a statement.
 */
public final class ExprNode extends SriNode {

	public static final NodeType<ExprNode> TYPE = NodeType.builder("Expr", ExprNode.class, ExprNode::new)
			.node("value", n -> n.value, (n, v) -> n.value = v)
			.build();

	private SriNode value;

	ExprNode(SriNode parent, SourceSpan span) {
		super(parent, span);
	}

	public SriNode value() {
		return value;
	}

	@Override
	public NodeType<ExprNode> nodeType() {
		return TYPE;
	}
}
