package org.javai.srilang.ast;

public final class ReturnNode extends SriNode {

	public static final NodeType<ReturnNode> TYPE = NodeType.builder("Return", ReturnNode.class, ReturnNode::new)
			.node("value", n -> n.value, (n, v) -> n.value = v)
			.build();

	private SriNode value;

	ReturnNode(SriNode parent, SourceSpan span) {
		super(parent, span);
	}

	/**
	 * The returned expression, or {@code null} for a bare {@code return}.
	 */
	public SriNode value() {
		return value;
	}

	@Override
	public NodeType<ReturnNode> nodeType() {
		return TYPE;
	}
}
