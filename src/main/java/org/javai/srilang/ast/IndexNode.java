package org.javai.srilang.ast;

public final class IndexNode extends SriNode {

	public static final NodeType<IndexNode> TYPE = NodeType.builder("Index", IndexNode.class, IndexNode::new)
			.node("value", n -> n.value, (n, v) -> n.value = v)
			.build();

	private SriNode value;

	IndexNode(SriNode parent, SourceSpan span) {
		super(parent, span);
	}

	public SriNode value() {
		return value;
	}

	@Override
	public NodeType<IndexNode> nodeType() {
		return TYPE;
	}
}
