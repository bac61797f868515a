package org.javai.srilang.ast;

public final class BreakNode extends SriNode {

	public static final NodeType<BreakNode> TYPE = NodeType.builder("Break", BreakNode.class, BreakNode::new).build();

	BreakNode(SriNode parent, SourceSpan span) {
		super(parent, span);
	}

	@Override
	public NodeType<BreakNode> nodeType() {
		return TYPE;
	}
}
