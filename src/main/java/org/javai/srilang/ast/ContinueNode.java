package org.javai.srilang.ast;

public final class ContinueNode extends SriNode {

	public static final NodeType<ContinueNode> TYPE = NodeType.builder("Continue", ContinueNode.class, ContinueNode::new).build();

	ContinueNode(SriNode parent, SourceSpan span) {
		super(parent, span);
	}

	@Override
	public NodeType<ContinueNode> nodeType() {
		return TYPE;
	}
}
