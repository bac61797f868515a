package org.javai.srilang.ast;

public final class PassNode extends SriNode {

	public static final NodeType<PassNode> TYPE = NodeType.builder("Pass", PassNode.class, PassNode::new).build();

	PassNode(SriNode parent, SourceSpan span) {
		super(parent, span);
	}

	@Override
	public NodeType<PassNode> nodeType() {
		return TYPE;
	}
}
