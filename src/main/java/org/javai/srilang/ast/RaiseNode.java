package org.javai.srilang.ast;

public final class RaiseNode extends SriNode {

	public static final NodeType<RaiseNode> TYPE = NodeType.builder("Raise", RaiseNode.class, RaiseNode::new)
			.node("exc", n -> n.exc, (n, v) -> n.exc = v)
			.onlyEmpty("cause")
			.build();

	private SriNode exc;

	RaiseNode(SriNode parent, SourceSpan span) {
		super(parent, span);
	}

	public SriNode exc() {
		return exc;
	}

	@Override
	public NodeType<RaiseNode> nodeType() {
		return TYPE;
	}
}
