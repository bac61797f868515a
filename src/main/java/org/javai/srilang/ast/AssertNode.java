package org.javai.srilang.ast;

public final class AssertNode extends SriNode {

	public static final NodeType<AssertNode> TYPE = NodeType.builder("Assert", AssertNode.class, AssertNode::new)
			.node("test", n -> n.test, (n, v) -> n.test = v)
			.node("msg", n -> n.msg, (n, v) -> n.msg = v)
			.build();

	private SriNode test;
	private SriNode msg;

	AssertNode(SriNode parent, SourceSpan span) {
		super(parent, span);
	}

	public SriNode test() {
		return test;
	}

	public SriNode msg() {
		return msg;
	}

	@Override
	public NodeType<AssertNode> nodeType() {
		return TYPE;
	}
}
