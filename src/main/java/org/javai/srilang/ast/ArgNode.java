package org.javai.srilang.ast;

public final class ArgNode extends SriNode {

	public static final NodeType<ArgNode> TYPE = NodeType.builder("arg", ArgNode.class, ArgNode::new)
			.value("arg", ValueType.STRING, n -> n.arg, (n, v) -> n.arg = (String) v)
			.node("annotation", n -> n.annotation, (n, v) -> n.annotation = v)
			.build();

	private String arg;
	private SriNode annotation;

	ArgNode(SriNode parent, SourceSpan span) {
		super(parent, span);
	}

	public String arg() {
		return arg;
	}

	public SriNode annotation() {
		return annotation;
	}

	@Override
	public NodeType<ArgNode> nodeType() {
		return TYPE;
	}
}
