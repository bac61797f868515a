package org.javai.srilang.ast;

public final class KeywordNode extends SriNode {

	public static final NodeType<KeywordNode> TYPE = NodeType.builder("keyword", KeywordNode.class, KeywordNode::new)
			.value("arg", ValueType.STRING, n -> n.arg, (n, v) -> n.arg = (String) v)
			.node("value", n -> n.value, (n, v) -> n.value = v)
			.build();

	private String arg;
	private SriNode value;

	KeywordNode(SriNode parent, SourceSpan span) {
		super(parent, span);
	}

	public String arg() {
		return arg;
	}

	public SriNode value() {
		return value;
	}

	@Override
	public NodeType<KeywordNode> nodeType() {
		return TYPE;
	}
}
