package org.javai.srilang.ast;

/**
 * Member access {@code value.attr}.
 */
public final class AttributeNode extends SriNode {

	public static final NodeType<AttributeNode> TYPE = NodeType
			.builder("Attribute", AttributeNode.class, AttributeNode::new)
			.value("attr", ValueType.STRING, n -> n.attr, (n, v) -> n.attr = (String) v)
			.node("value", n -> n.value, (n, v) -> n.value = v)
			.build();

	private String attr;
	private SriNode value;

	AttributeNode(SriNode parent, SourceSpan span) {
		super(parent, span);
	}

	public String attr() {
		return attr;
	}

	public SriNode value() {
		return value;
	}

	@Override
	public NodeType<AttributeNode> nodeType() {
		return TYPE;
	}
}
