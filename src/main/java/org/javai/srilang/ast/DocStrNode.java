package org.javai.srilang.ast;

/**
 * A docstring. The value is the raw text between the quotes.
 */
public final class DocStrNode extends SriNode {

	public static final NodeType<DocStrNode> TYPE = NodeType.builder("DocStr", DocStrNode.class, DocStrNode::new)
			.value("value", ValueType.STRING, n -> n.value, (n, v) -> n.value = (String) v)
			.translate("s", "value")
			.build();

	private String value;

	DocStrNode(SriNode parent, SourceSpan span) {
		super(parent, span);
	}

	public String value() {
		return value;
	}

	@Override
	public NodeType<DocStrNode> nodeType() {
		return TYPE;
	}
}
