package org.javai.srilang.ast;

/**
 * A reference to a variable, constant, type or function by name.
 */
public final class NameNode extends SriNode {

	public static final NodeType<NameNode> TYPE = NodeType.builder("Name", NameNode.class, NameNode::new)
			.value("id", ValueType.STRING, n -> n.id, (n, v) -> n.id = (String) v)
			.build();

	private String id;

	NameNode(SriNode parent, SourceSpan span) {
		super(parent, span);
	}

	public String id() {
		return id;
	}

	@Override
	public NodeType<NameNode> nodeType() {
		return TYPE;
	}
}
