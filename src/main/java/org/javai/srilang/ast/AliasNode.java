package org.javai.srilang.ast;

public final class AliasNode extends SriNode {

	public static final NodeType<AliasNode> TYPE = NodeType.builder("alias", AliasNode.class, AliasNode::new)
			.value("name", ValueType.STRING, n -> n.name, (n, v) -> n.name = (String) v)
			.value("asname", ValueType.STRING, n -> n.asname, (n, v) -> n.asname = (String) v)
			.build();

	private String name;
	private String asname;

	AliasNode(SriNode parent, SourceSpan span) {
		super(parent, span);
	}

	public String name() {
		return name;
	}

	public String asname() {
		return asname;
	}

	@Override
	public NodeType<AliasNode> nodeType() {
		return TYPE;
	}
}
