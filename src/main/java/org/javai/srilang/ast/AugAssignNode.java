package org.javai.srilang.ast;

public final class AugAssignNode extends SriNode {

	public static final NodeType<AugAssignNode> TYPE = NodeType
			.builder("AugAssign", AugAssignNode.class, AugAssignNode::new)
			.value("op", ValueType.BINARY_OPERATOR, n -> n.op, (n, v) -> n.op = (BinaryOperator) v)
			.node("target", n -> n.target, (n, v) -> n.target = v)
			.node("value", n -> n.value, (n, v) -> n.value = v)
			.build();

	private BinaryOperator op;
	private SriNode target;
	private SriNode value;

	AugAssignNode(SriNode parent, SourceSpan span) {
		super(parent, span);
	}

	public BinaryOperator op() {
		return op;
	}

	public SriNode target() {
		return target;
	}

	public SriNode value() {
		return value;
	}

	@Override
	public NodeType<AugAssignNode> nodeType() {
		return TYPE;
	}
}
