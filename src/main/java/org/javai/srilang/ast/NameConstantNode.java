package org.javai.srilang.ast;

import java.util.List;

/**
 * {@code True}, {@code False} or {@code None}. The value is {@code null} for {@code None}.
 */
public final class NameConstantNode extends ConstantNode<Boolean> {

	public static final NodeType<NameConstantNode> TYPE = NodeType
			.builder("NameConstant", NameConstantNode.class, NameConstantNode::new)
			.inherit(List.of(ConstantNode.valueField(ValueType.BOOLEAN)))
			.build();

	NameConstantNode(SriNode parent, SourceSpan span) {
		super(parent, span);
	}

	public static NameConstantNode from(SriNode source, Boolean value) {
		NameConstantNode node = new NameConstantNode(null, spanOf(source));
		node.value = value;
		return node;
	}

	/**
	 * True unless this is {@code None}.
	 */
	public boolean isBoolean() {
		return value != null;
	}

	@Override
	public NodeType<NameConstantNode> nodeType() {
		return TYPE;
	}

	@Override
	NameConstantNode copy(SriNode parent, SourceSpan span) {
		NameConstantNode node = new NameConstantNode(parent, span);
		node.value = value;
		return node;
	}
}
