package org.javai.srilang.ast;

import java.math.BigInteger;
import java.util.List;
import java.util.Objects;

/**
 * An integer literal.
 */
public final class IntNode extends NumNode<BigInteger> {

	public static final NodeType<IntNode> TYPE = NodeType.builder("Int", IntNode.class, IntNode::new)
			.inherit(List.of(ConstantNode.valueField(ValueType.INTEGER)))
			.translate("n", "value")
			.build();

	IntNode(SriNode parent, SourceSpan span) {
		super(parent, span);
	}

	/**
	 * A new integer literal positioned at {@code source}.
	 */
	public static IntNode from(SriNode source, BigInteger value) {
		IntNode node = new IntNode(null, spanOf(source));
		node.value = Objects.requireNonNull(value, "value must not be null");
		return node;
	}

	public static IntNode from(SriNode source, long value) {
		return from(source, BigInteger.valueOf(value));
	}

	@Override
	public NodeType<IntNode> nodeType() {
		return TYPE;
	}

	@Override
	IntNode copy(SriNode parent, SourceSpan span) {
		IntNode node = new IntNode(parent, span);
		node.value = value;
		return node;
	}
}
