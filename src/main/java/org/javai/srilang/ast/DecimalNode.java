package org.javai.srilang.ast;

import java.math.BigDecimal;
import java.util.List;
import java.util.Objects;

/**
 * A fixed-point decimal literal.
 */
public final class DecimalNode extends NumNode<BigDecimal> {

	public static final NodeType<DecimalNode> TYPE = NodeType.builder("Decimal", DecimalNode.class, DecimalNode::new)
			.inherit(List.of(ConstantNode.valueField(ValueType.DECIMAL)))
			.translate("n", "value")
			.build();

	DecimalNode(SriNode parent, SourceSpan span) {
		super(parent, span);
	}

	public static DecimalNode from(SriNode source, BigDecimal value) {
		DecimalNode node = new DecimalNode(null, spanOf(source));
		node.value = Objects.requireNonNull(value, "value must not be null");
		return node;
	}

	@Override
	public NodeType<DecimalNode> nodeType() {
		return TYPE;
	}

	@Override
	DecimalNode copy(SriNode parent, SourceSpan span) {
		DecimalNode node = new DecimalNode(parent, span);
		node.value = value;
		return node;
	}
}
