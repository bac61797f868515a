package org.javai.srilang.ast;

import java.math.BigDecimal;
import java.math.BigInteger;

/**
 * A unary operation. Folds {@code -literal} for integers and decimals and
 * {@code not literal} for booleans.
 */
public final class UnaryOpNode extends SriNode implements Foldable {

	public static final NodeType<UnaryOpNode> TYPE = NodeType.builder("UnaryOp", UnaryOpNode.class, UnaryOpNode::new)
			.value("op", ValueType.UNARY_OPERATOR, n -> n.op, (n, v) -> n.op = (UnaryOperator) v)
			.node("operand", n -> n.operand, (n, v) -> n.operand = v)
			.build();

	private UnaryOperator op;
	private SriNode operand;

	UnaryOpNode(SriNode parent, SourceSpan span) {
		super(parent, span);
	}

	public UnaryOperator op() {
		return op;
	}

	public SriNode operand() {
		return operand;
	}

	@Override
	public FoldResult tryEvaluate() {
		if (op == UnaryOperator.NOT) {
			if (operand instanceof NameConstantNode constant && constant.isBoolean()) {
				return FoldResult.folded(NameConstantNode.from(this, !constant.value()));
			}
			return FoldResult.unfoldable("Operand of 'not' is not a boolean literal");
		}
		if (operand instanceof IntNode integer) {
			BigInteger value = integer.value();
			return FoldResult.folded(IntNode.from(this, value.negate()));
		}
		if (operand instanceof DecimalNode decimal) {
			BigDecimal value = decimal.value();
			return FoldResult.folded(DecimalNode.from(this, value.negate()));
		}
		return FoldResult.unfoldable("Operand of negation is not a numeric literal");
	}

	@Override
	public String description() {
		return op == null ? super.description() : op.description();
	}

	@Override
	public NodeType<UnaryOpNode> nodeType() {
		return TYPE;
	}
}
