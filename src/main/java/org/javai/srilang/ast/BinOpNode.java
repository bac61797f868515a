package org.javai.srilang.ast;

import java.math.BigInteger;

/**
 * An arithmetic operation. Folds when both operands are integer literals or
 * both are decimal literals; the arithmetic itself lives in {@link BinaryOperator}.
 */
public final class BinOpNode extends SriNode implements Foldable {

	public static final NodeType<BinOpNode> TYPE = NodeType.builder("BinOp", BinOpNode.class, BinOpNode::new)
			.node("left", n -> n.left, (n, v) -> n.left = v)
			.value("op", ValueType.BINARY_OPERATOR, n -> n.op, (n, v) -> n.op = (BinaryOperator) v)
			.node("right", n -> n.right, (n, v) -> n.right = v)
			.build();

	private SriNode left;
	private BinaryOperator op;
	private SriNode right;

	BinOpNode(SriNode parent, SourceSpan span) {
		super(parent, span);
	}

	public SriNode left() {
		return left;
	}

	public BinaryOperator op() {
		return op;
	}

	public SriNode right() {
		return right;
	}

	/**
	 * @throws org.javai.srilang.exceptions.ZeroDivisionException on division or modulo by zero
	 * @throws org.javai.srilang.exceptions.TypeMismatchException on decimal exponentiation
	 */
	@Override
	public FoldResult tryEvaluate() {
		if (left instanceof IntNode l && right instanceof IntNode r) {
			BigInteger value = op.applyInteger(l.value(), r.value(), this);
			if (value == null) {
				return FoldResult.unfoldable("Result of " + op.description() + " is too large to evaluate");
			}
			return FoldResult.folded(IntNode.from(this, value));
		}
		if (left instanceof DecimalNode l && right instanceof DecimalNode r) {
			return FoldResult.folded(DecimalNode.from(this, op.applyDecimal(l.value(), r.value(), this)));
		}
		return FoldResult.unfoldable("Operands are not literals of one numeric kind");
	}

	@Override
	public String description() {
		return op == null ? super.description() : op.description();
	}

	@Override
	public NodeType<BinOpNode> nodeType() {
		return TYPE;
	}
}
