package org.javai.srilang.ast;

import java.math.BigDecimal;
import java.math.BigInteger;
import org.javai.srilang.exceptions.TypeMismatchException;

/**
 * A comparison of exactly two values. Chained comparisons are rejected when
 * the node is built.
 */
public final class CompareNode extends SriNode implements Foldable {

	public static final NodeType<CompareNode> TYPE = NodeType.builder("Compare", CompareNode.class, CompareNode::new)
			.node("left", n -> n.left, (n, v) -> n.left = v)
			.value("op", ValueType.COMPARE_OPERATOR, n -> n.op, (n, v) -> n.op = (CompareOperator) v)
			.node("right", n -> n.right, (n, v) -> n.right = v)
			.singleton("ops", "op", "Cannot have a comparison with more than two elements")
			.singleton("comparators", "right", "Cannot have a comparison with more than two elements")
			.build();

	private SriNode left;
	private CompareOperator op;
	private SriNode right;

	CompareNode(SriNode parent, SourceSpan span) {
		super(parent, span);
	}

	public SriNode left() {
		return left;
	}

	public CompareOperator op() {
		return op;
	}

	public SriNode right() {
		return right;
	}

	/**
	 * @throws TypeMismatchException for an ordering comparison between
	 *         non-numeric literals, or membership in a list of mixed literal kinds
	 */
	@Override
	public FoldResult tryEvaluate() {
		if (!(left instanceof ConstantNode<?> leftLiteral)) {
			return FoldResult.unfoldable("Left side of comparison is not a literal");
		}
		if (op == CompareOperator.IN) {
			return evaluateMembership(leftLiteral);
		}
		if (!(right instanceof ConstantNode<?> rightLiteral) || left.getClass() != right.getClass()) {
			return FoldResult.unfoldable("Cannot compare different literal types");
		}
		boolean result;
		if (op.isOrdering()) {
			if (!(left instanceof IntNode || left instanceof DecimalNode)) {
				throw new TypeMismatchException("Invalid literal types for " + op.description() + " comparison", this);
			}
			result = op.test(compareNumeric(leftLiteral.value(), rightLiteral.value()));
		}
		else {
			boolean equal = ConstantNode.valuesEqual(leftLiteral.value(), rightLiteral.value());
			result = op == CompareOperator.EQ ? equal : !equal;
		}
		return FoldResult.folded(NameConstantNode.from(this, result));
	}

	private FoldResult evaluateMembership(ConstantNode<?> needle) {
		if (!(right instanceof ListNode list)) {
			return FoldResult.unfoldable("Right side of membership test is not a literal list");
		}
		Class<?> elementKind = null;
		for (SriNode element : list.elements()) {
			if (!(element instanceof ConstantNode)) {
				return FoldResult.unfoldable("List contains non-literal elements");
			}
			if (elementKind == null) {
				elementKind = element.getClass();
			}
			else if (elementKind != element.getClass()) {
				throw new TypeMismatchException("List contains multiple literal types", list);
			}
		}
		boolean found = false;
		for (SriNode element : list.elements()) {
			if (ConstantNode.valuesEqual(needle.value(), ((ConstantNode<?>) element).value())) {
				found = true;
				break;
			}
		}
		return FoldResult.folded(NameConstantNode.from(this, found));
	}

	private static int compareNumeric(Object left, Object right) {
		if (left instanceof BigInteger l && right instanceof BigInteger r) {
			return l.compareTo(r);
		}
		return ((BigDecimal) left).compareTo((BigDecimal) right);
	}

	@Override
	public String description() {
		return op == null ? super.description() : op.description();
	}

	@Override
	public NodeType<CompareNode> nodeType() {
		return TYPE;
	}
}
