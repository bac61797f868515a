package org.javai.srilang.ast;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * {@code and} / {@code or} over two or more operands. Folds only once every
 * operand is already a boolean literal, so no short-circuiting is involved.
 */
public final class BoolOpNode extends SriNode implements Foldable {

	public static final NodeType<BoolOpNode> TYPE = NodeType.builder("BoolOp", BoolOpNode.class, BoolOpNode::new)
			.value("op", ValueType.BOOL_OPERATOR, n -> n.op, (n, v) -> n.op = (BoolOperator) v)
			.nodeList("values", n -> n.values)
			.build();

	private BoolOperator op;
	private final List<SriNode> values = new ArrayList<>();

	BoolOpNode(SriNode parent, SourceSpan span) {
		super(parent, span);
	}

	public BoolOperator op() {
		return op;
	}

	public List<SriNode> values() {
		return Collections.unmodifiableList(values);
	}

	@Override
	public FoldResult tryEvaluate() {
		List<Boolean> operands = new ArrayList<>(values.size());
		for (SriNode value : values) {
			if (!(value instanceof NameConstantNode constant) || !constant.isBoolean()) {
				return FoldResult.unfoldable("Operands are not all boolean literals");
			}
			operands.add(constant.value());
		}
		return FoldResult.folded(NameConstantNode.from(this, op.apply(operands)));
	}

	@Override
	public String description() {
		return op == null ? super.description() : op.description();
	}

	@Override
	public NodeType<BoolOpNode> nodeType() {
		return TYPE;
	}
}
