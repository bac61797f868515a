package org.javai.srilang.ast;

import java.math.BigInteger;
import java.util.List;

/**
 * An indexed reference such as {@code a[i]}.
 *
 * <p>{@code [10, 20, 30][1]} folds to the element node itself; the list being
 * indexed is discarded together with this node.</p>
 */
public final class SubscriptNode extends SriNode implements Foldable {

	public static final NodeType<SubscriptNode> TYPE = NodeType
			.builder("Subscript", SubscriptNode.class, SubscriptNode::new)
			.node("slice", n -> n.slice, (n, v) -> n.slice = v)
			.node("value", n -> n.value, (n, v) -> n.value = v)
			.build();

	private SriNode slice;
	private SriNode value;

	SubscriptNode(SriNode parent, SourceSpan span) {
		super(parent, span);
	}

	/**
	 * The index wrapper, normally an {@link IndexNode}.
	 */
	public SriNode slice() {
		return slice;
	}

	public SriNode value() {
		return value;
	}

	@Override
	public FoldResult tryEvaluate() {
		if (!(value instanceof ListNode list) || !Literals.isLiteral(list)) {
			return FoldResult.unfoldable("Subscript object is not a literal list");
		}
		List<SriNode> elements = list.elements();
		if (elements.stream().map(Object::getClass).distinct().count() > 1) {
			return FoldResult.unfoldable("List contains multiple node types");
		}
		Object index = slice == null ? null : slice.get("value.value");
		if (!(slice instanceof IndexNode) || !(index instanceof BigInteger position)
				|| position.signum() < 0 || position.compareTo(BigInteger.valueOf(elements.size())) >= 0) {
			return FoldResult.unfoldable("Invalid index value");
		}
		return FoldResult.folded(elements.get(position.intValue()));
	}

	@Override
	public NodeType<SubscriptNode> nodeType() {
		return TYPE;
	}
}
