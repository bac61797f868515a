package org.javai.srilang.ast;

import java.math.BigDecimal;
import java.util.Arrays;
import java.util.Objects;

/**
 * A literal whose value is fully known at compile time.
 *
 * <p>All literal variants share the {@code value} field. Two literals are of
 * the same kind only if they are of the same variant.</p>
 *
 * @param <V> Java representation of the value
 */
public abstract sealed class ConstantNode<V> extends SriNode permits NumNode, StrNode, BytesNode, NameConstantNode {

	V value;

	ConstantNode(SriNode parent, SourceSpan span) {
		super(parent, span);
	}

	public V value() {
		return value;
	}

	/**
	 * Literal with the same kind and value, owned by {@code parent} and positioned at {@code span}.
	 */
	abstract ConstantNode<V> copy(SriNode parent, SourceSpan span);

	@SuppressWarnings({ "unchecked", "rawtypes" })
	static NodeField valueField(ValueType valueType) {
		return NodeField.value("value", valueType, ConstantNode.class, n -> n.value, (n, v) -> n.value = v);
	}

	/**
	 * Literal value equality: decimals compare numerically, byte strings by content.
	 */
	public static boolean valuesEqual(Object left, Object right) {
		if (left instanceof BigDecimal l && right instanceof BigDecimal r) {
			return l.compareTo(r) == 0;
		}
		if (left instanceof byte[] l && right instanceof byte[] r) {
			return Arrays.equals(l, r);
		}
		return Objects.equals(left, right);
	}
}
