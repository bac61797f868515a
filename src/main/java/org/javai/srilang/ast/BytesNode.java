package org.javai.srilang.ast;

import java.util.List;
import java.util.Objects;

/**
 * A byte string literal.
 */
public final class BytesNode extends ConstantNode<byte[]> {

	public static final NodeType<BytesNode> TYPE = NodeType.builder("Bytes", BytesNode.class, BytesNode::new)
			.inherit(List.of(ConstantNode.valueField(ValueType.BYTES)))
			.translate("s", "value")
			.build();

	BytesNode(SriNode parent, SourceSpan span) {
		super(parent, span);
	}

	public static BytesNode from(SriNode source, byte[] value) {
		BytesNode node = new BytesNode(null, spanOf(source));
		node.value = Objects.requireNonNull(value, "value must not be null").clone();
		return node;
	}

	@Override
	public byte[] value() {
		return value.clone();
	}

	@Override
	public NodeType<BytesNode> nodeType() {
		return TYPE;
	}

	@Override
	BytesNode copy(SriNode parent, SourceSpan span) {
		BytesNode node = new BytesNode(parent, span);
		node.value = value;
		return node;
	}
}
