package org.javai.srilang.ast;

import java.util.List;
import java.util.Objects;
import org.javai.srilang.exceptions.SyntaxException;

/**
 * A hexadecimal literal such as {@code 0xFF}, kept exactly as written in the source.
 */
public final class HexNode extends NumNode<String> {

	public static final NodeType<HexNode> TYPE = NodeType.builder("Hex", HexNode.class, HexNode::new)
			.inherit(List.of(ConstantNode.valueField(ValueType.STRING)))
			.translate("n", "value")
			.build();

	HexNode(SriNode parent, SourceSpan span) {
		super(parent, span);
	}

	/**
	 * @throws SyntaxException if the literal has an odd number of digits
	 */
	public static HexNode from(SriNode source, String value) {
		HexNode node = new HexNode(null, spanOf(source));
		node.value = Objects.requireNonNull(value, "value must not be null");
		node.validate();
		return node;
	}

	/**
	 * Number of bytes the literal encodes.
	 */
	public int byteLength() {
		return (value.length() - 2) / 2;
	}

	@Override
	void validate() {
		if (value == null || value.length() % 2 != 0) {
			throw new SyntaxException("Hex notation requires an even number of digits", this);
		}
	}

	@Override
	public NodeType<HexNode> nodeType() {
		return TYPE;
	}

	@Override
	HexNode copy(SriNode parent, SourceSpan span) {
		HexNode node = new HexNode(parent, span);
		node.value = value;
		return node;
	}
}
