package org.javai.srilang.ast;

import java.util.List;
import java.util.Objects;
import org.javai.srilang.exceptions.SyntaxException;

/**
 * A string literal. Only characters below code point 256 are allowed.
 */
public final class StrNode extends ConstantNode<String> {

	public static final NodeType<StrNode> TYPE = NodeType.builder("Str", StrNode.class, StrNode::new)
			.inherit(List.of(ConstantNode.valueField(ValueType.STRING)))
			.translate("s", "value")
			.build();

	StrNode(SriNode parent, SourceSpan span) {
		super(parent, span);
	}

	public static StrNode from(SriNode source, String value) {
		StrNode node = new StrNode(null, spanOf(source));
		node.value = Objects.requireNonNull(value, "value must not be null");
		node.validate();
		return node;
	}

	@Override
	void validate() {
		if (value == null) {
			throw new SyntaxException("String literal has no value", this);
		}
		for (int i = 0; i < value.length(); i++) {
			char c = value.charAt(i);
			if (c >= 256) {
				throw new SyntaxException("'" + c + "' is not an allowed string literal character", this);
			}
		}
	}

	@Override
	public NodeType<StrNode> nodeType() {
		return TYPE;
	}

	@Override
	StrNode copy(SriNode parent, SourceSpan span) {
		StrNode node = new StrNode(parent, span);
		node.value = value;
		return node;
	}
}
