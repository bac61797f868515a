package org.javai.srilang.ast;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

public final class TupleNode extends SriNode {

	public static final NodeType<TupleNode> TYPE = NodeType.builder("Tuple", TupleNode.class, TupleNode::new)
			.nodeList("elts", n -> n.elements)
			.build();

	private final List<SriNode> elements = new ArrayList<>();

	TupleNode(SriNode parent, SourceSpan span) {
		super(parent, span);
	}

	public List<SriNode> elements() {
		return Collections.unmodifiableList(elements);
	}

	@Override
	public NodeType<TupleNode> nodeType() {
		return TYPE;
	}
}
