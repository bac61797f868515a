package org.javai.srilang.ast;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

public final class DictNode extends SriNode {

	public static final NodeType<DictNode> TYPE = NodeType.builder("Dict", DictNode.class, DictNode::new)
			.nodeList("keys", n -> n.keys)
			.nodeList("values", n -> n.values)
			.build();

	private final List<SriNode> keys = new ArrayList<>();
	private final List<SriNode> values = new ArrayList<>();

	DictNode(SriNode parent, SourceSpan span) {
		super(parent, span);
	}

	public List<SriNode> keys() {
		return Collections.unmodifiableList(keys);
	}

	public List<SriNode> values() {
		return Collections.unmodifiableList(values);
	}

	@Override
	public NodeType<DictNode> nodeType() {
		return TYPE;
	}
}
