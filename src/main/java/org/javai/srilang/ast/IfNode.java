package org.javai.srilang.ast;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

public final class IfNode extends SriNode {

	public static final NodeType<IfNode> TYPE = NodeType.builder("If", IfNode.class, IfNode::new)
			.node("test", n -> n.test, (n, v) -> n.test = v)
			.nodeList("body", n -> n.body)
			.nodeList("orelse", n -> n.orelse)
			.build();

	private SriNode test;
	private final List<SriNode> body = new ArrayList<>();
	private final List<SriNode> orelse = new ArrayList<>();

	IfNode(SriNode parent, SourceSpan span) {
		super(parent, span);
	}

	public SriNode test() {
		return test;
	}

	public List<SriNode> body() {
		return Collections.unmodifiableList(body);
	}

	public List<SriNode> orelse() {
		return Collections.unmodifiableList(orelse);
	}

	@Override
	public NodeType<IfNode> nodeType() {
		return TYPE;
	}
}
