package org.javai.srilang.ast;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A {@code for} loop. An {@code else} clause is not supported.
 */
public final class ForNode extends SriNode {

	public static final NodeType<ForNode> TYPE = NodeType.builder("For", ForNode.class, ForNode::new)
			.node("iter", n -> n.iter, (n, v) -> n.iter = v)
			.node("target", n -> n.target, (n, v) -> n.target = v)
			.nodeList("body", n -> n.body)
			.onlyEmpty("orelse")
			.build();

	private SriNode iter;
	private SriNode target;
	private final List<SriNode> body = new ArrayList<>();

	ForNode(SriNode parent, SourceSpan span) {
		super(parent, span);
	}

	public SriNode iter() {
		return iter;
	}

	public SriNode target() {
		return target;
	}

	public List<SriNode> body() {
		return Collections.unmodifiableList(body);
	}

	@Override
	public NodeType<ForNode> nodeType() {
		return TYPE;
	}
}
