package org.javai.srilang.ast;

/**
 * A single-target assignment. Python's {@code targets} list must hold exactly one element.
 */
public final class AssignNode extends SriNode {

	public static final NodeType<AssignNode> TYPE = NodeType.builder("Assign", AssignNode.class, AssignNode::new)
			.node("target", n -> n.target, (n, v) -> n.target = v)
			.node("value", n -> n.value, (n, v) -> n.value = v)
			.singleton("targets", "target", "Assignment statement must have one target")
			.build();

	private SriNode target;
	private SriNode value;

	AssignNode(SriNode parent, SourceSpan span) {
		super(parent, span);
	}

	public SriNode target() {
		return target;
	}

	public SriNode value() {
		return value;
	}

	@Override
	public NodeType<AssignNode> nodeType() {
		return TYPE;
	}
}
