package org.javai.srilang.ast;

/**
 * An annotated assignment. At module level this declares storage variables
 * and, when the annotation is {@code constant(...)}, compile-time constants.
 */
public final class AnnAssignNode extends SriNode {

	public static final NodeType<AnnAssignNode> TYPE = NodeType
			.builder("AnnAssign", AnnAssignNode.class, AnnAssignNode::new)
			.node("target", n -> n.target, (n, v) -> n.target = v)
			.node("annotation", n -> n.annotation, (n, v) -> n.annotation = v)
			.node("value", n -> n.value, (n, v) -> n.value = v)
			.value("simple", ValueType.SMALL_INTEGER, n -> n.simple, (n, v) -> n.simple = (Integer) v)
			.build();

	private SriNode target;
	private SriNode annotation;
	private SriNode value;
	private Integer simple;

	AnnAssignNode(SriNode parent, SourceSpan span) {
		super(parent, span);
	}

	public SriNode target() {
		return target;
	}

	public SriNode annotation() {
		return annotation;
	}

	public SriNode value() {
		return value;
	}

	public Integer simple() {
		return simple;
	}

	/**
	 * True if the annotation is a call to {@code constant} and the target is a plain name.
	 */
	public boolean isConstantDeclaration() {
		return target instanceof NameNode && "constant".equals(get("annotation.func.id"));
	}

	@Override
	public NodeType<AnnAssignNode> nodeType() {
		return TYPE;
	}
}
