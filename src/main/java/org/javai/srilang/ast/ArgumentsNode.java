package org.javai.srilang.ast;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Function parameters. Variadic and keyword-only parameters are not supported.
 */
public final class ArgumentsNode extends SriNode {

	public static final NodeType<ArgumentsNode> TYPE = NodeType
			.builder("arguments", ArgumentsNode.class, ArgumentsNode::new)
			.nodeList("args", n -> n.args)
			.nodeList("defaults", n -> n.defaults)
			.node("default", n -> n.defaultValue, (n, v) -> n.defaultValue = v)
			.onlyEmpty("vararg", "kwonlyargs", "kwarg", "kw_defaults")
			.build();

	private final List<SriNode> args = new ArrayList<>();
	private final List<SriNode> defaults = new ArrayList<>();
	private SriNode defaultValue;

	ArgumentsNode(SriNode parent, SourceSpan span) {
		super(parent, span);
	}

	public List<SriNode> args() {
		return Collections.unmodifiableList(args);
	}

	public List<SriNode> defaults() {
		return Collections.unmodifiableList(defaults);
	}

	public SriNode defaultValue() {
		return defaultValue;
	}

	@Override
	public NodeType<ArgumentsNode> nodeType() {
		return TYPE;
	}
}
