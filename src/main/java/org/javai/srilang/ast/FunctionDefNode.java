package org.javai.srilang.ast;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

public final class FunctionDefNode extends TopLevelNode {

	public static final NodeType<FunctionDefNode> TYPE = NodeType
			.builder("FunctionDef", FunctionDefNode.class, FunctionDefNode::new)
			.inherit(TopLevelNode.FIELDS)
			.node("args", n -> n.args, (n, v) -> n.args = v)
			.node("returns", n -> n.returns, (n, v) -> n.returns = v)
			.nodeList("decorator_list", n -> n.decoratorList)
			.value("pos", ValueType.SMALL_INTEGER, n -> n.pos, (n, v) -> n.pos = (Integer) v)
			.description("function definition")
			.build();

	private SriNode args;
	private SriNode returns;
	private final List<SriNode> decoratorList = new ArrayList<>();
	private Integer pos;

	FunctionDefNode(SriNode parent, SourceSpan span) {
		super(parent, span);
	}

	public SriNode args() {
		return args;
	}

	public SriNode returns() {
		return returns;
	}

	public List<SriNode> decoratorList() {
		return Collections.unmodifiableList(decoratorList);
	}

	public Integer pos() {
		return pos;
	}

	@Override
	public NodeType<FunctionDefNode> nodeType() {
		return TYPE;
	}
}
