package org.javai.srilang.ast;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A struct, event or interface declaration. {@code class_type} says which.
 */
public final class ClassDefNode extends SriNode {

	public static final NodeType<ClassDefNode> TYPE = NodeType.builder("ClassDef", ClassDefNode.class, ClassDefNode::new)
			.value("class_type", ValueType.STRING, n -> n.classType, (n, v) -> n.classType = (String) v)
			.value("name", ValueType.STRING, n -> n.name, (n, v) -> n.name = (String) v)
			.nodeList("body", n -> n.body)
			.build();

	private String classType;
	private String name;
	private final List<SriNode> body = new ArrayList<>();

	ClassDefNode(SriNode parent, SourceSpan span) {
		super(parent, span);
	}

	public String classType() {
		return classType;
	}

	public String name() {
		return name;
	}

	public List<SriNode> body() {
		return Collections.unmodifiableList(body);
	}

	@Override
	public NodeType<ClassDefNode> nodeType() {
		return TYPE;
	}
}
