package org.javai.srilang.ast;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Shared structure of {@link ModuleNode} and {@link FunctionDefNode}: a body of
 * statements, a name and an optional docstring.
 */
public abstract sealed class TopLevelNode extends SriNode permits ModuleNode, FunctionDefNode {

	static final List<NodeField> FIELDS = List.of(
			NodeField.nodeList("body", TopLevelNode.class, n -> n.body),
			NodeField.value("name", ValueType.STRING, TopLevelNode.class, n -> n.name, (n, v) -> n.name = (String) v),
			NodeField.node("doc_string", TopLevelNode.class, n -> n.docString, (n, v) -> n.docString = v));

	private final List<SriNode> body = new ArrayList<>();
	private String name;
	private SriNode docString;

	TopLevelNode(SriNode parent, SourceSpan span) {
		super(parent, span);
	}

	public List<SriNode> body() {
		return Collections.unmodifiableList(body);
	}

	public String name() {
		return name;
	}

	/**
	 * The docstring node, or {@code null} if there is none.
	 */
	public SriNode docString() {
		return docString;
	}
}
