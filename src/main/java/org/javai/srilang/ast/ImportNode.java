package org.javai.srilang.ast;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

public final class ImportNode extends SriNode {

	public static final NodeType<ImportNode> TYPE = NodeType.builder("Import", ImportNode.class, ImportNode::new)
			.nodeList("names", n -> n.names)
			.build();

	private final List<SriNode> names = new ArrayList<>();

	ImportNode(SriNode parent, SourceSpan span) {
		super(parent, span);
	}

	public List<SriNode> names() {
		return Collections.unmodifiableList(names);
	}

	@Override
	public NodeType<ImportNode> nodeType() {
		return TYPE;
	}
}
