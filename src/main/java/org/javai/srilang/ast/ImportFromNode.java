package org.javai.srilang.ast;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

public final class ImportFromNode extends SriNode {

	public static final NodeType<ImportFromNode> TYPE = NodeType
			.builder("ImportFrom", ImportFromNode.class, ImportFromNode::new)
			.value("level", ValueType.SMALL_INTEGER, n -> n.level, (n, v) -> n.level = (Integer) v)
			.value("module", ValueType.STRING, n -> n.module, (n, v) -> n.module = (String) v)
			.nodeList("names", n -> n.names)
			.build();

	private Integer level;
	private String module;
	private final List<SriNode> names = new ArrayList<>();

	ImportFromNode(SriNode parent, SourceSpan span) {
		super(parent, span);
	}

	public Integer level() {
		return level;
	}

	public String module() {
		return module;
	}

	public List<SriNode> names() {
		return Collections.unmodifiableList(names);
	}

	@Override
	public NodeType<ImportFromNode> nodeType() {
		return TYPE;
	}
}
