package org.javai.srilang.ast;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A list display. When every element is a literal the whole list is a literal
 * sequence and may be substituted for a constant or subscripted at compile time.
 */
public final class ListNode extends SriNode {

	public static final NodeType<ListNode> TYPE = NodeType.builder("List", ListNode.class, ListNode::new)
			.nodeList("elts", n -> n.elements)
			.build();

	private final List<SriNode> elements = new ArrayList<>();

	ListNode(SriNode parent, SourceSpan span) {
		super(parent, span);
	}

	public List<SriNode> elements() {
		return Collections.unmodifiableList(elements);
	}

	// used by Literals when building a copy
	void addElement(SriNode element) {
		elements.add(element);
	}

	@Override
	public NodeType<ListNode> nodeType() {
		return TYPE;
	}
}
