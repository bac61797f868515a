package org.javai.srilang.ast;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.Deque;
import java.util.List;

/**
 * Ordered enumeration of children and descendants.
 *
 * <p>Nodes are ordered by start line, then start column, then node id;
 * nodes without a position sort last. Ids grow in construction order and a
 * node is always constructed before the children it owns, so a node sorts
 * ahead of its descendants.</p>
 */
final class Traversal {

	static final Comparator<SriNode> SOURCE_ORDER = Comparator
			.comparing((SriNode n) -> n.span().lineno(), Comparator.nullsLast(Comparator.naturalOrder()))
			.thenComparing(n -> n.span().colOffset(), Comparator.nullsLast(Comparator.naturalOrder()))
			.thenComparingLong(SriNode::nodeId);

	private Traversal() {
	}

	static List<SriNode> children(SriNode node, NodeQuery query) {
		List<SriNode> result = new ArrayList<>();
		for (SriNode child : node.childSet()) {
			if (query.matches(child)) {
				result.add(child);
			}
		}
		return order(result, query.isReverse());
	}

	static List<SriNode> descendants(SriNode node, NodeQuery query) {
		List<SriNode> result = new ArrayList<>();
		Deque<SriNode> pending = new ArrayDeque<>(node.childSet());
		while (!pending.isEmpty()) {
			SriNode current = pending.pop();
			if (query.matches(current)) {
				result.add(current);
			}
			pending.addAll(current.childSet());
		}
		if (query.isIncludeSelf() && query.matches(node)) {
			result.add(node);
		}
		return order(result, query.isReverse());
	}

	private static List<SriNode> order(List<SriNode> nodes, boolean reverse) {
		nodes.sort(SOURCE_ORDER);
		if (reverse) {
			Collections.reverse(nodes);
		}
		return nodes;
	}
}
