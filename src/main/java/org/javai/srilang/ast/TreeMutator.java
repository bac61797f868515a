package org.javai.srilang.ast;

import java.util.List;
import java.util.Objects;
import org.javai.srilang.exceptions.CompilerPanic;

/**
 * The one supported in-place rewrite of a syntax tree.
 */
public final class TreeMutator {

	private TreeMutator() {
	}

	/**
	 * Replace {@code oldNode} with {@code newNode} in the tree rooted at {@code root}.
	 *
	 * <p>Exactly one field of the old node's parent, or exactly one slot of one of
	 * its sequence fields, must hold the old node. That slot is rebound to the new
	 * node, which takes over the old node's parent and depth. The old node is
	 * detached for good.</p>
	 *
	 * <p>{@code newNode} must be parentless, or be a descendant of {@code oldNode}
	 * (an element lifted out of a subscripted list, for instance).</p>
	 *
	 * @throws CompilerPanic if the tree bookkeeping does not match the above
	 */
	public static void replaceInTree(SriNode root, SriNode oldNode, SriNode newNode) {
		Objects.requireNonNull(root, "root must not be null");
		Objects.requireNonNull(oldNode, "oldNode must not be null");
		Objects.requireNonNull(newNode, "newNode must not be null");

		SriNode parent = oldNode.parentNode();
		if (parent == null || oldNode.isDetached() || !isReachable(root, parent)) {
			throw new CompilerPanic("Node to be replaced does not exist within the tree");
		}
		if (!parent.childSet().contains(oldNode)) {
			throw new CompilerPanic("Node to be replaced does not exist within parent children");
		}
		SriNode formerParent = newNode.parentNode();
		if (newNode.isDetached() || newNode == oldNode
				|| (formerParent != null && !isDescendant(newNode, oldNode))) {
			throw new CompilerPanic("Replacement node is already part of another tree");
		}

		NodeField slot = null;
		for (NodeField field : parent.nodeType().fields()) {
			switch (field.kind()) {
				case NODE -> {
					if (field.get(parent) == oldNode) {
						slot = claim(slot, field);
					}
				}
				case NODE_LIST -> {
					if (occurrences((List<?>) field.get(parent), oldNode) > 0) {
						slot = claim(slot, field);
					}
				}
				case VALUE -> {
				}
			}
		}
		if (slot == null) {
			throw new CompilerPanic("Node to be replaced does not exist within parent members");
		}

		if (slot.kind() == NodeField.Kind.NODE) {
			slot.set(parent, newNode);
		}
		else {
			@SuppressWarnings("unchecked")
			List<SriNode> list = (List<SriNode>) slot.get(parent);
			list.set(list.indexOf(oldNode), newNode);
		}

		if (formerParent != null) {
			formerParent.childSet().remove(newNode);
		}
		parent.childSet().remove(oldNode);
		newNode.rebind(parent, oldNode.depth());
		parent.childSet().add(newNode);
		oldNode.markDetached();
	}

	private static NodeField claim(NodeField current, NodeField candidate) {
		if (current != null) {
			throw new CompilerPanic("Node to be replaced exists as multiple members in parent");
		}
		return candidate;
	}

	private static int occurrences(List<?> list, SriNode node) {
		int count = 0;
		for (Object item : list) {
			if (item == node) {
				count++;
			}
		}
		if (count > 1) {
			throw new CompilerPanic("Node to be replaced exists as multiple members in parent");
		}
		return count;
	}

	// follows parent links, checking each link is also registered as a child
	private static boolean isReachable(SriNode root, SriNode node) {
		SriNode current = node;
		while (current != root) {
			SriNode parent = current.parentNode();
			if (parent == null || !parent.childSet().contains(current)) {
				return false;
			}
			current = parent;
		}
		return true;
	}

	private static boolean isDescendant(SriNode node, SriNode ancestor) {
		for (SriNode current = node.parentNode(); current != null; current = current.parentNode()) {
			if (current == ancestor) {
				return true;
			}
		}
		return false;
	}
}
