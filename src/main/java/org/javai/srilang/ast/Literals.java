package org.javai.srilang.ast;

import java.util.Optional;

/**
 * Helpers for literal values: scalar constants and lists whose elements are,
 * recursively, literals.
 */
public final class Literals {

	private Literals() {
	}

	public static boolean isLiteral(SriNode node) {
		if (node instanceof ConstantNode) {
			return true;
		}
		if (node instanceof ListNode list) {
			for (SriNode element : list.elements()) {
				if (!isLiteral(element)) {
					return false;
				}
			}
			return true;
		}
		return false;
	}

	/**
	 * Copy a literal so that it can stand in place of {@code at}. The copy gets
	 * fresh ids and {@code at}'s source position, and has no parent.
	 *
	 * @return the copy, or empty if {@code template} is not a literal
	 */
	public static Optional<SriNode> copyAt(SriNode template, SriNode at) {
		if (!isLiteral(template)) {
			return Optional.empty();
		}
		return Optional.of(copy(template, null, SriNode.spanOf(at)));
	}

	// parents are built before their elements so that ids keep source order
	private static SriNode copy(SriNode template, SriNode parent, SourceSpan span) {
		SriNode result;
		if (template instanceof ConstantNode<?> constant) {
			result = constant.copy(parent, span);
		}
		else {
			ListNode source = (ListNode) template;
			ListNode list = new ListNode(parent, span);
			for (SriNode element : source.elements()) {
				list.addElement(copy(element, list, SourceSpan.NONE));
			}
			result = list;
		}
		result.attachToParent();
		return result;
	}
}
