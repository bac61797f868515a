package org.javai.srilang.ast;

/**
 * Root of a contract's syntax tree.
 */
public final class ModuleNode extends TopLevelNode {

	public static final NodeType<ModuleNode> TYPE = NodeType.builder("Module", ModuleNode.class, ModuleNode::new)
			.inherit(TopLevelNode.FIELDS)
			.build();

	ModuleNode(SriNode parent, SourceSpan span) {
		super(parent, span);
	}

	/**
	 * Replace {@code oldNode} with {@code newNode} somewhere beneath this module.
	 *
	 * @see TreeMutator#replaceInTree(SriNode, SriNode, SriNode)
	 */
	public void replaceInTree(SriNode oldNode, SriNode newNode) {
		TreeMutator.replaceInTree(this, oldNode, newNode);
	}

	@Override
	public NodeType<ModuleNode> nodeType() {
		return TYPE;
	}
}
