package org.javai.srilang.ast;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Base class for all srilang syntax tree nodes.
 *
 * <p>Every node has a process-unique id, an exclusive owner ({@code null}
 * only for the root), the set of children it owns, a depth and a source span.
 * The set of variants is closed; each variant describes its fields through
 * its {@link NodeType}, which lets traversal, dict export and structural
 * comparison work on any node without per-variant code.</p>
 *
 * <p>Nodes are created by {@link NodeFactory} from a raw tree, or synthesised
 * with the {@code from(...)} factories of the literal variants and
 * {@link Literals#copyAt(SriNode, SriNode)}. After
 * construction the only supported mutation is
 * {@link TreeMutator#replaceInTree(SriNode, SriNode, SriNode)}.</p>
 *
 * <p>Equality and hashing use the node id only. Use
 * {@link #structurallyEquals(SriNode)} to compare represented values.</p>
 */
public abstract sealed class SriNode permits TopLevelNode, DocStrNode, ArgumentsNode, ArgNode, ReturnNode,
		ClassDefNode, ConstantNode, ListNode, TupleNode, DictNode, NameNode, ExprNode, UnaryOpNode, BinOpNode,
		BoolOpNode, CompareNode, CallNode, KeywordNode, AttributeNode, SubscriptNode, IndexNode, AssignNode,
		AnnAssignNode, AugAssignNode, RaiseNode, AssertNode, PassNode, ImportNode, ImportFromNode, AliasNode,
		IfNode, ForNode, BreakNode, ContinueNode {

	/**
	 * Attributes every node has in addition to its variant fields.
	 */
	public static final List<String> BASE_ATTRIBUTES = List.of(
			"node_id", "ast_type", "lineno", "col_offset", "end_lineno", "end_col_offset", "src",
			"full_source_code", "node_source_code");

	private static final AtomicLong ID_SEQUENCE = new AtomicLong();

	private final long nodeId;
	private final SourceSpan span;
	private final Set<SriNode> children = new LinkedHashSet<>();
	private SriNode parent;
	private int depth;
	private boolean detached;

	protected SriNode(SriNode parent, SourceSpan span) {
		this.nodeId = ID_SEQUENCE.incrementAndGet();
		this.parent = parent;
		this.depth = parent == null ? 0 : parent.depth + 1;
		SourceSpan own = span != null ? span : SourceSpan.NONE;
		this.span = parent == null ? own : own.inheritFrom(parent.span);
	}

	/**
	 * Static description of this node's variant.
	 */
	public abstract NodeType<? extends SriNode> nodeType();

	public final long nodeId() {
		return nodeId;
	}

	public final String astType() {
		return nodeType().astType();
	}

	public String description() {
		return nodeType().description();
	}

	public final SourceSpan span() {
		return span;
	}

	public final int depth() {
		return depth;
	}

	/**
	 * True once this node has been replaced out of its tree.
	 */
	public final boolean isDetached() {
		return detached;
	}

	/**
	 * The owning node, or {@code null} for the root.
	 */
	public final SriNode getAncestor() {
		return parent;
	}

	/**
	 * The closest ancestor that is an instance of one of {@code types}, or {@code null}.
	 */
	@SafeVarargs
	public final SriNode getAncestor(Class<? extends SriNode>... types) {
		if (types.length == 0) {
			return parent;
		}
		for (SriNode current = parent; current != null; current = current.parent) {
			for (Class<? extends SriNode> type : types) {
				if (type.isInstance(current)) {
					return current;
				}
			}
		}
		return null;
	}

	/**
	 * Value of a variant field, or of one of the {@link #BASE_ATTRIBUTES}.
	 * Returns {@code null} for unknown names. Sequence fields are returned as
	 * read-only views.
	 */
	public Object attribute(String name) {
		switch (name) {
			case "node_id":
				return nodeId;
			case "ast_type":
				return astType();
			case "lineno":
				return span.lineno();
			case "col_offset":
				return span.colOffset();
			case "end_lineno":
				return span.endLineno();
			case "end_col_offset":
				return span.endColOffset();
			case "src":
				return span.src();
			case "full_source_code":
				return span.fullSourceCode();
			case "node_source_code":
				return span.nodeSourceCode();
			default:
				break;
		}
		return nodeType().field(name)
				.map(field -> {
					Object value = field.get(this);
					return value instanceof List<?> list ? Collections.unmodifiableList(list) : value;
				})
				.orElse(null);
	}

	/**
	 * Resolve a dotted attribute path such as {@code annotation.func.id}.
	 *
	 * @return the value at the end of the path, or {@code null} if any segment is missing
	 */
	public Object get(String path) {
		Objects.requireNonNull(path, "path must not be null");
		Object current = this;
		for (String segment : path.split("\\.")) {
			if (!(current instanceof SriNode node)) {
				return null;
			}
			current = node.attribute(segment);
		}
		return current;
	}

	/**
	 * Attempt to reduce this node to a literal. Variants that have no
	 * evaluation rule are always {@link FoldResult.Unfoldable}.
	 */
	public final FoldResult evaluate() {
		if (this instanceof Foldable foldable) {
			return foldable.tryEvaluate();
		}
		return FoldResult.unfoldable(astType() + " cannot be evaluated");
	}

	/**
	 * Direct children, ordered by source position then node id.
	 */
	public List<SriNode> getChildren() {
		return Traversal.children(this, NodeQuery.any());
	}

	public <T extends SriNode> List<T> getChildren(Class<T> type) {
		return castAll(Traversal.children(this, NodeQuery.ofType(type)), type);
	}

	public List<SriNode> getChildren(NodeQuery query) {
		return Traversal.children(this, query);
	}

	/**
	 * Every node beneath this one. A node always precedes its own descendants;
	 * in reverse order every descendant precedes its ancestors.
	 */
	public List<SriNode> getDescendants() {
		return Traversal.descendants(this, NodeQuery.any());
	}

	public <T extends SriNode> List<T> getDescendants(Class<T> type) {
		return castAll(Traversal.descendants(this, NodeQuery.ofType(type)), type);
	}

	public <T extends SriNode> List<T> getDescendants(Class<T> type, Map<String, ?> filters) {
		return castAll(Traversal.descendants(this, NodeQuery.ofType(type).where(filters)), type);
	}

	public List<SriNode> getDescendants(NodeQuery query) {
		return Traversal.descendants(this, query);
	}

	/**
	 * Compare the represented values of two nodes, ignoring ids and source spans.
	 */
	public boolean structurallyEquals(SriNode other) {
		return structurallyEqual(this, other);
	}

	public static boolean structurallyEqual(SriNode left, SriNode right) {
		if (left == right) {
			return true;
		}
		if (left == null || right == null || left.getClass() != right.getClass()) {
			return false;
		}
		for (NodeField field : left.nodeType().fields()) {
			Object leftValue = field.get(left);
			Object rightValue = field.get(right);
			switch (field.kind()) {
				case NODE -> {
					if (!structurallyEqual((SriNode) leftValue, (SriNode) rightValue)) {
						return false;
					}
				}
				case NODE_LIST -> {
					List<?> leftList = (List<?>) leftValue;
					List<?> rightList = (List<?>) rightValue;
					if (leftList.size() != rightList.size()) {
						return false;
					}
					for (int i = 0; i < leftList.size(); i++) {
						if (!structurallyEqual((SriNode) leftList.get(i), (SriNode) rightList.get(i))) {
							return false;
						}
					}
				}
				case VALUE -> {
					if (!ConstantNode.valuesEqual(leftValue, rightValue)) {
						return false;
					}
				}
			}
		}
		return true;
	}

	@Override
	public final boolean equals(Object obj) {
		if (this == obj) {
			return true;
		}
		return obj instanceof SriNode other && other.nodeId == nodeId;
	}

	@Override
	public final int hashCode() {
		return Long.hashCode(nodeId);
	}

	@Override
	public String toString() {
		StringBuilder sb = new StringBuilder(astType()).append('#').append(nodeId);
		if (span.hasPosition()) {
			sb.append(" @ ").append(span.lineno()).append(':').append(span.colOffset());
		}
		return sb.toString();
	}

	// package-private bookkeeping for NodeFactory, Literals and TreeMutator

	final Set<SriNode> childSet() {
		return children;
	}

	final SriNode parentNode() {
		return parent;
	}

	/**
	 * Register with the parent once every field has been populated.
	 */
	final void attachToParent() {
		if (parent != null) {
			parent.children.add(this);
		}
	}

	final void rebind(SriNode newParent, int newDepth) {
		this.parent = newParent;
		this.depth = newDepth;
	}

	/**
	 * Variant-specific checks run once all fields are set.
	 */
	void validate() {
	}

	static SourceSpan spanOf(SriNode node) {
		return node == null ? SourceSpan.NONE : node.span;
	}

	final void markDetached() {
		this.parent = null;
		this.detached = true;
	}

	private static <T> List<T> castAll(List<SriNode> nodes, Class<T> type) {
		List<T> result = new ArrayList<>(nodes.size());
		for (SriNode node : nodes) {
			result.add(type.cast(node));
		}
		return result;
	}
}
