package org.javai.srilang.ast;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Lookup of every concrete node variant by its {@code ast_type} name.
 */
public final class NodeTypes {

	private static final List<NodeType<?>> ALL = List.of(
			ModuleNode.TYPE, FunctionDefNode.TYPE, DocStrNode.TYPE, ArgumentsNode.TYPE, ArgNode.TYPE,
			ReturnNode.TYPE, ClassDefNode.TYPE, IntNode.TYPE, DecimalNode.TYPE, HexNode.TYPE, StrNode.TYPE,
			BytesNode.TYPE, NameConstantNode.TYPE, ListNode.TYPE, TupleNode.TYPE, DictNode.TYPE, NameNode.TYPE,
			ExprNode.TYPE, UnaryOpNode.TYPE, BinOpNode.TYPE, BoolOpNode.TYPE, CompareNode.TYPE, CallNode.TYPE,
			KeywordNode.TYPE, AttributeNode.TYPE, SubscriptNode.TYPE, IndexNode.TYPE, AssignNode.TYPE,
			AnnAssignNode.TYPE, AugAssignNode.TYPE, RaiseNode.TYPE, AssertNode.TYPE, PassNode.TYPE,
			ImportNode.TYPE, ImportFromNode.TYPE, AliasNode.TYPE, IfNode.TYPE, ForNode.TYPE, BreakNode.TYPE,
			ContinueNode.TYPE);

	private static final Map<String, NodeType<?>> BY_AST_TYPE;
	private static final Map<Class<?>, NodeType<?>> BY_CLASS;

	static {
		Map<String, NodeType<?>> byAstType = new LinkedHashMap<>();
		Map<Class<?>, NodeType<?>> byClass = new LinkedHashMap<>();
		for (NodeType<?> type : ALL) {
			byAstType.put(type.astType(), type);
			byClass.put(type.javaType(), type);
		}
		BY_AST_TYPE = Map.copyOf(byAstType);
		BY_CLASS = Map.copyOf(byClass);
	}

	private NodeTypes() {
	}

	public static List<NodeType<?>> all() {
		return ALL;
	}

	public static Optional<NodeType<?>> forAstType(String astType) {
		return Optional.ofNullable(BY_AST_TYPE.get(astType));
	}

	/**
	 * Names of every field of a concrete variant, including those of the refinements it extends.
	 *
	 * @throws IllegalArgumentException if {@code variant} is not a concrete node class
	 */
	public static List<String> fieldsOf(Class<? extends SriNode> variant) {
		NodeType<?> type = BY_CLASS.get(variant);
		if (type == null) {
			throw new IllegalArgumentException(variant.getSimpleName() + " is not a concrete node variant");
		}
		return type.fieldNames();
	}
}
