package org.javai.srilang.ast.folding;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.javai.srilang.ast.AnnAssignNode;
import org.javai.srilang.ast.AssignNode;
import org.javai.srilang.ast.AttributeNode;
import org.javai.srilang.ast.AugAssignNode;
import org.javai.srilang.ast.BinOpNode;
import org.javai.srilang.ast.BoolOpNode;
import org.javai.srilang.ast.CallNode;
import org.javai.srilang.ast.CompareNode;
import org.javai.srilang.ast.ConstantNode;
import org.javai.srilang.ast.DictNode;
import org.javai.srilang.ast.FoldResult;
import org.javai.srilang.ast.IndexNode;
import org.javai.srilang.ast.Literals;
import org.javai.srilang.ast.ModuleNode;
import org.javai.srilang.ast.NameNode;
import org.javai.srilang.ast.NodeQuery;
import org.javai.srilang.ast.SriNode;
import org.javai.srilang.ast.SubscriptNode;
import org.javai.srilang.ast.UnaryOpNode;
import org.javai.srilang.exceptions.UnfoldableConstantException;
import org.javai.srilang.functions.BuiltinRegistry;
import org.javai.srilang.functions.DispatchTable;
import org.javai.srilang.functions.FoldableBuiltin;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reduces every compile-time computable expression of a module to a literal.
 *
 * <p>Builtin constants are substituted once. Then user constants, literal
 * operations, literal subscripts and foldable builtin calls are replaced,
 * in that order, round after round until a round changes nothing. Every pass
 * visits candidates deepest first, so nested expressions are folded before
 * the expressions that contain them.</p>
 *
 * <p>Errors in the contract, such as a division by zero between literals,
 * abort the run. A folder holds no per-module state and may be reused.</p>
 */
public final class ConstantFolder {

	private static final Logger logger = LoggerFactory.getLogger(ConstantFolder.class);

	private static final NodeQuery LITERAL_OPS = NodeQuery
			.ofType(BoolOpNode.class, BinOpNode.class, UnaryOpNode.class, CompareNode.class)
			.reverse();

	private final BuiltinConstants constants;
	private final BuiltinRegistry registry;

	public ConstantFolder(BuiltinConstants constants, BuiltinRegistry registry) {
		this.constants = Objects.requireNonNull(constants, "constants must not be null");
		this.registry = Objects.requireNonNull(registry, "registry must not be null");
	}

	/**
	 * A folder using the standard builtin constants and builtin functions.
	 */
	public static ConstantFolder withDefaults() {
		return new ConstantFolder(BuiltinConstants.standard(), DispatchTable.standard());
	}

	/**
	 * Fold {@code module} in place.
	 *
	 * @throws UnfoldableConstantException if a constant declaration does not reduce to a literal
	 * @throws org.javai.srilang.exceptions.SrilangException for other errors in the contract
	 */
	public FoldingReport fold(ModuleNode module) {
		Objects.requireNonNull(module, "module must not be null");
		int builtinSubstitutions = replaceBuiltinConstants(module);

		List<Integer> rounds = new ArrayList<>();
		int changed;
		do {
			int constantsReplaced = replaceUserDefinedConstants(module);
			int opsReplaced = replaceLiteralOps(module);
			int subscriptsReplaced = replaceSubscripts(module);
			int callsReplaced = replaceBuiltinFunctionCalls(module);
			changed = constantsReplaced + opsReplaced + subscriptsReplaced + callsReplaced;
			rounds.add(changed);
			logger.debug("Folding round {}: {} constant(s), {} operation(s), {} subscript(s), {} call(s)",
					rounds.size(), constantsReplaced, opsReplaced, subscriptsReplaced, callsReplaced);
		}
		while (changed > 0);

		verifyConstantDeclarations(module);
		FoldingReport report = new FoldingReport(builtinSubstitutions, rounds);
		logger.debug("Folding finished after {} round(s) with {} substitution(s)", report.rounds(),
				report.totalSubstitutions());
		return report;
	}

	/**
	 * Replace every reference to a builtin constant.
	 *
	 * @return number of references replaced
	 */
	public int replaceBuiltinConstants(ModuleNode module) {
		int changed = 0;
		for (Map.Entry<String, ConstantNode<?>> entry : constants.templates().entrySet()) {
			changed += replaceConstant(module, entry.getKey(), entry.getValue(), true);
		}
		return changed;
	}

	/**
	 * Replace references to module-level {@code NAME: constant(type) = value}
	 * declarations whose value is already a literal.
	 *
	 * @return number of references replaced
	 */
	public int replaceUserDefinedConstants(ModuleNode module) {
		int changed = 0;
		for (AnnAssignNode declaration : module.getChildren(AnnAssignNode.class)) {
			if (!declaration.isConstantDeclaration()) {
				continue;
			}
			String name = ((NameNode) declaration.target()).id();
			changed += replaceConstant(module, name, declaration.value(), false);
		}
		return changed;
	}

	/**
	 * Evaluate unary, binary, boolean and comparison operations between literals.
	 *
	 * @return number of operations replaced
	 */
	public int replaceLiteralOps(ModuleNode module) {
		return replaceEvaluated(module, module.getDescendants(LITERAL_OPS));
	}

	/**
	 * Evaluate indexing into literal lists.
	 *
	 * @return number of subscripts replaced
	 */
	public int replaceSubscripts(ModuleNode module) {
		return replaceEvaluated(module, module.getDescendants(NodeQuery.ofType(SubscriptNode.class).reverse()));
	}

	/**
	 * Evaluate calls to foldable builtins whose arguments are literals.
	 *
	 * @return number of calls replaced
	 */
	public int replaceBuiltinFunctionCalls(ModuleNode module) {
		int changed = 0;
		for (SriNode node : module.getDescendants(NodeQuery.ofType(CallNode.class).reverse())) {
			CallNode call = (CallNode) node;
			String name = call.calleeName();
			if (name == null || !isAttached(module, call)) {
				continue;
			}
			Optional<FoldableBuiltin> builtin = registry.lookupFoldable(name);
			if (builtin.isEmpty()) {
				continue;
			}
			if (replaceIfFolded(module, call, builtin.get().evaluate(call))) {
				changed++;
			}
		}
		return changed;
	}

	/**
	 * Replace references to the name {@code id} with copies of {@code replacement}.
	 *
	 * <p>Attribute bases ({@code id.x}), callees ({@code id(...)}), dict keys and
	 * assignment targets are left alone, except that a name used as an index
	 * inside an assignment target ({@code a[id] = ...}) is replaced.</p>
	 *
	 * @param replacement a literal or a list of literals
	 * @param raiseOnError whether a non-literal replacement is an error rather than a no-op
	 * @return number of references replaced
	 * @throws UnfoldableConstantException if {@code raiseOnError} is set and
	 *         {@code replacement} is not a literal
	 */
	public static int replaceConstant(ModuleNode module, String id, SriNode replacement, boolean raiseOnError) {
		Objects.requireNonNull(module, "module must not be null");
		Objects.requireNonNull(id, "id must not be null");
		int changed = 0;
		for (SriNode node : module.getDescendants(NodeQuery.ofType(NameNode.class).where("id", id).reverse())) {
			if (isProtectedReference(node) || !isAttached(module, node)) {
				continue;
			}
			Optional<SriNode> copy = Literals.copyAt(replacement, node);
			if (copy.isEmpty()) {
				if (raiseOnError) {
					throw new UnfoldableConstantException("Value of '" + id + "' is not a literal",
							replacement != null ? replacement : node);
				}
				continue;
			}
			module.replaceInTree(node, copy.get());
			logger.trace("Replaced {} with {}", node, copy.get());
			changed++;
		}
		return changed;
	}

	/**
	 * Check that every constant declaration has been reduced to a literal.
	 *
	 * @throws UnfoldableConstantException at the first initializer that was not
	 */
	public static void verifyConstantDeclarations(ModuleNode module) {
		for (AnnAssignNode declaration : module.getChildren(AnnAssignNode.class)) {
			if (declaration.isConstantDeclaration() && !Literals.isLiteral(declaration.value())) {
				String name = ((NameNode) declaration.target()).id();
				SriNode at = declaration.value() != null ? declaration.value() : declaration;
				throw new UnfoldableConstantException("Value of constant '" + name + "' must be a literal", at);
			}
		}
	}

	private static boolean isProtectedReference(SriNode node) {
		SriNode parent = node.getAncestor();
		if (parent instanceof AttributeNode) {
			return true;
		}
		if (parent instanceof CallNode call && call.func() == node) {
			return true;
		}
		if (parent instanceof DictNode dict && dict.keys().contains(node)) {
			return true;
		}
		if (parent instanceof IndexNode) {
			return false;
		}
		SriNode assignment = node.getAncestor(AssignNode.class, AnnAssignNode.class, AugAssignNode.class);
		if (assignment == null) {
			return false;
		}
		SriNode target = (SriNode) assignment.attribute("target");
		return target != null && target.getDescendants(NodeQuery.any().includeSelf()).contains(node);
	}

	// false once the node, or a subtree holding it, has been replaced in this pass
	private static boolean isAttached(ModuleNode module, SriNode node) {
		SriNode current = node;
		while (current.getAncestor() != null) {
			current = current.getAncestor();
		}
		return current == module;
	}

	private int replaceEvaluated(ModuleNode module, List<SriNode> candidates) {
		int changed = 0;
		for (SriNode node : candidates) {
			if (!isAttached(module, node)) {
				continue;
			}
			if (replaceIfFolded(module, node, node.evaluate())) {
				changed++;
			}
		}
		return changed;
	}

	private static boolean replaceIfFolded(ModuleNode module, SriNode node, FoldResult result) {
		if (result instanceof FoldResult.Folded folded) {
			module.replaceInTree(node, folded.node());
			logger.trace("Folded {} into {}", node, folded.node());
			return true;
		}
		return false;
	}
}
