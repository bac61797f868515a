package org.javai.srilang.functions;

import org.javai.srilang.ast.CallNode;
import org.javai.srilang.ast.FoldResult;

/**
 * A builtin whose calls can be evaluated at compile time when the arguments are literals.
 */
public interface FoldableBuiltin extends BuiltinFunction {

	/**
	 * Evaluate a call to this builtin.
	 *
	 * @return the literal replacing the call, or {@link FoldResult.Unfoldable}
	 *         when an argument is not a literal of a supported kind
	 * @throws org.javai.srilang.exceptions.SrilangException if the call is invalid
	 *         whatever the argument values, e.g. a wrong argument count
	 */
	FoldResult evaluate(CallNode call);
}
