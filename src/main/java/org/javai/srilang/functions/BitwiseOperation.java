package org.javai.srilang.functions;

import java.math.BigInteger;
import java.util.List;
import java.util.Objects;
import java.util.function.BinaryOperator;
import org.javai.srilang.ast.CallNode;
import org.javai.srilang.ast.FoldResult;
import org.javai.srilang.ast.IntNode;
import org.javai.srilang.ast.SriNode;

/**
 * {@code bitwise_and}, {@code bitwise_or} and {@code bitwise_xor} on uint256 literals.
 */
final class BitwiseOperation implements FoldableBuiltin {

	static final BitwiseOperation AND = new BitwiseOperation("bitwise_and", BigInteger::and);
	static final BitwiseOperation OR = new BitwiseOperation("bitwise_or", BigInteger::or);
	static final BitwiseOperation XOR = new BitwiseOperation("bitwise_xor", BigInteger::xor);

	private final String name;
	private final BinaryOperator<BigInteger> operation;

	private BitwiseOperation(String name, BinaryOperator<BigInteger> operation) {
		this.name = Objects.requireNonNull(name, "name must not be null");
		this.operation = Objects.requireNonNull(operation, "operation must not be null");
	}

	@Override
	public String name() {
		return name;
	}

	@Override
	public FoldResult evaluate(CallNode call) {
		List<SriNode> args = CallArguments.require(call, name, 2);
		if (!(args.get(0) instanceof IntNode left) || !(args.get(1) instanceof IntNode right)) {
			return FoldResult.unfoldable(name + " arguments are not integer literals");
		}
		BigInteger a = CallArguments.uint256(left.value(), left);
		BigInteger b = CallArguments.uint256(right.value(), right);
		return FoldResult.folded(IntNode.from(call, operation.apply(a, b)));
	}
}
