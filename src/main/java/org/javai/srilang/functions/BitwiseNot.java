package org.javai.srilang.functions;

import java.math.BigInteger;
import org.javai.srilang.ast.CallNode;
import org.javai.srilang.ast.FoldResult;
import org.javai.srilang.ast.IntNode;
import org.javai.srilang.ast.SriNode;

/**
 * {@code bitwise_not(x)}: the 256-bit complement of a uint256 literal.
 */
final class BitwiseNot implements FoldableBuiltin {

	static final String NAME = "bitwise_not";

	private static final BigInteger MAX_UINT256 = CallArguments.UINT256_CEILING.subtract(BigInteger.ONE);

	@Override
	public String name() {
		return NAME;
	}

	@Override
	public FoldResult evaluate(CallNode call) {
		SriNode arg = CallArguments.require(call, NAME, 1).get(0);
		if (!(arg instanceof IntNode integer)) {
			return FoldResult.unfoldable("bitwise_not argument is not an integer literal");
		}
		BigInteger value = CallArguments.uint256(integer.value(), integer);
		return FoldResult.folded(IntNode.from(call, MAX_UINT256.subtract(value)));
	}
}
