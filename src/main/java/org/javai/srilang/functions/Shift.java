package org.javai.srilang.functions;

import java.math.BigInteger;
import java.util.List;
import org.javai.srilang.ast.CallNode;
import org.javai.srilang.ast.FoldResult;
import org.javai.srilang.ast.IntNode;
import org.javai.srilang.ast.SriNode;
import org.javai.srilang.exceptions.InvalidLiteralException;

/**
 * {@code shift(x, n)}: shift a uint256 left for positive {@code n}, right for
 * negative. Bits shifted past the top of the word are lost.
 */
final class Shift implements FoldableBuiltin {

	static final String NAME = "shift";

	private static final int MAX_STEPS = 256;

	@Override
	public String name() {
		return NAME;
	}

	@Override
	public FoldResult evaluate(CallNode call) {
		List<SriNode> args = CallArguments.require(call, NAME, 2);
		if (!(args.get(0) instanceof IntNode value) || !(args.get(1) instanceof IntNode steps)) {
			return FoldResult.unfoldable("shift arguments are not integer literals");
		}
		BigInteger word = CallArguments.uint256(value.value(), value);
		BigInteger distance = steps.value();
		if (distance.abs().compareTo(BigInteger.valueOf(MAX_STEPS)) > 0) {
			throw new InvalidLiteralException("Shift must be between -256 and 256", steps);
		}
		int n = distance.intValueExact();
		BigInteger result = n < 0
				? word.shiftRight(-n)
				: word.shiftLeft(n).mod(CallArguments.UINT256_CEILING);
		return FoldResult.folded(IntNode.from(call, result));
	}
}
