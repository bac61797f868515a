package org.javai.srilang.functions;

import java.math.BigInteger;
import java.util.List;
import org.javai.srilang.ast.CallNode;
import org.javai.srilang.ast.KeywordNode;
import org.javai.srilang.ast.SriNode;
import org.javai.srilang.exceptions.ArgumentException;
import org.javai.srilang.exceptions.InvalidLiteralException;

/**
 * Argument checks shared by the foldable builtins.
 */
final class CallArguments {

	static final BigInteger UINT256_CEILING = BigInteger.ONE.shiftLeft(256);

	private CallArguments() {
	}

	/**
	 * Check that {@code call} has exactly {@code count} positional arguments and no keywords.
	 *
	 * @return the positional arguments
	 * @throws ArgumentException otherwise
	 */
	static List<SriNode> require(CallNode call, String name, int count) {
		List<SriNode> args = call.args();
		if (args.size() != count) {
			throw new ArgumentException("Invalid argument count for call to '" + name + "': expected " + count
					+ ", got " + args.size(), call);
		}
		if (!call.keywords().isEmpty()) {
			SriNode keyword = call.keywords().get(0);
			String keywordName = keyword instanceof KeywordNode k ? k.arg() : keyword.astType();
			throw new ArgumentException("Invalid keyword argument '" + keywordName + "' for call to '" + name + "'",
					keyword);
		}
		return args;
	}

	/**
	 * @throws InvalidLiteralException if {@code value} does not fit an unsigned 256-bit word
	 */
	static BigInteger uint256(BigInteger value, SriNode at) {
		if (value.signum() < 0 || value.compareTo(UINT256_CEILING) >= 0) {
			throw new InvalidLiteralException("Value out of range for uint256", at);
		}
		return value;
	}
}
