package org.javai.srilang.functions;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.javai.srilang.ast.CallNode;
import org.javai.srilang.ast.DecimalNode;
import org.javai.srilang.ast.FoldResult;
import org.javai.srilang.ast.IntNode;
import org.javai.srilang.ast.SriNode;
import org.javai.srilang.ast.StrNode;
import org.javai.srilang.exceptions.ArgumentException;
import org.javai.srilang.exceptions.InvalidLiteralException;

/**
 * {@code as_wei_value(value, denomination)}: convert an amount of ether in the
 * named denomination to wei. Fractions of a wei are truncated.
 */
final class AsWeiValue implements FoldableBuiltin {

	static final String NAME = "as_wei_value";

	private static final BigInteger DECIMAL_CEILING = BigInteger.ONE.shiftLeft(127);

	private static final Map<String, BigInteger> DENOMINATIONS = denominations();

	@Override
	public String name() {
		return NAME;
	}

	@Override
	public FoldResult evaluate(CallNode call) {
		List<SriNode> args = CallArguments.require(call, NAME, 2);
		BigInteger multiplier = denomination(args.get(1));

		SriNode amount = args.get(0);
		BigDecimal value;
		if (amount instanceof IntNode integer) {
			if (integer.value().compareTo(CallArguments.UINT256_CEILING) >= 0) {
				throw new InvalidLiteralException("Value out of range for uint256", amount);
			}
			value = new BigDecimal(integer.value());
		}
		else if (amount instanceof DecimalNode decimal) {
			if (decimal.value().compareTo(new BigDecimal(DECIMAL_CEILING)) >= 0) {
				throw new InvalidLiteralException("Value out of range for decimal", amount);
			}
			value = decimal.value();
		}
		else {
			return FoldResult.unfoldable("as_wei_value amount is not a numeric literal");
		}
		if (value.signum() < 0) {
			throw new InvalidLiteralException("Negative wei value not allowed", amount);
		}
		BigInteger wei = value.multiply(new BigDecimal(multiplier)).toBigInteger();
		return FoldResult.folded(IntNode.from(call, wei));
	}

	private static BigInteger denomination(SriNode node) {
		if (!(node instanceof StrNode str)) {
			throw new ArgumentException("Wei denomination must be given as a literal string", node);
		}
		return Optional.ofNullable(DENOMINATIONS.get(str.value()))
				.orElseThrow(() -> new ArgumentException("Unknown denomination: " + str.value(), node));
	}

	private static Map<String, BigInteger> denominations() {
		Map<String, BigInteger> table = new LinkedHashMap<>();
		register(table, 0, "wei");
		register(table, 3, "femtoether", "kwei", "babbage");
		register(table, 6, "picoether", "mwei", "lovelace");
		register(table, 9, "nanoether", "gwei", "shannon");
		register(table, 12, "microether", "szabo");
		register(table, 15, "milliether", "finney");
		register(table, 18, "ether");
		register(table, 21, "kether", "grand");
		return Map.copyOf(table);
	}

	private static void register(Map<String, BigInteger> table, int exponent, String... names) {
		for (String name : names) {
			table.put(name, BigInteger.TEN.pow(exponent));
		}
	}
}
