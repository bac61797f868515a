package org.javai.srilang.functions;

import java.math.BigInteger;
import java.util.List;
import java.util.Objects;
import java.util.function.BinaryOperator;
import org.javai.srilang.ast.CallNode;
import org.javai.srilang.ast.FoldResult;
import org.javai.srilang.ast.IntNode;
import org.javai.srilang.ast.SriNode;
import org.javai.srilang.exceptions.ZeroDivisionException;

/**
 * {@code uint256_addmod(a, b, c)} and {@code uint256_mulmod(a, b, c)}. The
 * intermediate sum or product is not truncated to 256 bits.
 */
final class ModularArithmetic implements FoldableBuiltin {

	static final ModularArithmetic ADDMOD = new ModularArithmetic("uint256_addmod", BigInteger::add);
	static final ModularArithmetic MULMOD = new ModularArithmetic("uint256_mulmod", BigInteger::multiply);

	private final String name;
	private final BinaryOperator<BigInteger> operation;

	private ModularArithmetic(String name, BinaryOperator<BigInteger> operation) {
		this.name = Objects.requireNonNull(name, "name must not be null");
		this.operation = Objects.requireNonNull(operation, "operation must not be null");
	}

	@Override
	public String name() {
		return name;
	}

	@Override
	public FoldResult evaluate(CallNode call) {
		List<SriNode> args = CallArguments.require(call, name, 3);
		BigInteger[] values = new BigInteger[3];
		for (int i = 0; i < 3; i++) {
			if (!(args.get(i) instanceof IntNode integer)) {
				return FoldResult.unfoldable(name + " arguments are not integer literals");
			}
			values[i] = CallArguments.uint256(integer.value(), integer);
		}
		if (values[2].signum() == 0) {
			throw new ZeroDivisionException("Modulo by 0", call);
		}
		return FoldResult.folded(IntNode.from(call, operation.apply(values[0], values[1]).mod(values[2])));
	}
}
