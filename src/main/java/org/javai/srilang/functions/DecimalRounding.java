package org.javai.srilang.functions;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.List;
import java.util.Objects;
import org.javai.srilang.ast.CallNode;
import org.javai.srilang.ast.DecimalNode;
import org.javai.srilang.ast.FoldResult;
import org.javai.srilang.ast.IntNode;
import org.javai.srilang.ast.SriNode;

/**
 * {@code floor(x)} and {@code ceil(x)}: round a decimal literal to an integer.
 */
final class DecimalRounding implements FoldableBuiltin {

	static final DecimalRounding FLOOR = new DecimalRounding("floor", RoundingMode.FLOOR);
	static final DecimalRounding CEIL = new DecimalRounding("ceil", RoundingMode.CEILING);

	private final String name;
	private final RoundingMode mode;

	private DecimalRounding(String name, RoundingMode mode) {
		this.name = Objects.requireNonNull(name, "name must not be null");
		this.mode = Objects.requireNonNull(mode, "mode must not be null");
	}

	@Override
	public String name() {
		return name;
	}

	@Override
	public FoldResult evaluate(CallNode call) {
		List<SriNode> args = CallArguments.require(call, name, 1);
		if (!(args.get(0) instanceof DecimalNode decimal)) {
			return FoldResult.unfoldable(name + " argument is not a decimal literal");
		}
		BigDecimal value = decimal.value();
		return FoldResult.folded(IntNode.from(call, value.setScale(0, mode).toBigIntegerExact()));
	}
}
