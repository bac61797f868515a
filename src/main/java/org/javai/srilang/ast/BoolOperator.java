package org.javai.srilang.ast;

import java.util.List;
import java.util.Optional;

public enum BoolOperator implements OperatorTag {

	AND("And", "logical conjunction") {
		@Override
		public boolean apply(List<Boolean> values) {
			return values.stream().allMatch(Boolean::booleanValue);
		}
	},
	OR("Or", "logical disjunction") {
		@Override
		public boolean apply(List<Boolean> values) {
			return values.stream().anyMatch(Boolean::booleanValue);
		}
	};

	private final String astType;
	private final String description;

	BoolOperator(String astType, String description) {
		this.astType = astType;
		this.description = description;
	}

	/**
	 * Combine already evaluated operands.
	 */
	public abstract boolean apply(List<Boolean> values);

	@Override
	public String astType() {
		return astType;
	}

	@Override
	public String description() {
		return description;
	}

	public static Optional<BoolOperator> fromAstType(String astType) {
		for (BoolOperator op : values()) {
			if (op.astType.equals(astType)) {
				return Optional.of(op);
			}
		}
		return Optional.empty();
	}
}
