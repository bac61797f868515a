package org.javai.srilang.ast;

import java.util.Optional;

public enum CompareOperator implements OperatorTag {

	EQ("Eq", "equality", false),
	NOT_EQ("NotEq", "non-equality", false),
	LT("Lt", "less than", true),
	LT_E("LtE", "less-or-equal", true),
	GT("Gt", "greater than", true),
	GT_E("GtE", "greater-or-equal", true),
	IN("In", "membership", false);

	private final String astType;
	private final String description;
	private final boolean ordering;

	CompareOperator(String astType, String description, boolean ordering) {
		this.astType = astType;
		this.description = description;
		this.ordering = ordering;
	}

	/**
	 * True for {@code <, <=, >, >=}, which are only defined between numeric literals.
	 */
	public boolean isOrdering() {
		return ordering;
	}

	/**
	 * Interpret the result of a {@code compareTo} call for an ordering operator.
	 */
	public boolean test(int comparison) {
		return switch (this) {
			case LT -> comparison < 0;
			case LT_E -> comparison <= 0;
			case GT -> comparison > 0;
			case GT_E -> comparison >= 0;
			case EQ -> comparison == 0;
			case NOT_EQ -> comparison != 0;
			case IN -> throw new IllegalStateException("Membership is not an ordering comparison");
		};
	}

	@Override
	public String astType() {
		return astType;
	}

	@Override
	public String description() {
		return description;
	}

	public static Optional<CompareOperator> fromAstType(String astType) {
		for (CompareOperator op : values()) {
			if (op.astType.equals(astType)) {
				return Optional.of(op);
			}
		}
		return Optional.empty();
	}
}
