package org.javai.srilang.ast;

import java.util.Optional;

public enum UnaryOperator implements OperatorTag {

	USUB("USub", "negation"),
	NOT("Not", "logical negation");

	private final String astType;
	private final String description;

	UnaryOperator(String astType, String description) {
		this.astType = astType;
		this.description = description;
	}

	@Override
	public String astType() {
		return astType;
	}

	@Override
	public String description() {
		return description;
	}

	public static Optional<UnaryOperator> fromAstType(String astType) {
		for (UnaryOperator op : values()) {
			if (op.astType.equals(astType)) {
				return Optional.of(op);
			}
		}
		return Optional.empty();
	}
}
