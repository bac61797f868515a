package org.javai.srilang.ast;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.math.RoundingMode;
import java.util.Optional;
import org.javai.srilang.exceptions.TypeMismatchException;
import org.javai.srilang.exceptions.ZeroDivisionException;

/**
 * Arithmetic operators, with the literal semantics of the target machine:
 * division truncates toward zero, modulo takes the sign of the dividend and
 * decimal results are truncated to {@value #DECIMAL_PLACES} fractional digits.
 */
public enum BinaryOperator implements OperatorTag {

	ADD("Add", "addition") {
		@Override
		public BigInteger applyInteger(BigInteger left, BigInteger right, SriNode at) {
			return left.add(right);
		}

		@Override
		public BigDecimal applyDecimal(BigDecimal left, BigDecimal right, SriNode at) {
			return left.add(right);
		}
	},
	SUB("Sub", "subtraction") {
		@Override
		public BigInteger applyInteger(BigInteger left, BigInteger right, SriNode at) {
			return left.subtract(right);
		}

		@Override
		public BigDecimal applyDecimal(BigDecimal left, BigDecimal right, SriNode at) {
			return left.subtract(right);
		}
	},
	MULT("Mult", "multiplication") {
		@Override
		public BigInteger applyInteger(BigInteger left, BigInteger right, SriNode at) {
			return left.multiply(right);
		}

		@Override
		public BigDecimal applyDecimal(BigDecimal left, BigDecimal right, SriNode at) {
			return left.multiply(right).setScale(DECIMAL_PLACES, RoundingMode.DOWN);
		}
	},
	DIV("Div", "division") {
		@Override
		public BigInteger applyInteger(BigInteger left, BigInteger right, SriNode at) {
			if (right.signum() == 0) {
				throw new ZeroDivisionException("Division by zero", at);
			}
			// BigInteger division truncates toward zero, as the target machine does
			return left.divide(right);
		}

		@Override
		public BigDecimal applyDecimal(BigDecimal left, BigDecimal right, SriNode at) {
			if (right.signum() == 0) {
				throw new ZeroDivisionException("Division by zero", at);
			}
			return left.divide(right, DECIMAL_PLACES, RoundingMode.DOWN);
		}
	},
	MOD("Mod", "modulus") {
		@Override
		public BigInteger applyInteger(BigInteger left, BigInteger right, SriNode at) {
			if (right.signum() == 0) {
				throw new ZeroDivisionException("Modulo by zero", at);
			}
			BigInteger value = left.abs().mod(right.abs());
			return left.signum() < 0 ? value.negate() : value;
		}

		@Override
		public BigDecimal applyDecimal(BigDecimal left, BigDecimal right, SriNode at) {
			if (right.signum() == 0) {
				throw new ZeroDivisionException("Modulo by zero", at);
			}
			BigDecimal value = left.abs().remainder(right.abs());
			return left.signum() < 0 ? value.negate() : value;
		}
	},
	POW("Pow", "exponentiation") {
		@Override
		public BigInteger applyInteger(BigInteger left, BigInteger right, SriNode at) {
			if (right.signum() < 0) {
				return negativePower(left, right, at);
			}
			if (left.abs().compareTo(BigInteger.ONE) <= 0) {
				// 0, 1 and -1 never grow
				if (right.signum() == 0) {
					return BigInteger.ONE;
				}
				return left.signum() < 0 && right.testBit(0) ? left : left.abs();
			}
			if (right.bitLength() > 31) {
				return null;
			}
			return left.pow(right.intValueExact());
		}

		@Override
		public BigDecimal applyDecimal(BigDecimal left, BigDecimal right, SriNode at) {
			throw new TypeMismatchException("Cannot perform exponentiation on decimal values.", at);
		}
	};

	/**
	 * Fractional digits kept by the fixed-point decimal type.
	 */
	public static final int DECIMAL_PLACES = 10;

	private final String astType;
	private final String description;

	BinaryOperator(String astType, String description) {
		this.astType = astType;
		this.description = description;
	}

	/**
	 * Apply the operator to two integer literals.
	 *
	 * @param at node to blame for errors
	 * @return the result, or {@code null} when the exponent is beyond what can be computed
	 */
	public abstract BigInteger applyInteger(BigInteger left, BigInteger right, SriNode at);

	/**
	 * Apply the operator to two fixed-point decimal literals.
	 *
	 * @param at node to blame for errors
	 */
	public abstract BigDecimal applyDecimal(BigDecimal left, BigDecimal right, SriNode at);

	@Override
	public String astType() {
		return astType;
	}

	@Override
	public String description() {
		return description;
	}

	public static Optional<BinaryOperator> fromAstType(String astType) {
		for (BinaryOperator op : values()) {
			if (op.astType.equals(astType)) {
				return Optional.of(op);
			}
		}
		return Optional.empty();
	}

	// a ** -n is 1 / a ** n truncated toward zero
	private static BigInteger negativePower(BigInteger base, BigInteger exponent, SriNode at) {
		if (base.signum() == 0) {
			throw new ZeroDivisionException("Zero cannot be raised to a negative power", at);
		}
		if (base.equals(BigInteger.ONE)) {
			return BigInteger.ONE;
		}
		if (base.equals(BigInteger.ONE.negate())) {
			return exponent.testBit(0) ? base : BigInteger.ONE;
		}
		return BigInteger.ZERO;
	}
}
