package org.javai.srilang.ast;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.javai.srilang.testsupport.Ast.at;
import static org.javai.srilang.testsupport.Ast.binOp;
import static org.javai.srilang.testsupport.Ast.decimal;
import static org.javai.srilang.testsupport.Ast.expression;
import static org.javai.srilang.testsupport.Ast.name;
import static org.javai.srilang.testsupport.Ast.num;
import static org.javai.srilang.testsupport.Ast.str;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.math.BigDecimal;
import java.math.BigInteger;
import org.javai.srilang.exceptions.TypeMismatchException;
import org.javai.srilang.exceptions.ZeroDivisionException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

@DisplayName("BinOpNode")
class BinOpNodeTest {

	@Nested
	@DisplayName("integer arithmetic")
	class IntegerArithmetic {

		@ParameterizedTest(name = "{0} {1} {2} = {3}")
		@CsvSource({
				"7, Add, 5, 12",
				"7, Sub, 10, -3",
				"-6, Mult, 7, -42",
				"7, Div, 2, 3",
				"-7, Div, 2, -3",
				"7, Div, -2, -3",
				"-7, Div, -2, 3",
				"7, Mod, 3, 1",
				"-7, Mod, 3, -1",
				"7, Mod, -3, 1",
				"-7, Mod, -3, -1",
				"2, Pow, 10, 1024",
				"-3, Pow, 3, -27",
				"5, Pow, 0, 1"
		})
		void folds(long left, String op, long right, long expected) {
			assertThat(foldInteger(num(left), op, num(right))).isEqualTo(BigInteger.valueOf(expected));
		}

		@Test
		@DisplayName("is exact beyond 64 bits")
		void arbitraryPrecision() {
			BigInteger big = BigInteger.TWO.pow(255);

			assertThat(foldInteger(num(big), "Mult", num(2))).isEqualTo(BigInteger.TWO.pow(256));
		}

		@Test
		@DisplayName("negative exponents truncate toward zero")
		void negativeExponent() {
			assertThat(foldInteger(num(2), "Pow", num(-1))).isZero();
			assertThat(foldInteger(num(1), "Pow", num(-5))).isEqualTo(BigInteger.ONE);
			assertThat(foldInteger(num(-1), "Pow", num(-3))).isEqualTo(BigInteger.ONE.negate());
			assertThatThrownBy(() -> fold(num(0), "Pow", num(-1)))
					.isInstanceOf(ZeroDivisionException.class);
		}

		@Test
		@DisplayName("folds powers of any size")
		void largePower() {
			assertThat(foldInteger(num(2), "Pow", num(70_000))).isEqualTo(BigInteger.TWO.pow(70_000));
			assertThat(foldInteger(num(10), "Pow", num(20_000))).isEqualTo(BigInteger.TEN.pow(20_000));
		}

		@Test
		@DisplayName("leaves exponents beyond the int range in place")
		void exponentOutOfRange() {
			FoldResult result = expression(binOp(num(2), "Pow", num(3_000_000_000L))).evaluate();

			assertThat(result).isInstanceOfSatisfying(FoldResult.Unfoldable.class,
					u -> assertThat(u.reason()).isEqualTo("Result of exponentiation is too large to evaluate"));
			assertThat(foldInteger(num(-1), "Pow", num(3_000_000_001L))).isEqualTo(BigInteger.ONE.negate());
		}

		@Test
		@DisplayName("rejects division and modulo by zero")
		void byZero() {
			assertThatThrownBy(() -> fold(num(1), "Div", num(0)))
					.isInstanceOf(ZeroDivisionException.class)
					.hasMessageContaining("Division by zero");
			assertThatThrownBy(() -> fold(num(1), "Mod", num(0)))
					.isInstanceOf(ZeroDivisionException.class)
					.hasMessageContaining("Modulo by zero");
		}
	}

	@Nested
	@DisplayName("decimal arithmetic")
	class DecimalArithmetic {

		@Test
		@DisplayName("adds exactly")
		void add() {
			assertThat(foldDecimal(decimal("0.1"), "Add", decimal("0.2"))).isEqualByComparingTo("0.3");
		}

		@Test
		@DisplayName("truncates division to ten places")
		void divide() {
			assertThat(foldDecimal(decimal("1"), "Div", decimal("3"))).isEqualByComparingTo("0.3333333333");
			assertThat(foldDecimal(decimal("-2"), "Div", decimal("3"))).isEqualByComparingTo("-0.6666666666");
		}

		@Test
		@DisplayName("truncates multiplication to ten places")
		void multiply() {
			assertThat(foldDecimal(decimal("0.00000000015"), "Mult", decimal("0.5"))).isEqualByComparingTo("0");
			assertThat(foldDecimal(decimal("1.5"), "Mult", decimal("-2"))).isEqualByComparingTo("-3");
		}

		@Test
		@DisplayName("modulo takes the sign of the dividend")
		void modulo() {
			assertThat(foldDecimal(decimal("-7.5"), "Mod", decimal("2"))).isEqualByComparingTo("-1.5");
			assertThat(foldDecimal(decimal("7.5"), "Mod", decimal("-2"))).isEqualByComparingTo("1.5");
		}

		@Test
		@DisplayName("rejects exponentiation")
		void power() {
			assertThatThrownBy(() -> fold(decimal("1.5"), "Pow", decimal("2")))
					.isInstanceOf(TypeMismatchException.class)
					.hasMessageContaining("Cannot perform exponentiation on decimal values.");
		}

		@Test
		@DisplayName("rejects division by zero")
		void byZero() {
			assertThatThrownBy(() -> fold(decimal("1.5"), "Div", decimal("0.0")))
					.isInstanceOf(ZeroDivisionException.class);
		}
	}

	@Test
	@DisplayName("leaves mixed or non-literal operands alone")
	void unfoldable() {
		assertThat(expression(binOp(num(1), "Add", decimal("1.0"))).evaluate().isFolded()).isFalse();
		assertThat(expression(binOp(num(1), "Add", name("x"))).evaluate().isFolded()).isFalse();
		assertThat(expression(binOp(str("a"), "Add", str("b"))).evaluate().isFolded()).isFalse();
	}

	@Test
	@DisplayName("the result is positioned at the operation")
	void resultPosition() {
		SriNode op = expression(at(binOp(num(1), "Add", num(2)), 5, 3));

		SriNode result = ((FoldResult.Folded) op.evaluate()).node();

		assertThat(result.span().lineno()).isEqualTo(5);
		assertThat(result.span().colOffset()).isEqualTo(3);
		assertThat(result.getAncestor()).isNull();
	}

	private static SriNode fold(ObjectNode left, String op, ObjectNode right) {
		FoldResult result = expression(binOp(left, op, right)).evaluate();
		assertThat(result).isInstanceOf(FoldResult.Folded.class);
		return ((FoldResult.Folded) result).node();
	}

	private static BigInteger foldInteger(ObjectNode left, String op, ObjectNode right) {
		return ((IntNode) fold(left, op, right)).value();
	}

	private static BigDecimal foldDecimal(ObjectNode left, String op, ObjectNode right) {
		return ((DecimalNode) fold(left, op, right)).value();
	}
}
