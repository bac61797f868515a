package org.javai.srilang.ast.folding;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import java.io.ByteArrayInputStream;
import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import org.javai.srilang.ast.BytesNode;
import org.javai.srilang.ast.ConstantNode;
import org.javai.srilang.ast.DecimalNode;
import org.javai.srilang.ast.HexNode;
import org.javai.srilang.ast.IntNode;
import org.javai.srilang.ast.NameConstantNode;
import org.javai.srilang.ast.StrNode;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("BuiltinConstants")
class BuiltinConstantsTest {

	@Nested
	@DisplayName("standard table")
	class Standard {

		@Test
		@DisplayName("holds the language constants")
		void names() {
			assertThat(BuiltinConstants.standard().names()).containsExactlyInAnyOrder(
					"EMPTY_BYTES32", "ZERO_ADDRESS", "MAX_INT128", "MIN_INT128", "MAX_DECIMAL", "MIN_DECIMAL",
					"MAX_UINT256");
		}

		@Test
		@DisplayName("with the values of the target machine")
		void values() {
			BuiltinConstants constants = BuiltinConstants.standard();

			assertThat(intValue(constants, "MAX_INT128")).isEqualTo(BigInteger.TWO.pow(127).subtract(BigInteger.ONE));
			assertThat(intValue(constants, "MIN_INT128")).isEqualTo(BigInteger.TWO.pow(127).negate());
			assertThat(intValue(constants, "MAX_UINT256")).isEqualTo(BigInteger.TWO.pow(256).subtract(BigInteger.ONE));
			assertThat(((DecimalNode) constants.template("MAX_DECIMAL").orElseThrow()).value())
					.isEqualByComparingTo(BigInteger.TWO.pow(127).subtract(BigInteger.ONE).toString());
			assertThat(((HexNode) constants.template("ZERO_ADDRESS").orElseThrow()).byteLength()).isEqualTo(20);
			assertThat(((HexNode) constants.template("EMPTY_BYTES32").orElseThrow()).byteLength()).isEqualTo(32);
		}

		@Test
		@DisplayName("is loaded once")
		void cached() {
			assertThat(BuiltinConstants.standard()).isSameAs(BuiltinConstants.standard());
		}

		@Test
		@DisplayName("templates are parentless")
		void parentless() {
			assertThat(BuiltinConstants.standard().templates().values()).allMatch(t -> t.getAncestor() == null);
		}
	}

	@Nested
	@DisplayName("custom tables")
	class Custom {

		@Test
		@DisplayName("load every literal kind from a resource")
		void resource() {
			BuiltinConstants constants = BuiltinConstants.fromResource("constants/custom-constants.yml",
					getClass().getClassLoader());

			assertThat(constants.size()).isEqualTo(6);
			assertThat(intValue(constants, "ANSWER")).isEqualTo(42);
			assertThat(((DecimalNode) constants.template("RATE").orElseThrow()).value()).isEqualByComparingTo("0.0125");
			assertThat(((StrNode) constants.template("GREETING").orElseThrow()).value()).isEqualTo("hello");
			assertThat(((BytesNode) constants.template("MAGIC").orElseThrow()).value())
					.isEqualTo("abc".getBytes(StandardCharsets.ISO_8859_1));
			assertThat(((NameConstantNode) constants.template("ENABLED").orElseThrow()).value()).isTrue();
			assertThat(((NameConstantNode) constants.template("NOTHING").orElseThrow()).isBoolean()).isFalse();
			assertThat(constants.template("MAX_INT128")).isEmpty();
		}

		@Test
		@DisplayName("report a missing resource")
		void missing() {
			assertThatThrownBy(() -> BuiltinConstants.fromResource("constants/nope.yml", getClass().getClassLoader()))
					.isInstanceOf(IllegalArgumentException.class)
					.hasMessageContaining("Resource not found: constants/nope.yml");
		}

		@Test
		@DisplayName("report an unknown literal type")
		void unknownType() {
			assertThatThrownBy(() -> BuiltinConstants.fromResource("constants/unknown-type.yml",
					getClass().getClassLoader()))
					.isInstanceOf(IllegalStateException.class)
					.hasMessageContaining("Constant 'BROKEN' has unknown literal type: Float");
		}

		@Test
		@DisplayName("report malformed documents")
		void malformed() {
			assertThatThrownBy(() -> BuiltinConstants.fromYaml(yaml("other: {}")))
					.isInstanceOf(IllegalStateException.class)
					.hasMessageContaining("Missing required 'constants' section");
			assertThatThrownBy(() -> BuiltinConstants.fromYaml(yaml("constants:\n  X: 5\n")))
					.isInstanceOf(IllegalStateException.class)
					.hasMessageContaining("Constant 'X' must be a mapping");
			assertThatThrownBy(() -> BuiltinConstants.fromYaml(yaml("constants:\n  X:\n    type: Int\n    value: \"ten\"\n")))
					.isInstanceOf(IllegalStateException.class)
					.hasMessageContaining("Constant 'X' has an invalid Int value: ten");
			assertThatThrownBy(() -> BuiltinConstants.fromYaml(yaml("constants:\n  X:\n    type: Hex\n    value: \"0xabc\"\n")))
					.isInstanceOf(RuntimeException.class);
		}

		@Test
		@DisplayName("can be empty")
		void empty() {
			assertThat(BuiltinConstants.empty().size()).isZero();
			assertThat(BuiltinConstants.empty().names()).isEmpty();
		}
	}

	private static BigInteger intValue(BuiltinConstants constants, String name) {
		ConstantNode<?> template = constants.template(name).orElseThrow();
		assertThat(template).isInstanceOf(IntNode.class);
		return ((IntNode) template).value();
	}

	private static ByteArrayInputStream yaml(String text) {
		return new ByteArrayInputStream(text.getBytes(StandardCharsets.UTF_8));
	}
}
