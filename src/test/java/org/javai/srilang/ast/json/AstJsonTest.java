package org.javai.srilang.ast.json;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.javai.srilang.testsupport.Ast.bytes;
import static org.javai.srilang.testsupport.Ast.expression;
import static org.javai.srilang.testsupport.Ast.list;
import static org.javai.srilang.testsupport.Ast.num;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.io.IOException;
import java.io.InputStream;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.List;
import java.util.Map;
import org.javai.srilang.ast.AnnAssignNode;
import org.javai.srilang.ast.DecimalNode;
import org.javai.srilang.ast.FunctionDefNode;
import org.javai.srilang.ast.IntNode;
import org.javai.srilang.ast.ModuleNode;
import org.javai.srilang.ast.SriNode;
import org.javai.srilang.testsupport.TreeAssertions;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("AstJson")
class AstJsonTest {

	static ModuleNode loadFixture(String name) {
		try (InputStream in = AstJsonTest.class.getResourceAsStream("/fixtures/" + name)) {
			assertThat(in).as("fixture %s", name).isNotNull();
			return (ModuleNode) AstJson.toNode(AstJson.mapper().readTree(in));
		}
		catch (IOException e) {
			throw new IllegalStateException("Cannot read fixture " + name, e);
		}
	}

	@Nested
	@DisplayName("reading")
	class Reading {

		@Test
		@DisplayName("converts a front-end module")
		void fixture() {
			ModuleNode module = loadFixture("fee_module.json");

			assertThat(module.name()).isEqualTo("fees");
			assertThat(module.body()).hasSize(2);
			assertThat(module.body().get(0)).isInstanceOfSatisfying(AnnAssignNode.class,
					declaration -> assertThat(declaration.isConstantDeclaration()).isTrue());
			assertThat(module.body().get(1)).isInstanceOfSatisfying(FunctionDefNode.class,
					function -> assertThat(function.get("returns.id")).isEqualTo("uint256"));
			TreeAssertions.assertOwnershipConsistent(module);
		}

		@Test
		@DisplayName("carries positions, and the full source down the tree")
		void positions() {
			ModuleNode module = loadFixture("fee_module.json");
			IntNode ten = module.getDescendants(IntNode.class, Map.of("value", 10)).get(0);

			assertThat(ten.span().lineno()).isEqualTo(5);
			assertThat(ten.span().colOffset()).isEqualTo(17);
			assertThat(ten.span().fullSourceCode()).startsWith("FEE: constant(uint256)");
		}

		@Test
		@DisplayName("keeps integers and decimals exact")
		void precision() {
			BigInteger huge = BigInteger.TWO.pow(256).subtract(BigInteger.ONE);

			SriNode integer = AstJson.parse("{\"ast_type\": \"Int\", \"n\": " + huge + "}");
			SriNode decimal = AstJson.parse("{\"ast_type\": \"Decimal\", \"n\": 0.1000000001}");

			assertThat(((IntNode) integer).value()).isEqualTo(huge);
			assertThat(((DecimalNode) decimal).value()).isEqualByComparingTo(new BigDecimal("0.1000000001"));
		}

		@Test
		@DisplayName("converts each element of an array separately")
		void manyTrees() {
			ArrayNode array = AstJson.mapper().createArrayNode().add(num(1)).add(num(2));

			List<SriNode> nodes = AstJson.toNodes(array);

			assertThat(nodes).hasSize(2).allMatch(n -> n.getAncestor() == null);
		}

		@Test
		@DisplayName("rejects malformed input")
		void malformed() {
			assertThatThrownBy(() -> AstJson.parse("{\"ast_type\": "))
					.isInstanceOf(IllegalArgumentException.class)
					.hasMessageStartingWith("Invalid AST JSON");
			assertThatThrownBy(() -> AstJson.parse("[1, 2]"))
					.isInstanceOf(IllegalArgumentException.class)
					.hasMessage("AST node must be a JSON object");
		}
	}

	@Nested
	@DisplayName("writing")
	class Writing {

		@Test
		@DisplayName("exports ids, positions and fields")
		void dict() {
			ModuleNode module = loadFixture("fee_module.json");
			SriNode sum = ((AnnAssignNode) module.body().get(0)).value();

			ObjectNode dict = AstJson.toDict(sum);

			assertThat(dict.get("ast_type").asText()).isEqualTo("BinOp");
			assertThat(dict.get("node_id").asLong()).isEqualTo(sum.nodeId());
			assertThat(dict.get("lineno").asInt()).isEqualTo(1);
			assertThat(dict.get("col_offset").asInt()).isEqualTo(25);
			assertThat(dict.get("op").get("ast_type").asText()).isEqualTo("Add");
			assertThat(dict.get("left").get("value").bigIntegerValue()).isEqualTo(BigInteger.TWO);
			assertThat(dict.has("full_source_code")).isFalse();
		}

		@Test
		@DisplayName("exports sequences and byte strings")
		void sequences() {
			ObjectNode dict = AstJson.toDict(expression(list(num(1), bytes("ÿA"))));

			JsonNode elements = dict.get("elts");
			assertThat(elements.isArray()).isTrue();
			assertThat(elements.size()).isEqualTo(2);
			assertThat(elements.get(1).get("value").asText()).isEqualTo("ÿA");
		}

		@Test
		@DisplayName("exported dicts convert back to an equal tree")
		void roundTrip() {
			ModuleNode module = loadFixture("fee_module.json");

			SriNode copy = AstJson.toNode(AstJson.toDict(module));

			assertThat(copy.structurallyEquals(module)).isTrue();
			assertThat(copy.nodeId()).isNotEqualTo(module.nodeId());
		}
	}
}
