package org.javai.srilang.ast;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.javai.srilang.testsupport.Ast.binOp;
import static org.javai.srilang.testsupport.Ast.call;
import static org.javai.srilang.testsupport.Ast.constant;
import static org.javai.srilang.testsupport.Ast.decimal;
import static org.javai.srilang.testsupport.Ast.expr;
import static org.javai.srilang.testsupport.Ast.expression;
import static org.javai.srilang.testsupport.Ast.list;
import static org.javai.srilang.testsupport.Ast.moduleOf;
import static org.javai.srilang.testsupport.Ast.name;
import static org.javai.srilang.testsupport.Ast.num;
import static org.javai.srilang.testsupport.Ast.str;
import java.math.BigInteger;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import org.javai.srilang.testsupport.TreeAssertions;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("SriNode")
class SriNodeTest {

	@Nested
	@DisplayName("identity")
	class Identity {

		@Test
		@DisplayName("assigns distinct ids to every node")
		void distinctIds() {
			ModuleNode module = moduleOf(expr(binOp(num(1), "Add", num(2))), expr(name("x")));

			Set<Long> ids = new HashSet<>();
			for (SriNode node : module.getDescendants(NodeQuery.any().includeSelf())) {
				ids.add(node.nodeId());
			}

			assertThat(ids).hasSize(module.getDescendants().size() + 1);
		}

		@Test
		@DisplayName("equality follows identity, not value")
		void equalityIsIdentity() {
			SriNode first = expression(num(5));
			SriNode second = expression(num(5));

			assertThat(first).isNotEqualTo(second);
			assertThat(first).isEqualTo(first);
			assertThat(first.structurallyEquals(second)).isTrue();
		}

		@Test
		@DisplayName("hash code does not change when the tree is rewritten")
		void hashIsStable() {
			ModuleNode module = moduleOf(expr(binOp(num(1), "Add", num(2))));
			BinOpNode op = module.getDescendants(BinOpNode.class).get(0);
			SriNode left = op.left();
			int before = op.hashCode();
			Set<SriNode> seen = new HashSet<>(Set.of(op));

			module.replaceInTree(left, IntNode.from(left, 7));

			assertThat(op.hashCode()).isEqualTo(before);
			assertThat(seen).contains(op);
		}
	}

	@Nested
	@DisplayName("structure")
	class Structure {

		@Test
		@DisplayName("computes depth from the root")
		void depth() {
			ModuleNode module = moduleOf(expr(binOp(num(1), "Add", num(2))));

			assertThat(module.depth()).isZero();
			assertThat(module.body().get(0).depth()).isEqualTo(1);
			assertThat(module.getDescendants(IntNode.class)).allMatch(n -> n.depth() == 3);
			TreeAssertions.assertOwnershipConsistent(module);
			TreeAssertions.assertDepthsConsistent(module);
		}

		@Test
		@DisplayName("finds the closest ancestor of a given variant")
		void ancestors() {
			ModuleNode module = moduleOf(expr(call("foo", binOp(num(1), "Add", num(2)))));
			IntNode one = module.getDescendants(IntNode.class).get(0);

			assertThat(one.getAncestor()).isInstanceOf(BinOpNode.class);
			assertThat(one.getAncestor(CallNode.class)).isInstanceOf(CallNode.class);
			assertThat(one.getAncestor(ModuleNode.class)).isSameAs(module);
			assertThat(one.getAncestor(ListNode.class)).isNull();
			assertThat(module.getAncestor()).isNull();
		}

		@Test
		@DisplayName("lists the fields of each variant, including shared ones")
		void fields() {
			assertThat(NodeTypes.fieldsOf(IntNode.class)).containsExactly("value");
			assertThat(NodeTypes.fieldsOf(ModuleNode.class)).containsExactly("body", "name", "doc_string");
			assertThat(NodeTypes.fieldsOf(FunctionDefNode.class))
					.containsExactly("body", "name", "doc_string", "args", "returns", "decorator_list", "pos");
			assertThat(NodeTypes.fieldsOf(CompareNode.class)).containsExactly("left", "op", "right");
		}
	}

	@Nested
	@DisplayName("attribute access")
	class AttributeAccess {

		@Test
		@DisplayName("resolves dotted paths")
		void dottedPath() {
			ModuleNode module = moduleOf(constant("FEE", "int128", num(5)));
			AnnAssignNode declaration = module.getChildren(AnnAssignNode.class).get(0);

			assertThat(declaration.get("annotation.func.id")).isEqualTo("constant");
			assertThat(declaration.get("target.id")).isEqualTo("FEE");
			assertThat(declaration.get("value.value")).isEqualTo(BigInteger.valueOf(5));
			assertThat(declaration.get("ast_type")).isEqualTo("AnnAssign");
		}

		@Test
		@DisplayName("returns null for a missing segment")
		void missingSegment() {
			SriNode node = expression(name("x"));

			assertThat(node.get("id.something")).isNull();
			assertThat(node.get("nope")).isNull();
			assertThat(node.get("value.value")).isNull();
		}

		@Test
		@DisplayName("exposes sequence fields read-only")
		void readOnlySequences() {
			SriNode node = expression(list(num(1), num(2)));

			Object elements = node.attribute("elts");

			assertThat(elements).isInstanceOf(List.class);
			assertThatThrownBy(() -> ((List<?>) elements).clear())
					.isInstanceOf(UnsupportedOperationException.class);
		}
	}

	@Nested
	@DisplayName("structural equality")
	class StructuralEquality {

		@Test
		@DisplayName("ignores ids and positions")
		void ignoresIdentity() {
			SriNode left = expression(binOp(num(1), "Add", str("a")));
			SriNode right = expression(binOp(num(1), "Add", str("a")));

			assertThat(SriNode.structurallyEqual(left, right)).isTrue();
		}

		@Test
		@DisplayName("distinguishes values, operators and variants")
		void distinguishes() {
			SriNode base = expression(binOp(num(1), "Add", num(2)));

			assertThat(base.structurallyEquals(expression(binOp(num(1), "Add", num(3))))).isFalse();
			assertThat(base.structurallyEquals(expression(binOp(num(1), "Sub", num(2))))).isFalse();
			assertThat(expression(list(num(1))).structurallyEquals(expression(list(num(1), num(1))))).isFalse();
			assertThat(expression(num(1)).structurallyEquals(expression(name("x")))).isFalse();
		}

		@Test
		@DisplayName("compares decimals numerically")
		void decimals() {
			SriNode left = expression(decimal("1.50"));
			SriNode right = expression(decimal("1.5"));

			assertThat(left.structurallyEquals(right)).isTrue();
		}
	}

	@Test
	@DisplayName("variants without an evaluation rule are unfoldable")
	void defaultEvaluation() {
		SriNode node = expression(name("x"));

		FoldResult result = node.evaluate();

		assertThat(result).isInstanceOf(FoldResult.Unfoldable.class);
		assertThat(((FoldResult.Unfoldable) result).reason()).contains("Name");
	}

	@Test
	@DisplayName("describes operations by their operator")
	void description() {
		assertThat(expression(binOp(num(1), "Mod", num(2))).description()).isEqualTo("modulus");
		assertThat(expression(name("x")).description()).isEqualTo("Name");
	}
}
