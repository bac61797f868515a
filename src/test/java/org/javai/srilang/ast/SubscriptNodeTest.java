package org.javai.srilang.ast;

import static org.assertj.core.api.Assertions.assertThat;
import static org.javai.srilang.testsupport.Ast.expr;
import static org.javai.srilang.testsupport.Ast.list;
import static org.javai.srilang.testsupport.Ast.moduleOf;
import static org.javai.srilang.testsupport.Ast.name;
import static org.javai.srilang.testsupport.Ast.num;
import static org.javai.srilang.testsupport.Ast.str;
import static org.javai.srilang.testsupport.Ast.subscript;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.math.BigInteger;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("SubscriptNode")
class SubscriptNodeTest {

	@Test
	@DisplayName("folds to the indexed element itself")
	void element() {
		ModuleNode module = moduleOf(expr(subscript(list(num(10), num(20), num(30)), num(1))));
		SubscriptNode sub = module.getDescendants(SubscriptNode.class).get(0);
		SriNode twenty = ((ListNode) sub.value()).elements().get(1);

		FoldResult result = sub.evaluate();

		assertThat(result).isInstanceOfSatisfying(FoldResult.Folded.class, folded -> {
			assertThat(folded.node()).isSameAs(twenty);
			assertThat(((IntNode) folded.node()).value()).isEqualTo(BigInteger.valueOf(20));
		});
	}

	@Test
	@DisplayName("indexes nested literal lists")
	void nested() {
		FoldResult result = evaluate(subscript(list(list(num(1)), list(num(2), num(3))), num(1)));

		assertThat(result).isInstanceOfSatisfying(FoldResult.Folded.class,
				folded -> assertThat(folded.node()).isInstanceOf(ListNode.class));
	}

	@Test
	@DisplayName("leaves indexes outside the list alone")
	void outOfRange() {
		assertThat(evaluate(subscript(list(num(10), num(20)), num(2))))
				.isInstanceOfSatisfying(FoldResult.Unfoldable.class,
						u -> assertThat(u.reason()).isEqualTo("Invalid index value"));
		assertThat(evaluate(subscript(list(num(10), num(20)), num(-1))).isFolded()).isFalse();
	}

	@Test
	@DisplayName("leaves non-literal indexes and lists alone")
	void nonLiteral() {
		assertThat(evaluate(subscript(list(num(10)), name("i"))).isFolded()).isFalse();
		assertThat(evaluate(subscript(list(num(10)), str("0"))).isFolded()).isFalse();
		assertThat(evaluate(subscript(name("xs"), num(0))).isFolded()).isFalse();
		assertThat(evaluate(subscript(list(num(10), name("x")), num(0))).isFolded()).isFalse();
	}

	@Test
	@DisplayName("leaves lists of mixed kinds alone")
	void mixedKinds() {
		assertThat(evaluate(subscript(list(num(1), str("a")), num(0))))
				.isInstanceOfSatisfying(FoldResult.Unfoldable.class,
						u -> assertThat(u.reason()).isEqualTo("List contains multiple node types"));
	}

	private static FoldResult evaluate(ObjectNode subscript) {
		return moduleOf(expr(subscript)).getDescendants(SubscriptNode.class).get(0).evaluate();
	}
}
