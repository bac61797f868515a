package org.javai.srilang.ast;

import static org.assertj.core.api.Assertions.assertThat;
import static org.javai.srilang.testsupport.Ast.bool;
import static org.javai.srilang.testsupport.Ast.boolOp;
import static org.javai.srilang.testsupport.Ast.expression;
import static org.javai.srilang.testsupport.Ast.name;
import static org.javai.srilang.testsupport.Ast.num;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("BoolOpNode")
class BoolOpNodeTest {

	@Test
	@DisplayName("and is true only when every operand is")
	void and() {
		assertThat(fold(boolOp("And", bool(true), bool(true), bool(true)))).isTrue();
		assertThat(fold(boolOp("And", bool(true), bool(false), bool(true)))).isFalse();
	}

	@Test
	@DisplayName("or is true when any operand is")
	void or() {
		assertThat(fold(boolOp("Or", bool(false), bool(false), bool(true)))).isTrue();
		assertThat(fold(boolOp("Or", bool(false), bool(false)))).isFalse();
	}

	@Test
	@DisplayName("needs every operand to be a boolean literal")
	void unfoldable() {
		assertThat(expression(boolOp("And", bool(true), name("x"))).evaluate().isFolded()).isFalse();
		assertThat(expression(boolOp("Or", bool(true), num(1))).evaluate().isFolded()).isFalse();
		assertThat(expression(boolOp("Or", bool(null), bool(true))).evaluate().isFolded()).isFalse();
	}

	private static Boolean fold(ObjectNode op) {
		FoldResult result = expression(op).evaluate();
		return ((NameConstantNode) ((FoldResult.Folded) result).node()).value();
	}
}
