package org.javai.srilang.ast;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("NodeTypes")
class NodeTypesTest {

	@Test
	@DisplayName("every variant has a unique dict name")
	void uniqueNames() {
		Set<String> names = new HashSet<>();
		for (NodeType<?> type : NodeTypes.all()) {
			assertThat(names.add(type.astType())).as("duplicate %s", type).isTrue();
			assertThat(NodeTypes.forAstType(type.astType())).contains(type);
		}
	}

	@Test
	@DisplayName("unknown names are absent")
	void unknown() {
		assertThat(NodeTypes.forAstType("Lambda")).isEmpty();
		assertThat(NodeTypes.forAstType("Slice")).isEmpty();
	}

	@Test
	@DisplayName("literal variants share the value field")
	void literalFields() {
		for (Class<? extends SriNode> literal : List.<Class<? extends SriNode>>of(IntNode.class, DecimalNode.class, HexNode.class,
				StrNode.class, BytesNode.class, NameConstantNode.class)) {
			assertThat(NodeTypes.fieldsOf(literal)).as("%s", literal.getSimpleName()).containsExactly("value");
		}
	}

	@Test
	@DisplayName("abstract refinements have no field list of their own")
	void abstractRefinements() {
		assertThatThrownBy(() -> NodeTypes.fieldsOf(NumNode.class))
				.isInstanceOf(IllegalArgumentException.class)
				.hasMessageContaining("NumNode is not a concrete node variant");
	}
}
