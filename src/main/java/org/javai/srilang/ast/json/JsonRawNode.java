package org.javai.srilang.ast.json;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import org.javai.srilang.ast.RawNode;
import org.javai.srilang.ast.SourceSpan;

/**
 * A {@link RawNode} view of one JSON object in a dict-of-fields tree.
 */
final class JsonRawNode implements RawNode {

	static final String AST_TYPE = "ast_type";
	static final String NODE_ID = "node_id";

	private static final Set<String> NON_FIELD_KEYS = Set.of(AST_TYPE, NODE_ID, "lineno", "col_offset",
			"end_lineno", "end_col_offset", "src", "full_source_code", "node_source_code");

	private final ObjectNode json;

	JsonRawNode(ObjectNode json) {
		this.json = Objects.requireNonNull(json, "json must not be null");
	}

	@Override
	public String astType() {
		JsonNode type = json.get(AST_TYPE);
		return type == null || type.isNull() ? null : type.asText();
	}

	@Override
	public SourceSpan span() {
		return new SourceSpan(
				intOrNull("lineno"),
				intOrNull("col_offset"),
				intOrNull("end_lineno"),
				intOrNull("end_col_offset"),
				textOrNull("src"),
				textOrNull("full_source_code"),
				textOrNull("node_source_code"));
	}

	@Override
	public List<String> fieldNames() {
		List<String> names = new ArrayList<>();
		Iterator<String> it = json.fieldNames();
		while (it.hasNext()) {
			String name = it.next();
			if (!NON_FIELD_KEYS.contains(name)) {
				names.add(name);
			}
		}
		return names;
	}

	@Override
	public Object get(String fieldName) {
		return convert(json.get(fieldName));
	}

	static Object convert(JsonNode value) {
		if (value == null || value.isNull() || value.isMissingNode()) {
			return null;
		}
		if (value.isObject()) {
			return new JsonRawNode((ObjectNode) value);
		}
		if (value.isArray()) {
			List<Object> items = new ArrayList<>(value.size());
			for (JsonNode item : value) {
				items.add(convert(item));
			}
			return items;
		}
		if (value.isIntegralNumber()) {
			return value.bigIntegerValue();
		}
		if (value.isNumber()) {
			return value.decimalValue();
		}
		if (value.isBoolean()) {
			return value.booleanValue();
		}
		return value.asText();
	}

	private Integer intOrNull(String key) {
		JsonNode value = json.get(key);
		return value == null || !value.canConvertToInt() ? null : value.intValue();
	}

	private String textOrNull(String key) {
		JsonNode value = json.get(key);
		return value == null || value.isNull() ? null : value.asText();
	}
}
