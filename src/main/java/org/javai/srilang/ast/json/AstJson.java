package org.javai.srilang.ast.json;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.javai.srilang.ast.NodeFactory;
import org.javai.srilang.ast.NodeField;
import org.javai.srilang.ast.OperatorTag;
import org.javai.srilang.ast.SourceSpan;
import org.javai.srilang.ast.SriNode;

/**
 * Reads and writes syntax trees in the dict-of-fields JSON form exchanged with
 * the front end.
 *
 * <p>Each node is an object with an {@code ast_type} key, optional span keys
 * and one key per field. Integers and decimals are read without loss of
 * precision.</p>
 *
 * <pre>{@code
 * SriNode module = AstJson.parse("""
 *     {"ast_type": "Module", "body": [ ... ]}
 *     """);
 * ObjectNode dict = AstJson.toDict(module);
 * }</pre>
 */
public final class AstJson {

	private static final ObjectMapper MAPPER = new ObjectMapper()
			.configure(DeserializationFeature.USE_BIG_DECIMAL_FOR_FLOATS, true)
			.configure(DeserializationFeature.USE_BIG_INTEGER_FOR_INTS, true);

	private AstJson() {
	}

	public static ObjectMapper mapper() {
		return MAPPER;
	}

	/**
	 * Parse JSON text and convert it into a typed tree.
	 *
	 * @throws IllegalArgumentException if the text is not a JSON object
	 * @throws org.javai.srilang.exceptions.SyntaxException if the tree contains unsupported constructs
	 */
	public static SriNode parse(String json) {
		Objects.requireNonNull(json, "json must not be null");
		JsonNode tree;
		try {
			tree = MAPPER.readTree(json);
		}
		catch (JsonProcessingException e) {
			throw new IllegalArgumentException("Invalid AST JSON: " + e.getOriginalMessage(), e);
		}
		return toNode(tree);
	}

	public static SriNode toNode(JsonNode json) {
		if (json == null || !json.isObject()) {
			throw new IllegalArgumentException("AST node must be a JSON object");
		}
		return NodeFactory.getNode(new JsonRawNode((ObjectNode) json));
	}

	/**
	 * Convert each element of a JSON array into its own parentless tree.
	 */
	public static List<SriNode> toNodes(ArrayNode json) {
		Objects.requireNonNull(json, "json must not be null");
		List<SriNode> nodes = new ArrayList<>(json.size());
		for (JsonNode item : json) {
			nodes.add(toNode(item));
		}
		return nodes;
	}

	/**
	 * Export a node and its descendants. Full and per-node source text are omitted.
	 */
	public static ObjectNode toDict(SriNode node) {
		Objects.requireNonNull(node, "node must not be null");
		ObjectNode dict = MAPPER.createObjectNode();
		dict.put(JsonRawNode.AST_TYPE, node.astType());
		dict.put(JsonRawNode.NODE_ID, node.nodeId());
		SourceSpan span = node.span();
		dict.put("lineno", span.lineno());
		dict.put("col_offset", span.colOffset());
		dict.put("end_lineno", span.endLineno());
		dict.put("end_col_offset", span.endColOffset());
		dict.put("src", span.src());

		for (NodeField field : node.nodeType().fields()) {
			Object value = field.get(node);
			switch (field.kind()) {
				case NODE -> {
					if (value == null) {
						dict.putNull(field.name());
					}
					else {
						dict.set(field.name(), toDict((SriNode) value));
					}
				}
				case NODE_LIST -> {
					ArrayNode items = dict.putArray(field.name());
					for (Object item : (List<?>) value) {
						items.add(toDict((SriNode) item));
					}
				}
				case VALUE -> putValue(dict, field.name(), value);
			}
		}
		return dict;
	}

	public static ArrayNode toDict(List<? extends SriNode> nodes) {
		ArrayNode array = MAPPER.createArrayNode();
		for (SriNode node : nodes) {
			array.add(toDict(node));
		}
		return array;
	}

	private static void putValue(ObjectNode dict, String name, Object value) {
		if (value == null) {
			dict.putNull(name);
		}
		else if (value instanceof BigInteger integer) {
			dict.put(name, integer);
		}
		else if (value instanceof BigDecimal decimal) {
			dict.put(name, decimal);
		}
		else if (value instanceof Integer number) {
			dict.put(name, number);
		}
		else if (value instanceof Boolean flag) {
			dict.put(name, flag);
		}
		else if (value instanceof byte[] bytes) {
			dict.put(name, new String(bytes, StandardCharsets.ISO_8859_1));
		}
		else if (value instanceof OperatorTag op) {
			dict.putObject(name).put(JsonRawNode.AST_TYPE, op.astType());
		}
		else {
			dict.put(name, value.toString());
		}
	}
}
