package org.javai.srilang.ast;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;
import org.javai.srilang.exceptions.ErrorLocation;
import org.javai.srilang.exceptions.SyntaxException;

/**
 * Converts a raw parse tree into typed nodes, recursively.
 *
 * <p>A node registers with its parent only after all of its fields have been
 * converted, so a conversion error part way through never leaves a partially
 * built child in the parent's child set.</p>
 */
public final class NodeFactory {

	private NodeFactory() {
	}

	/**
	 * Convert {@code raw} and everything beneath it into a new, parentless tree.
	 *
	 * @throws SyntaxException if the raw tree contains a construct srilang does not support
	 */
	public static SriNode getNode(RawNode raw) {
		return getNode(raw, null);
	}

	static SriNode getNode(RawNode raw, SriNode parent) {
		Objects.requireNonNull(raw, "raw must not be null");
		NodeType<?> type = NodeTypes.forAstType(raw.astType())
				.orElseThrow(() -> unsupported(raw, parent));

		SriNode node = type.instantiate(parent, raw.span());
		for (String rawName : raw.fieldNames()) {
			Object value = raw.get(rawName);
			String fieldName = type.translatedFields().getOrDefault(rawName, rawName);

			NodeType.SingletonField singleton = type.singletonFields().get(rawName);
			if (singleton != null) {
				value = unwrapSingleton(value, singleton, node);
				fieldName = singleton.targetField();
			}

			Optional<NodeField> field = type.field(fieldName);
			if (field.isPresent()) {
				field.get().set(node, convert(field.get(), value, node));
			}
			else if (isPresent(value) && type.onlyEmptyFields().contains(rawName)) {
				throw new SyntaxException("Syntax is valid Python but not valid for srilang\nclass: "
						+ type.astType() + ", field_name: " + rawName, node);
			}
		}
		node.validate();
		node.attachToParent();
		return node;
	}

	private static SyntaxException unsupported(RawNode raw, SriNode parent) {
		String astType = raw.astType();
		ErrorLocation here = location(raw, parent);
		switch (astType == null ? "" : astType) {
			case "Delete":
				return new SyntaxException("Deleting is not supported", here);
			case "Slice":
			case "ExtSlice":
				return new SyntaxException("srilang does not support slicing", here);
			case "UAdd":
				return new SyntaxException("srilang does not support + as a unary operator", ErrorLocation.of(parent));
			case "Invert":
				return new SyntaxException("srilang does not support ~ as a unary operator", ErrorLocation.of(parent));
			default:
				return new SyntaxException("Invalid syntax (unsupported '" + astType + "' Python AST node)", here);
		}
	}

	private static Object unwrapSingleton(Object value, NodeType.SingletonField singleton, SriNode node) {
		if (!(value instanceof List<?> list)) {
			return value;
		}
		if (list.size() > 1) {
			throw new SyntaxException(singleton.errorMessage(), node);
		}
		return list.isEmpty() ? null : list.get(0);
	}

	private static Object convert(NodeField field, Object value, SriNode node) {
		switch (field.kind()) {
			case NODE:
				if (value == null) {
					return null;
				}
				if (value instanceof RawNode raw) {
					return getNode(raw, node);
				}
				throw invalidValue(field, value, node);
			case NODE_LIST:
				List<SriNode> children = new ArrayList<>();
				if (value == null) {
					return children;
				}
				if (!(value instanceof List<?> items)) {
					throw invalidValue(field, value, node);
				}
				for (Object item : items) {
					if (!(item instanceof RawNode raw)) {
						throw invalidValue(field, item, node);
					}
					children.add(getNode(raw, node));
				}
				return children;
			default:
				return convertValue(field, value, node);
		}
	}

	private static Object convertValue(NodeField field, Object value, SriNode node) {
		if (value == null) {
			return null;
		}
		switch (field.valueType()) {
			case INTEGER:
				if (value instanceof BigInteger) {
					return value;
				}
				if (value instanceof Integer || value instanceof Long) {
					return BigInteger.valueOf(((Number) value).longValue());
				}
				break;
			case DECIMAL:
				if (value instanceof BigDecimal) {
					return value;
				}
				if (value instanceof BigInteger integer) {
					return new BigDecimal(integer);
				}
				if (value instanceof String text) {
					try {
						return new BigDecimal(text);
					}
					catch (NumberFormatException e) {
						throw invalidValue(field, value, node);
					}
				}
				break;
			case STRING:
				if (value instanceof String) {
					return value;
				}
				break;
			case BYTES:
				if (value instanceof String text) {
					return text.getBytes(StandardCharsets.ISO_8859_1);
				}
				if (value instanceof byte[] bytes) {
					return bytes.clone();
				}
				break;
			case BOOLEAN:
				if (value instanceof Boolean) {
					return value;
				}
				break;
			case SMALL_INTEGER:
				if (value instanceof Number number) {
					try {
						return new BigDecimal(number.toString()).intValueExact();
					}
					catch (ArithmeticException | NumberFormatException e) {
						throw invalidValue(field, value, node);
					}
				}
				break;
			case UNARY_OPERATOR:
				return operator(value, node, UnaryOperator::fromAstType);
			case BINARY_OPERATOR:
				return operator(value, node, BinaryOperator::fromAstType);
			case BOOL_OPERATOR:
				return operator(value, node, BoolOperator::fromAstType);
			case COMPARE_OPERATOR:
				return operator(value, node, CompareOperator::fromAstType);
		}
		throw invalidValue(field, value, node);
	}

	private static <T extends OperatorTag> T operator(Object value, SriNode node,
			Function<String, Optional<T>> lookup) {
		if (!(value instanceof RawNode raw)) {
			throw new SyntaxException("Invalid operator in " + node.astType(), node);
		}
		return lookup.apply(raw.astType()).orElseThrow(() -> unsupported(raw, node));
	}

	private static SyntaxException invalidValue(NodeField field, Object value, SriNode node) {
		String kind = value == null ? "null" : value.getClass().getSimpleName();
		return new SyntaxException("Invalid value of type " + kind + " for field '" + field.name() + "' of "
				+ node.astType(), node);
	}

	private static ErrorLocation location(RawNode raw, SriNode parent) {
		SourceSpan span = raw.span() == null ? SourceSpan.NONE : raw.span();
		if (parent != null) {
			span = span.inheritFrom(parent.span());
		}
		return new ErrorLocation(span.lineno(), span.colOffset(), span.fullSourceCode());
	}

	// truthiness of a raw value, for fields that must be left empty
	private static boolean isPresent(Object value) {
		if (value == null || Boolean.FALSE.equals(value)) {
			return false;
		}
		if (value instanceof List<?> list) {
			return !list.isEmpty();
		}
		if (value instanceof Map<?, ?> map) {
			return !map.isEmpty();
		}
		if (value instanceof String text) {
			return !text.isEmpty();
		}
		return true;
	}
}
