package org.javai.srilang.ast;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.function.BiConsumer;
import java.util.function.BiFunction;
import java.util.function.Function;

/**
 * Static description of one node variant: its dict name, its fields in
 * declaration order (including those of the refinements it extends) and the
 * rules used when converting a raw tree into the variant.
 *
 * @param <N> the Java class of the variant
 */
public final class NodeType<N extends SriNode> {

	/**
	 * A raw field that holds a list but must be stored as a single value.
	 *
	 * @param targetField the variant field receiving the single element
	 * @param errorMessage syntax error raised when the list has more than one element
	 */
	public record SingletonField(String targetField, String errorMessage) {
	}

	private final String astType;
	private final Class<N> javaType;
	private final BiFunction<SriNode, SourceSpan, N> factory;
	private final List<NodeField> fields;
	private final Map<String, NodeField> fieldsByName;
	private final Map<String, String> translatedFields;
	private final Map<String, SingletonField> singletonFields;
	private final Set<String> onlyEmptyFields;
	private final String description;

	private NodeType(Builder<N> builder) {
		this.astType = builder.astType;
		this.javaType = builder.javaType;
		this.factory = builder.factory;
		this.fields = List.copyOf(builder.fields);
		Map<String, NodeField> byName = new LinkedHashMap<>();
		for (NodeField field : fields) {
			if (byName.put(field.name(), field) != null) {
				throw new IllegalStateException("Duplicate field '" + field.name() + "' in " + astType);
			}
		}
		this.fieldsByName = Collections.unmodifiableMap(byName);
		this.translatedFields = Map.copyOf(builder.translatedFields);
		this.singletonFields = Map.copyOf(builder.singletonFields);
		this.onlyEmptyFields = Collections.unmodifiableSet(new LinkedHashSet<>(builder.onlyEmptyFields));
		this.description = builder.description != null ? builder.description : astType;
	}

	public static <N extends SriNode> Builder<N> builder(String astType, Class<N> javaType,
			BiFunction<SriNode, SourceSpan, N> factory) {
		return new Builder<>(astType, javaType, factory);
	}

	public String astType() {
		return astType;
	}

	public Class<N> javaType() {
		return javaType;
	}

	public String description() {
		return description;
	}

	public List<NodeField> fields() {
		return fields;
	}

	/**
	 * Names of every field declared by the variant or a refinement it extends.
	 */
	public List<String> fieldNames() {
		return fields.stream().map(NodeField::name).toList();
	}

	public Optional<NodeField> field(String name) {
		return Optional.ofNullable(fieldsByName.get(name));
	}

	/**
	 * Raw field names that are renamed on conversion, e.g. {@code n -> value}.
	 */
	public Map<String, String> translatedFields() {
		return translatedFields;
	}

	public Map<String, SingletonField> singletonFields() {
		return singletonFields;
	}

	/**
	 * Raw fields that are valid Python but must be empty in srilang.
	 */
	public Set<String> onlyEmptyFields() {
		return onlyEmptyFields;
	}

	N instantiate(SriNode parent, SourceSpan span) {
		return factory.apply(parent, span);
	}

	@Override
	public String toString() {
		return astType;
	}

	public static final class Builder<N extends SriNode> {

		private final String astType;
		private final Class<N> javaType;
		private final BiFunction<SriNode, SourceSpan, N> factory;
		private final List<NodeField> fields = new ArrayList<>();
		private final Map<String, String> translatedFields = new LinkedHashMap<>();
		private final Map<String, SingletonField> singletonFields = new LinkedHashMap<>();
		private final List<String> onlyEmptyFields = new ArrayList<>();
		private String description;

		private Builder(String astType, Class<N> javaType, BiFunction<SriNode, SourceSpan, N> factory) {
			this.astType = Objects.requireNonNull(astType, "astType must not be null");
			this.javaType = Objects.requireNonNull(javaType, "javaType must not be null");
			this.factory = Objects.requireNonNull(factory, "factory must not be null");
		}

		/**
		 * Add fields declared by a refinement this variant extends.
		 */
		public Builder<N> inherit(List<NodeField> inherited) {
			fields.addAll(inherited);
			return this;
		}

		public Builder<N> node(String name, Function<N, SriNode> getter, BiConsumer<N, SriNode> setter) {
			fields.add(NodeField.node(name, javaType, getter, setter));
			return this;
		}

		public Builder<N> nodeList(String name, Function<N, List<SriNode>> list) {
			fields.add(NodeField.nodeList(name, javaType, list));
			return this;
		}

		public Builder<N> value(String name, ValueType valueType, Function<N, Object> getter,
				BiConsumer<N, Object> setter) {
			fields.add(NodeField.value(name, valueType, javaType, getter, setter));
			return this;
		}

		public Builder<N> translate(String rawName, String fieldName) {
			translatedFields.put(rawName, fieldName);
			return this;
		}

		public Builder<N> singleton(String rawName, String fieldName, String errorMessage) {
			singletonFields.put(rawName, new SingletonField(fieldName, errorMessage));
			return this;
		}

		public Builder<N> onlyEmpty(String... rawNames) {
			onlyEmptyFields.addAll(List.of(rawNames));
			return this;
		}

		public Builder<N> description(String description) {
			this.description = description;
			return this;
		}

		public NodeType<N> build() {
			return new NodeType<>(this);
		}
	}
}
