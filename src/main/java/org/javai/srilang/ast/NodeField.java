package org.javai.srilang.ast;

import java.util.List;
import java.util.Objects;
import java.util.function.BiConsumer;
import java.util.function.Function;

/**
 * Descriptor of one named field of a node variant.
 *
 * <p>A field either owns a single child node, owns an ordered sequence of
 * child nodes, or holds a plain value. Descriptors give generic code
 * (traversal filters, dict export, structural equality, the tree mutator)
 * access to a variant's fields without per-variant special cases.</p>
 */
public final class NodeField {

	public enum Kind {
		NODE,
		NODE_LIST,
		VALUE
	}

	private final String name;
	private final Kind kind;
	private final ValueType valueType;
	private final Function<SriNode, Object> getter;
	private final BiConsumer<SriNode, Object> setter;

	private NodeField(String name, Kind kind, ValueType valueType, Function<SriNode, Object> getter,
			BiConsumer<SriNode, Object> setter) {
		this.name = Objects.requireNonNull(name, "name must not be null");
		this.kind = kind;
		this.valueType = valueType;
		this.getter = getter;
		this.setter = setter;
	}

	static <N extends SriNode> NodeField node(String name, Class<N> owner, Function<N, SriNode> getter,
			BiConsumer<N, SriNode> setter) {
		return new NodeField(name, Kind.NODE, null,
				n -> getter.apply(owner.cast(n)),
				(n, v) -> setter.accept(owner.cast(n), (SriNode) v));
	}

	static <N extends SriNode> NodeField nodeList(String name, Class<N> owner, Function<N, List<SriNode>> list) {
		return new NodeField(name, Kind.NODE_LIST, null,
				n -> list.apply(owner.cast(n)),
				(n, v) -> {
					List<SriNode> target = list.apply(owner.cast(n));
					target.clear();
					if (v != null) {
						for (Object item : (List<?>) v) {
							target.add((SriNode) item);
						}
					}
				});
	}

	static <N extends SriNode> NodeField value(String name, ValueType valueType, Class<N> owner,
			Function<N, Object> getter, BiConsumer<N, Object> setter) {
		return new NodeField(name, Kind.VALUE, Objects.requireNonNull(valueType, "valueType must not be null"),
				n -> getter.apply(owner.cast(n)),
				(n, v) -> setter.accept(owner.cast(n), v));
	}

	public String name() {
		return name;
	}

	public Kind kind() {
		return kind;
	}

	/**
	 * Representation of a {@link Kind#VALUE} field; {@code null} for node fields.
	 */
	public ValueType valueType() {
		return valueType;
	}

	public boolean holdsNodes() {
		return kind != Kind.VALUE;
	}

	/**
	 * Current value. For {@link Kind#NODE_LIST} this is the live backing list.
	 */
	public Object get(SriNode node) {
		return getter.apply(node);
	}

	/**
	 * Rebind the field. Callers are responsible for keeping parent and child
	 * bookkeeping consistent; outside of construction only {@link TreeMutator}
	 * does this.
	 */
	void set(SriNode node, Object value) {
		setter.accept(node, value);
	}

	@Override
	public String toString() {
		return name + ":" + kind;
	}
}
