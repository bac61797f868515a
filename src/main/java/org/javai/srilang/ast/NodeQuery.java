package org.javai.srilang.ast;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Selection criteria for {@link SriNode#getChildren(NodeQuery)} and
 * {@link SriNode#getDescendants(NodeQuery)}.
 *
 * <p>Filters map a dotted attribute path to an expected value. The expected
 * value may be a {@link Collection}, in which case a node matches if the
 * attribute equals any member, e.g. {@code where("id", Set.of("public", "constant"))}.</p>
 *
 * <p>Instances are immutable; every refinement returns a new query.</p>
 */
public final class NodeQuery {

	private static final NodeQuery ANY = new NodeQuery(List.of(), Map.of(), false, false);

	private final List<Class<? extends SriNode>> types;
	private final Map<String, Object> filters;
	private final boolean includeSelf;
	private final boolean reverse;

	private NodeQuery(List<Class<? extends SriNode>> types, Map<String, Object> filters, boolean includeSelf,
			boolean reverse) {
		this.types = types;
		this.filters = filters;
		this.includeSelf = includeSelf;
		this.reverse = reverse;
	}

	public static NodeQuery any() {
		return ANY;
	}

	@SafeVarargs
	public static NodeQuery ofType(Class<? extends SriNode>... types) {
		return new NodeQuery(List.of(types), Map.of(), false, false);
	}

	public NodeQuery where(String path, Object expected) {
		Objects.requireNonNull(path, "path must not be null");
		Map<String, Object> copy = new LinkedHashMap<>(filters);
		copy.put(path, expected);
		return new NodeQuery(types, copy, includeSelf, reverse);
	}

	public NodeQuery where(Map<String, ?> moreFilters) {
		if (moreFilters == null || moreFilters.isEmpty()) {
			return this;
		}
		Map<String, Object> copy = new LinkedHashMap<>(filters);
		copy.putAll(moreFilters);
		return new NodeQuery(types, copy, includeSelf, reverse);
	}

	public NodeQuery includeSelf() {
		return new NodeQuery(types, filters, true, reverse);
	}

	public NodeQuery reverse() {
		return new NodeQuery(types, filters, includeSelf, true);
	}

	public boolean isIncludeSelf() {
		return includeSelf;
	}

	public boolean isReverse() {
		return reverse;
	}

	/**
	 * True if {@code node} is of one of the requested variants and satisfies every filter.
	 */
	public boolean matches(SriNode node) {
		return matchesType(node) && matchesFilters(node);
	}

	private boolean matchesType(SriNode node) {
		if (types.isEmpty()) {
			return true;
		}
		for (Class<? extends SriNode> type : types) {
			if (type.isInstance(node)) {
				return true;
			}
		}
		return false;
	}

	private boolean matchesFilters(SriNode node) {
		for (Map.Entry<String, Object> filter : filters.entrySet()) {
			Object actual = node.get(filter.getKey());
			Object expected = filter.getValue();
			if (expected instanceof Collection<?> options) {
				if (options.stream().noneMatch(option -> valueMatches(actual, option))) {
					return false;
				}
			}
			else if (!valueMatches(actual, expected)) {
				return false;
			}
		}
		return true;
	}

	private static boolean valueMatches(Object actual, Object expected) {
		if (actual instanceof BigInteger big && expected instanceof Number number
				&& !(expected instanceof BigDecimal) && !(expected instanceof Double)
				&& !(expected instanceof Float)) {
			return big.equals(number instanceof BigInteger b ? b : BigInteger.valueOf(number.longValue()));
		}
		return ConstantNode.valuesEqual(actual, expected);
	}

	@Override
	public String toString() {
		return "NodeQuery[types=" + types + ", filters=" + filters + ", includeSelf=" + includeSelf
				+ ", reverse=" + reverse + "]";
	}
}
