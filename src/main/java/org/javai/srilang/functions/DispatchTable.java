package org.javai.srilang.functions;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * An immutable {@link BuiltinRegistry} backed by a name-to-function map.
 *
 * <pre>{@code
 * BuiltinRegistry registry = DispatchTable.builder()
 *     .register(myBuiltin)
 *     .build();
 * }</pre>
 */
public final class DispatchTable implements BuiltinRegistry {

	private static final Logger logger = LoggerFactory.getLogger(DispatchTable.class);

	private static final String[] RUNTIME_ONLY = {
			"ecrecover", "min", "max", "concat", "slice", "convert", "raw_call", "send",
			"blockhash", "extract32", "method_id", "empty" };

	private static final DispatchTable STANDARD = createStandard();

	private final Map<String, BuiltinFunction> functions;

	private DispatchTable(Map<String, BuiltinFunction> functions) {
		this.functions = Collections.unmodifiableMap(new LinkedHashMap<>(functions));
	}

	/**
	 * The builtins of the language, with folding support where it exists.
	 */
	public static DispatchTable standard() {
		return STANDARD;
	}

	public static Builder builder() {
		return new Builder();
	}

	@Override
	public Optional<BuiltinFunction> lookup(String name) {
		return Optional.ofNullable(functions.get(name));
	}

	public Set<String> names() {
		return functions.keySet();
	}

	public int size() {
		return functions.size();
	}

	private static DispatchTable createStandard() {
		Builder builder = builder()
				.register(DecimalRounding.FLOOR)
				.register(DecimalRounding.CEIL)
				.register(new Len())
				.register(BitwiseOperation.AND)
				.register(BitwiseOperation.OR)
				.register(BitwiseOperation.XOR)
				.register(new BitwiseNot())
				.register(new Shift())
				.register(ModularArithmetic.ADDMOD)
				.register(ModularArithmetic.MULMOD)
				.register(new AsWeiValue())
				.register(new Sha256())
				.register(new Keccak256());
		for (String name : RUNTIME_ONLY) {
			builder.register(new RuntimeBuiltin(name));
		}
		DispatchTable table = builder.build();
		logger.debug("Standard dispatch table holds {} builtin(s)", table.size());
		return table;
	}

	public static final class Builder {

		private final Map<String, BuiltinFunction> functions = new LinkedHashMap<>();

		private Builder() {
		}

		/**
		 * @throws IllegalArgumentException if a builtin of the same name is already registered
		 */
		public Builder register(BuiltinFunction function) {
			Objects.requireNonNull(function, "function must not be null");
			if (functions.putIfAbsent(function.name(), function) != null) {
				throw new IllegalArgumentException("Builtin already registered: " + function.name());
			}
			return this;
		}

		/**
		 * Register a builtin that can only be evaluated at run time.
		 */
		public Builder registerRuntimeOnly(String name) {
			return register(new RuntimeBuiltin(name));
		}

		public DispatchTable build() {
			return new DispatchTable(functions);
		}
	}
}
