package org.javai.srilang.functions;

import java.util.Optional;

/**
 * Lookup of builtin functions by name.
 */
public interface BuiltinRegistry {

	Optional<BuiltinFunction> lookup(String name);

	/**
	 * The builtin called {@code name}, if it exists and can be folded.
	 */
	default Optional<FoldableBuiltin> lookupFoldable(String name) {
		return lookup(name)
				.filter(FoldableBuiltin.class::isInstance)
				.map(FoldableBuiltin.class::cast);
	}
}
