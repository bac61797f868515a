package org.javai.srilang.functions;

import java.util.Objects;

/**
 * A builtin that is only ever evaluated by generated code.
 */
record RuntimeBuiltin(String name) implements BuiltinFunction {

	RuntimeBuiltin {
		Objects.requireNonNull(name, "name must not be null");
	}
}
