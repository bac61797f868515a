package org.javai.srilang.ast.folding;

import java.io.InputStream;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import org.javai.srilang.ast.BytesNode;
import org.javai.srilang.ast.ConstantNode;
import org.javai.srilang.ast.DecimalNode;
import org.javai.srilang.ast.HexNode;
import org.javai.srilang.ast.IntNode;
import org.javai.srilang.ast.NameConstantNode;
import org.javai.srilang.ast.StrNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.Yaml;

/**
 * Names the compiler replaces with fixed literals, such as {@code MAX_INT128}.
 *
 * <p>The standard table is read from {@value #STANDARD_RESOURCE}:</p>
 * <pre>
 * constants:
 *   MAX_INT128:
 *     type: Int
 *     value: "170141183460469231731687303715884105727"
 * </pre>
 *
 * <p>Each entry holds a parentless template literal; references are replaced
 * with copies of it.</p>
 */
public final class BuiltinConstants {

	private static final Logger logger = LoggerFactory.getLogger(BuiltinConstants.class);

	public static final String STANDARD_RESOURCE = "META-INF/srilang/builtin-constants.yml";

	private static volatile BuiltinConstants standard;

	private final Map<String, ConstantNode<?>> templates;

	private BuiltinConstants(Map<String, ConstantNode<?>> templates) {
		this.templates = Collections.unmodifiableMap(new LinkedHashMap<>(templates));
	}

	/**
	 * The table shipped with the compiler.
	 */
	public static BuiltinConstants standard() {
		BuiltinConstants result = standard;
		if (result == null) {
			synchronized (BuiltinConstants.class) {
				result = standard;
				if (result == null) {
					result = fromResource(STANDARD_RESOURCE, BuiltinConstants.class.getClassLoader());
					standard = result;
				}
			}
		}
		return result;
	}

	public static BuiltinConstants empty() {
		return new BuiltinConstants(Map.of());
	}

	public static BuiltinConstants of(Map<String, ? extends ConstantNode<?>> templates) {
		Objects.requireNonNull(templates, "templates must not be null");
		return new BuiltinConstants(new LinkedHashMap<>(templates));
	}

	/**
	 * Load a table from a classpath resource.
	 *
	 * @throws IllegalArgumentException if the resource cannot be found
	 * @throws IllegalStateException if the resource is not a valid constants table
	 */
	public static BuiltinConstants fromResource(String resourcePath, ClassLoader loader) {
		Objects.requireNonNull(resourcePath, "resourcePath must not be null");
		Objects.requireNonNull(loader, "loader must not be null");
		try (InputStream is = loader.getResourceAsStream(resourcePath)) {
			if (is == null) {
				throw new IllegalArgumentException("Resource not found: " + resourcePath);
			}
			BuiltinConstants constants = fromYaml(is);
			logger.debug("Loaded {} builtin constant(s) from {}", constants.size(), resourcePath);
			return constants;
		}
		catch (IllegalArgumentException | IllegalStateException e) {
			throw e;
		}
		catch (Exception e) {
			throw new IllegalStateException("Failed to load builtin constants from resource: " + resourcePath, e);
		}
	}

	/**
	 * @throws IllegalStateException if the document is not a valid constants table
	 */
	public static BuiltinConstants fromYaml(InputStream inputStream) {
		Object document = new Yaml().load(inputStream);
		if (!(document instanceof Map<?, ?> root) || !(root.get("constants") instanceof Map<?, ?> entries)) {
			throw new IllegalStateException("Missing required 'constants' section");
		}
		Map<String, ConstantNode<?>> templates = new LinkedHashMap<>();
		for (Map.Entry<?, ?> entry : entries.entrySet()) {
			String name = String.valueOf(entry.getKey());
			if (!(entry.getValue() instanceof Map<?, ?> definition)) {
				throw new IllegalStateException("Constant '" + name + "' must be a mapping with 'type' and 'value'");
			}
			templates.put(name, template(name, definition));
		}
		return new BuiltinConstants(templates);
	}

	public Optional<ConstantNode<?>> template(String name) {
		return Optional.ofNullable(templates.get(name));
	}

	public Set<String> names() {
		return templates.keySet();
	}

	public Map<String, ConstantNode<?>> templates() {
		return templates;
	}

	public int size() {
		return templates.size();
	}

	private static ConstantNode<?> template(String name, Map<?, ?> definition) {
		Object type = definition.get("type");
		Object value = definition.get("value");
		if (type == null || value == null) {
			throw new IllegalStateException("Constant '" + name + "' requires 'type' and 'value'");
		}
		String text = String.valueOf(value);
		try {
			switch (String.valueOf(type)) {
				case "Int":
					return IntNode.from(null, new BigInteger(text));
				case "Decimal":
					return DecimalNode.from(null, new BigDecimal(text));
				case "Hex":
					return HexNode.from(null, text);
				case "Str":
					return StrNode.from(null, text);
				case "Bytes":
					return BytesNode.from(null, text.getBytes(StandardCharsets.ISO_8859_1));
				case "NameConstant":
					return NameConstantNode.from(null, "None".equals(text) ? null : Boolean.valueOf(text));
				default:
					throw new IllegalStateException("Constant '" + name + "' has unknown literal type: " + type);
			}
		}
		catch (NumberFormatException e) {
			throw new IllegalStateException("Constant '" + name + "' has an invalid " + type + " value: " + text, e);
		}
	}
}
