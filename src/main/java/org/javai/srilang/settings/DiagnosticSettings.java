package org.javai.srilang.settings;

import java.util.Map;
import java.util.Objects;
import java.util.Properties;

/**
 * Controls how source excerpts are rendered in error messages.
 *
 * <p>Values are resolved from system properties first
 * ({@code srilang.error.context-lines}, {@code srilang.error.line-numbers}),
 * then from the environment ({@code SRILANG_ERROR_CONTEXT_LINES},
 * {@code SRILANG_ERROR_LINE_NUMBERS}).</p>
 *
 * @param errorContextLines number of source lines shown above and below the offending line
 * @param errorLineNumbers whether line numbers are printed in the margin
 */
public record DiagnosticSettings(int errorContextLines, boolean errorLineNumbers) {

	public static final String CONTEXT_LINES_PROPERTY = "srilang.error.context-lines";
	public static final String LINE_NUMBERS_PROPERTY = "srilang.error.line-numbers";
	public static final String CONTEXT_LINES_ENV = "SRILANG_ERROR_CONTEXT_LINES";
	public static final String LINE_NUMBERS_ENV = "SRILANG_ERROR_LINE_NUMBERS";

	private static final int DEFAULT_CONTEXT_LINES = 1;

	public DiagnosticSettings {
		if (errorContextLines < 0) {
			throw new IllegalArgumentException("errorContextLines must not be negative");
		}
	}

	public static DiagnosticSettings defaults() {
		return new DiagnosticSettings(DEFAULT_CONTEXT_LINES, true);
	}

	/**
	 * Resolve settings from the running JVM's system properties and environment.
	 */
	public static DiagnosticSettings current() {
		return resolve(System.getProperties(), System.getenv());
	}

	public static DiagnosticSettings resolve(Properties properties, Map<String, String> environment) {
		Objects.requireNonNull(properties, "properties must not be null");
		Objects.requireNonNull(environment, "environment must not be null");

		String contextLines = firstNonBlank(properties.getProperty(CONTEXT_LINES_PROPERTY),
				environment.get(CONTEXT_LINES_ENV));
		String lineNumbers = firstNonBlank(properties.getProperty(LINE_NUMBERS_PROPERTY),
				environment.get(LINE_NUMBERS_ENV));

		int lines = DEFAULT_CONTEXT_LINES;
		if (contextLines != null) {
			try {
				lines = Integer.parseInt(contextLines.trim());
			}
			catch (NumberFormatException e) {
				throw new IllegalArgumentException("Invalid error context line count: " + contextLines, e);
			}
		}
		boolean numbers = lineNumbers == null || "1".equals(lineNumbers.trim())
				|| "true".equalsIgnoreCase(lineNumbers.trim());
		return new DiagnosticSettings(lines, numbers);
	}

	private static String firstNonBlank(String first, String second) {
		if (first != null && !first.isBlank()) {
			return first;
		}
		if (second != null && !second.isBlank()) {
			return second;
		}
		return null;
	}
}
