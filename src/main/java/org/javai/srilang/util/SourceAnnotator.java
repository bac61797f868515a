package org.javai.srilang.util;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Renders an excerpt of contract source with a caret under the offending column.
 *
 * <pre>
 *      1 FEE: constant(int128) = 2 + 3
 * ---> 2 BAD: constant(int128) = 1 / 0
 * ------------------------------^
 *      3
 * </pre>
 */
public final class SourceAnnotator {

	private static final String CURRENT_LINE_MARKER = "---> ";

	private SourceAnnotator() {
	}

	/**
	 * Annotate a single line of source.
	 *
	 * @param sourceCode full source text
	 * @param lineno one-based line number to highlight
	 * @param colOffset zero-based column to mark, or {@code null} for no caret
	 * @param contextLines lines of context to show above and below
	 * @param lineNumbers whether to prefix each line with its number
	 * @throws IllegalArgumentException if {@code lineno} is outside the source
	 */
	public static String annotate(String sourceCode, int lineno, Integer colOffset, int contextLines,
			boolean lineNumbers) {
		Objects.requireNonNull(sourceCode, "sourceCode must not be null");
		List<String> sourceLines = sourceCode.lines().toList();
		if (lineno < 1 || lineno > sourceLines.size()) {
			throw new IllegalArgumentException("Line number is out of range: " + lineno);
		}

		int lineOffset = lineno - 1;
		int startOffset = Math.max(0, lineOffset - contextLines);
		int endOffset = Math.min(sourceLines.size(), lineOffset + contextLines + 1);

		List<String> rendered = new ArrayList<>(sourceLines.subList(startOffset, lineOffset + 1));
		if (colOffset != null) {
			rendered.add("-".repeat(Math.max(0, colOffset)) + "^");
		}
		rendered.addAll(sourceLines.subList(lineOffset + 1, endOffset));

		if (lineNumbers) {
			List<String> margins = new ArrayList<>();
			for (int i = startOffset + 1; i <= endOffset; i++) {
				margins.add(i + " ");
			}
			int localOffset = lineOffset - startOffset;
			margins.set(localOffset, CURRENT_LINE_MARKER + margins.get(localOffset));
			int width = margins.stream().mapToInt(String::length).max().orElse(0);
			List<String> justified = new ArrayList<>();
			for (String margin : margins) {
				justified.add(" ".repeat(width - margin.length()) + margin);
			}
			if (colOffset != null) {
				justified.add(localOffset + 1, "-".repeat(width));
			}
			for (int i = 0; i < rendered.size(); i++) {
				rendered.set(i, justified.get(i) + rendered.get(i));
			}
		}

		List<String> cleaned = new ArrayList<>(rendered.size());
		for (String line : rendered) {
			cleaned.add(line.stripTrailing());
		}
		return String.join("\n", cleaned);
	}
}
