package org.javai.srilang.exceptions;

import java.util.Objects;
import org.javai.srilang.ast.SriNode;
import org.javai.srilang.settings.DiagnosticSettings;
import org.javai.srilang.util.SourceAnnotator;

/**
 * Base class for errors attributable to the contract being compiled.
 *
 * <p>Every instance carries the source position it refers to. The rendered
 * message includes a caret-annotated excerpt of the source when the full
 * source text is known.</p>
 */
public class SrilangException extends RuntimeException {

	private final String detail;
	private final ErrorLocation location;

	public SrilangException(String message) {
		this(message, ErrorLocation.UNKNOWN);
	}

	public SrilangException(String message, SriNode node) {
		this(message, ErrorLocation.of(node));
	}

	public SrilangException(String message, ErrorLocation location) {
		super(message);
		this.detail = Objects.requireNonNull(message, "message must not be null");
		this.location = location != null ? location : ErrorLocation.UNKNOWN;
	}

	/**
	 * The bare message, without position or source excerpt.
	 */
	public String detail() {
		return detail;
	}

	public ErrorLocation location() {
		return location;
	}

	public Integer lineno() {
		return location.lineno();
	}

	public Integer colOffset() {
		return location.colOffset();
	}

	/**
	 * Return a copy of this exception pointing at another node.
	 */
	public SrilangException withAnnotation(SriNode node) {
		SrilangException copy = relocated(ErrorLocation.of(node));
		copy.setStackTrace(getStackTrace());
		return copy;
	}

	protected SrilangException relocated(ErrorLocation newLocation) {
		return new SrilangException(detail, newLocation);
	}

	@Override
	public String getMessage() {
		return render(DiagnosticSettings.current());
	}

	public String render(DiagnosticSettings settings) {
		Integer lineno = location.lineno();
		Integer colOffset = location.colOffset();
		if (lineno == null) {
			return detail;
		}
		String columnText = colOffset == null ? "" : colOffset.toString();
		String header = "line " + lineno + ":" + columnText + " " + detail;
		if (location.sourceCode() == null) {
			return header;
		}
		try {
			String excerpt = SourceAnnotator.annotate(location.sourceCode(), lineno, colOffset,
					settings.errorContextLines(), settings.errorLineNumbers());
			return header + "\n" + excerpt;
		}
		catch (IllegalArgumentException e) {
			// position does not fall inside the recorded source
			return header;
		}
	}
}
