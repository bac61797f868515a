package org.javai.srilang.functions;

import org.javai.srilang.ast.BytesNode;
import org.javai.srilang.ast.CallNode;
import org.javai.srilang.ast.FoldResult;
import org.javai.srilang.ast.HexNode;
import org.javai.srilang.ast.IntNode;
import org.javai.srilang.ast.SriNode;
import org.javai.srilang.ast.StrNode;

/**
 * {@code len(x)} of a string, byte string or hex literal. Hex literals are measured in bytes.
 */
final class Len implements FoldableBuiltin {

	static final String NAME = "len";

	@Override
	public String name() {
		return NAME;
	}

	@Override
	public FoldResult evaluate(CallNode call) {
		SriNode arg = CallArguments.require(call, NAME, 1).get(0);
		long length;
		if (arg instanceof StrNode str) {
			length = str.value().length();
		}
		else if (arg instanceof BytesNode bytes) {
			length = bytes.value().length;
		}
		else if (arg instanceof HexNode hex) {
			length = hex.byteLength();
		}
		else {
			return FoldResult.unfoldable("len argument is not a string, bytes or hex literal");
		}
		return FoldResult.folded(IntNode.from(call, length));
	}
}
