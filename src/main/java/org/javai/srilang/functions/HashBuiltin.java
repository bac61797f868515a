package org.javai.srilang.functions;

import java.nio.charset.StandardCharsets;
import java.util.HexFormat;
import org.javai.srilang.ast.BytesNode;
import org.javai.srilang.ast.CallNode;
import org.javai.srilang.ast.FoldResult;
import org.javai.srilang.ast.HexNode;
import org.javai.srilang.ast.SriNode;
import org.javai.srilang.ast.StrNode;

/**
 * A 32-byte hash of a string, byte string or hex literal, folded to a hex literal.
 */
abstract class HashBuiltin implements FoldableBuiltin {

	private final String name;

	HashBuiltin(String name) {
		this.name = name;
	}

	@Override
	public String name() {
		return name;
	}

	@Override
	public FoldResult evaluate(CallNode call) {
		SriNode arg = CallArguments.require(call, name, 1).get(0);
		byte[] input;
		if (arg instanceof StrNode str) {
			input = str.value().getBytes(StandardCharsets.ISO_8859_1);
		}
		else if (arg instanceof BytesNode bytes) {
			input = bytes.value();
		}
		else if (arg instanceof HexNode hex) {
			input = HexFormat.of().parseHex(hex.value().substring(2));
		}
		else {
			return FoldResult.unfoldable(name + " argument is not a string, bytes or hex literal");
		}
		return FoldResult.folded(HexNode.from(call, "0x" + HexFormat.of().formatHex(digest(input))));
	}

	protected abstract byte[] digest(byte[] input);
}
