package org.javai.srilang.functions;

import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import org.javai.srilang.exceptions.CompilerPanic;

/**
 * {@code sha256(x)}.
 */
final class Sha256 extends HashBuiltin {

	static final String NAME = "sha256";

	Sha256() {
		super(NAME);
	}

	@Override
	protected byte[] digest(byte[] input) {
		try {
			return MessageDigest.getInstance("SHA-256").digest(input);
		}
		catch (NoSuchAlgorithmException e) {
			throw new CompilerPanic("SHA-256 is not available in this JVM", e);
		}
	}
}
