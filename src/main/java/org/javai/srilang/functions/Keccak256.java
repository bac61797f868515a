package org.javai.srilang.functions;

import org.bouncycastle.crypto.digests.KeccakDigest;

/**
 * {@code keccak256(x)}, the original Keccak padding rather than NIST SHA3-256.
 */
final class Keccak256 extends HashBuiltin {

	static final String NAME = "keccak256";

	Keccak256() {
		super(NAME);
	}

	@Override
	protected byte[] digest(byte[] input) {
		KeccakDigest keccak = new KeccakDigest(256);
		keccak.update(input, 0, input.length);
		byte[] out = new byte[keccak.getDigestSize()];
		keccak.doFinal(out, 0);
		return out;
	}
}
