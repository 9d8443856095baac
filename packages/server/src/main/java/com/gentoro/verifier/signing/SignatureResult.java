package com.gentoro.verifier.signing;

/**
 * @param signature 0x-prefixed hex
 * @param publicKey 0x-prefixed hex of the key that verifies {@code signature}
 */
public record SignatureResult(String signature, String publicKey) {}
