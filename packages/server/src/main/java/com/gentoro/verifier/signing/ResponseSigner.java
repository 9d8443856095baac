package com.gentoro.verifier.signing;

/** Signs bytes with a key that never leaves the implementation. */
public interface ResponseSigner {

  SignatureResult sign(byte[] message);

  /** Public half of the signing key, 0x-prefixed hex. */
  String publicKey();
}
