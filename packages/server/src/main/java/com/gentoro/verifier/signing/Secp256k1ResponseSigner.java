package com.gentoro.verifier.signing;

import com.gentoro.verifier.exception.ConfigException;
import com.gentoro.verifier.exception.SigningException;
import org.web3j.crypto.Credentials;
import org.web3j.crypto.ECKeyPair;
import org.web3j.crypto.Sign;
import org.web3j.utils.Numeric;

/**
 * ECDSA over secp256k1. The message is hashed with Keccak-256 and the signature is rendered as
 * {@code r || s || v} (65 bytes). The public key is the 64-byte uncompressed point without prefix.
 */
public class Secp256k1ResponseSigner implements ResponseSigner {
  private final ECKeyPair keyPair;
  private final String publicKey;

  public Secp256k1ResponseSigner(String privateKeyHex) {
    try {
      this.keyPair = Credentials.create(privateKeyHex).getEcKeyPair();
    } catch (RuntimeException e) {
      // the message must not echo the key
      throw new ConfigException("signing.private-key is not a valid secp256k1 private key");
    }
    this.publicKey = Numeric.toHexStringWithPrefixZeroPadded(keyPair.getPublicKey(), 128);
  }

  @Override
  public SignatureResult sign(byte[] message) {
    Sign.SignatureData data;
    try {
      data = Sign.signMessage(message, keyPair);
    } catch (RuntimeException e) {
      throw new SigningException("Failed to sign response", e);
    }
    byte[] signature = new byte[65];
    System.arraycopy(data.getR(), 0, signature, 0, 32);
    System.arraycopy(data.getS(), 0, signature, 32, 32);
    signature[64] = data.getV()[0];
    return new SignatureResult(Numeric.toHexString(signature), publicKey);
  }

  @Override
  public String publicKey() {
    return publicKey;
  }
}
