package com.gentoro.verifier.signing;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.gentoro.verifier.exception.SigningException;
import com.gentoro.verifier.utility.JacksonUtility;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Attaches {@code signature} and {@code public_key} to a response payload. The signature covers
 * the canonical JSON encoding of the payload (sorted keys, no whitespace, nulls omitted), so the
 * same content always signs the same bytes. Without a signer the payload is returned unchanged.
 */
public class SigningEnvelope {
  public static final String SIGNATURE = "signature";
  public static final String PUBLIC_KEY = "public_key";

  private final ResponseSigner signer;

  /** @param signer may be {@code null} to disable signing */
  public SigningEnvelope(ResponseSigner signer) {
    this.signer = signer;
  }

  public boolean isEnabled() {
    return signer != null;
  }

  public Optional<String> publicKey() {
    return Optional.ofNullable(signer).map(ResponseSigner::publicKey);
  }

  public Map<String, Object> sign(Map<String, Object> payload) {
    if (signer == null) {
      return payload;
    }
    SignatureResult result = signer.sign(canonicalBytes(payload));
    Map<String, Object> signed = new LinkedHashMap<>(payload);
    signed.put(SIGNATURE, result.signature());
    signed.put(PUBLIC_KEY, result.publicKey());
    return signed;
  }

  /** Bytes the signature is computed over. */
  public static byte[] canonicalBytes(Map<String, Object> payload) {
    try {
      return JacksonUtility.getCanonicalMapper().writeValueAsBytes(payload);
    } catch (JsonProcessingException e) {
      throw new SigningException("Failed to encode payload for signing", e);
    }
  }
}
