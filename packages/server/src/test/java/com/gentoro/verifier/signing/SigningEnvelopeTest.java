package com.gentoro.verifier.signing;

import static org.junit.jupiter.api.Assertions.*;

import java.math.BigInteger;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.web3j.crypto.Sign;
import org.web3j.utils.Numeric;

class SigningEnvelopeTest {
  private static final String KEY =
      "0x4c0883a69102937d6231471b5dbb6204fe5129617082792ae468d01a3f362318";

  private static Map<String, Object> payload() {
    Map<String, Object> p = new LinkedHashMap<>();
    p.put("job_id", "abc");
    p.put("status", "completed");
    p.put("word_count", 11);
    p.put("job_details", Map.of("step", 1, "agent_id", 7));
    return p;
  }

  @Test
  void withoutSignerPayloadIsReturnedUnchanged() {
    SigningEnvelope envelope = new SigningEnvelope(null);
    Map<String, Object> p = payload();

    assertSame(p, envelope.sign(p));
    assertFalse(envelope.isEnabled());
    assertTrue(envelope.publicKey().isEmpty());
  }

  @Test
  void signatureVerifiesAgainstPublicKey() throws Exception {
    Secp256k1ResponseSigner signer = new Secp256k1ResponseSigner(KEY);
    Map<String, Object> p = payload();

    Map<String, Object> signed = new SigningEnvelope(signer).sign(p);

    assertEquals(p.size() + 2, signed.size());
    assertFalse(p.containsKey(SigningEnvelope.SIGNATURE));
    byte[] sig = Numeric.hexStringToByteArray((String) signed.get(SigningEnvelope.SIGNATURE));
    assertEquals(65, sig.length);
    Sign.SignatureData data =
        new Sign.SignatureData(
            sig[64], Arrays.copyOfRange(sig, 0, 32), Arrays.copyOfRange(sig, 32, 64));
    BigInteger recovered = Sign.signedMessageToKey(SigningEnvelope.canonicalBytes(p), data);
    assertEquals(
        Numeric.toHexStringWithPrefixZeroPadded(recovered, 128),
        signed.get(SigningEnvelope.PUBLIC_KEY));
    assertEquals(signer.publicKey(), signed.get(SigningEnvelope.PUBLIC_KEY));
  }

  @Test
  void canonicalEncodingIgnoresInsertionOrder() {
    Map<String, Object> a = new LinkedHashMap<>();
    a.put("b", 2);
    a.put("a", Map.of("y", 1, "x", 2));
    Map<String, Object> b = new LinkedHashMap<>();
    b.put("a", Map.of("x", 2, "y", 1));
    b.put("b", 2);

    assertArrayEquals(SigningEnvelope.canonicalBytes(a), SigningEnvelope.canonicalBytes(b));
    assertEquals(
        "{\"a\":{\"x\":2,\"y\":1},\"b\":2}",
        new String(SigningEnvelope.canonicalBytes(a), java.nio.charset.StandardCharsets.UTF_8));
  }

  @Test
  void sameContentSignsTheSameBytes() {
    SigningEnvelope envelope = new SigningEnvelope(new Secp256k1ResponseSigner(KEY));
    // RFC 6979 deterministic nonces make the signature itself repeatable
    assertEquals(envelope.sign(payload()), envelope.sign(payload()));
  }

  @Test
  void invalidKeyIsAConfigurationError() {
    assertThrows(
        com.gentoro.verifier.exception.ConfigException.class,
        () -> new Secp256k1ResponseSigner("not-a-key"));
  }
}
