package com.gentoro.verifier.pipeline;

import com.gentoro.verifier.chain.JobReference;
import com.gentoro.verifier.exception.ValidationException;
import java.math.BigInteger;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Cross-validation input.
 *
 * @param jobReference on-chain job to score
 * @param transactionHash transaction expected to carry the request event, or {@code null} to skip
 *     event confirmation
 * @param verifierAgentId verifier identity, or {@code null} when not supplied
 */
public record CrossValidationRequest(
    JobReference jobReference, String transactionHash, BigInteger verifierAgentId) {
  private static final Pattern TX_HASH = Pattern.compile("(0x)?[0-9a-fA-F]{64}");

  public CrossValidationRequest {
    if (jobReference == null) {
      throw new ValidationException("Job reference is required");
    }
    if (transactionHash != null) {
      String trimmed = transactionHash.trim();
      if (trimmed.isEmpty()) {
        transactionHash = null;
      } else if (!TX_HASH.matcher(trimmed).matches()) {
        throw new ValidationException("Transaction id must be a 32-byte hex string: " + trimmed);
      } else {
        String lower = trimmed.toLowerCase(Locale.ROOT);
        transactionHash = lower.startsWith("0x") ? lower : "0x" + lower;
      }
    }
    if (verifierAgentId != null && verifierAgentId.signum() < 0) {
      throw new ValidationException("Verifier agent id must not be negative");
    }
  }

  public boolean requiresEventConfirmation() {
    return transactionHash != null;
  }
}
