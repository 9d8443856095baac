package com.gentoro.verifier.pipeline;

import com.gentoro.verifier.chain.ChainLog;
import com.gentoro.verifier.chain.ContractFunctions;
import com.gentoro.verifier.chain.JobReference;
import java.math.BigInteger;
import java.util.List;
import org.web3j.utils.Numeric;

/** Finds the {@code CrossValidationRequested} log for a job among a transaction's logs. */
public final class CrossValidationEventMatcher {
  private static final String TOPIC = ContractFunctions.CROSS_VALIDATION_REQUESTED_TOPIC;

  private CrossValidationEventMatcher() {}

  /**
   * @param verifierAgentId when non-null, the indexed verifier topic must equal it as well
   */
  public static boolean matches(
      List<ChainLog> logs, JobReference jobReference, BigInteger verifierAgentId) {
    for (ChainLog log : logs) {
      if (log.topics().isEmpty() || !TOPIC.equalsIgnoreCase(log.topics().get(0))) continue;
      if (!jobReference.hex().equalsIgnoreCase(firstWord(log.data()))) continue;
      if (verifierAgentId != null && !verifierMatches(log, verifierAgentId)) continue;
      return true;
    }
    return false;
  }

  private static String firstWord(String data) {
    String hex = Numeric.cleanHexPrefix(data);
    if (hex.length() >= 64) return hex.substring(0, 64);
    return "0".repeat(64 - hex.length()) + hex;
  }

  private static boolean verifierMatches(ChainLog log, BigInteger verifierAgentId) {
    if (log.topics().size() < 2) return false;
    try {
      return Numeric.toBigInt(log.topics().get(1)).equals(verifierAgentId);
    } catch (RuntimeException e) {
      return false;
    }
  }
}
