package com.gentoro.verifier.chain;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.math.BigInteger;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Snapshot of the JobsModule contract's view of a job.
 *
 * @param creator creator address, 0x-prefixed
 * @param agentId owning agent token id
 * @param budget budget in the smallest unit
 * @param state lifecycle state code
 * @param createdAt creation time in unix seconds, unsigned 64-bit like the other timestamps
 * @param multihopId linking id for multi-step workflows, 0x-prefixed 32-byte hex
 * @param step step counter within the multihop workflow
 */
public record ChainJobDetails(
    @JsonProperty("creator") String creator,
    @JsonProperty("agent_id") BigInteger agentId,
    @JsonProperty("budget") BigInteger budget,
    @JsonProperty("description") String description,
    @JsonProperty("state") int state,
    @JsonProperty("created_at") BigInteger createdAt,
    @JsonProperty("accept_deadline") BigInteger acceptDeadline,
    @JsonProperty("complete_deadline") BigInteger completeDeadline,
    @JsonProperty("multihop_id") String multihopId,
    @JsonProperty("step") BigInteger step) {

  public static final String ZERO_ADDRESS = "0x0000000000000000000000000000000000000000";

  /**
   * True when the contract returned its zero value for an unknown job: no owning agent and the zero
   * creator address. Both must be zero; a job with only one of them set is still considered real.
   */
  public boolean hasNoData() {
    boolean noAgent = agentId == null || agentId.signum() == 0;
    boolean noCreator = creator == null || creator.isBlank() || isZeroAddress(creator);
    return noAgent && noCreator;
  }

  /** Field values keyed by the placeholder names of the job context prompt. */
  public Map<String, Object> promptValues() {
    Map<String, Object> values = new LinkedHashMap<>();
    values.put("multihopId", multihopId == null ? "" : stripHexPrefix(multihopId));
    values.put("creator", creator);
    values.put("agentId", agentId);
    values.put("budget", budget);
    values.put("description", description);
    values.put("state", state);
    values.put("createdAt", createdAt);
    values.put("acceptDeadline", acceptDeadline);
    values.put("completeDeadline", completeDeadline);
    values.put("step", step);
    return values;
  }

  private static boolean isZeroAddress(String address) {
    String hex = stripHexPrefix(address.trim());
    for (int i = 0; i < hex.length(); i++) {
      if (hex.charAt(i) != '0') return false;
    }
    return true;
  }

  private static String stripHexPrefix(String hex) {
    return hex.startsWith("0x") || hex.startsWith("0X") ? hex.substring(2) : hex;
  }
}
