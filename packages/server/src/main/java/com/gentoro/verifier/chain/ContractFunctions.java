package com.gentoro.verifier.chain;

import java.math.BigInteger;
import java.util.List;
import org.web3j.abi.EventEncoder;
import org.web3j.abi.TypeReference;
import org.web3j.abi.datatypes.Event;
import org.web3j.abi.datatypes.Function;
import org.web3j.abi.datatypes.generated.Bytes32;
import org.web3j.abi.datatypes.generated.Uint256;

/** Typed descriptors of the contract functions and events the service uses. */
public final class ContractFunctions {

  /** {@code CrossValidationRequested(bytes32 jobID, uint256 indexed verifierAgentId)}. */
  public static final Event CROSS_VALIDATION_REQUESTED =
      new Event(
          "CrossValidationRequested",
          List.of(new TypeReference<Bytes32>() {}, new TypeReference<Uint256>(true) {}));

  /** First topic of every {@link #CROSS_VALIDATION_REQUESTED} log. */
  public static final String CROSS_VALIDATION_REQUESTED_TOPIC =
      EventEncoder.encode(CROSS_VALIDATION_REQUESTED);

  private ContractFunctions() {}

  /** {@code JobsModule.getJob(bytes32) view returns (Job)}. */
  public static Function getJob(JobReference reference) {
    return new Function(
        "getJob",
        List.of(new Bytes32(reference.toBytes32())),
        List.of(new TypeReference<JobStruct>() {}));
  }

  /**
   * {@code RegistryModule.recordCrossValidationReputationScore(uint256 agentId, uint256
   * verifierAgentId, uint256 score)}.
   */
  public static Function recordCrossValidationReputationScore(
      BigInteger agentId, BigInteger verifierAgentId, int score) {
    return new Function(
        "recordCrossValidationReputationScore",
        List.of(
            new Uint256(agentId), new Uint256(verifierAgentId), new Uint256(BigInteger.valueOf(score))),
        List.of());
  }
}
