package com.gentoro.verifier.chain;

import com.gentoro.verifier.config.ChainSettings;
import java.math.BigInteger;
import java.util.List;
import java.util.Optional;
import org.web3j.abi.datatypes.Type;

/**
 * Typed view of the two contracts involved in cross-validation. Pipelines talk to this class and
 * never see ABI data.
 */
public class ChainAdapter {
  private static final org.slf4j.Logger log =
      com.gentoro.verifier.logging.LoggingService.getLogger(ChainAdapter.class);

  private final ChainClient client;
  private final ChainSettings settings;

  public ChainAdapter(ChainClient client, ChainSettings settings) {
    this.client = client;
    this.settings = settings;
  }

  /**
   * Read a job from the JobsModule.
   *
   * @return the decoded job, or empty when the accessor returned no data
   * @throws com.gentoro.verifier.exception.ChainException when the call fails or reverts
   */
  @SuppressWarnings("rawtypes")
  public Optional<ChainJobDetails> readJob(JobReference reference) {
    List<Type> outputs =
        client.call(settings.jobsModuleAddress(), ContractFunctions.getJob(reference));
    if (outputs.isEmpty() || !(outputs.get(0) instanceof JobStruct job)) {
      log.debug("getJob({}) returned no data", reference);
      return Optional.empty();
    }
    return Optional.of(job.toDetails());
  }

  /**
   * Record a cross-validation score on the RegistryModule and wait for confirmation.
   *
   * @return the confirmed transaction hash
   * @throws IllegalArgumentException if {@code score} is outside [0, 100]
   */
  public String writeScore(BigInteger agentId, BigInteger verifierAgentId, int score) {
    if (score < 0 || score > 100) {
      throw new IllegalArgumentException("Score must be within [0, 100], got " + score);
    }
    BigInteger verifier = verifierAgentId == null ? BigInteger.ZERO : verifierAgentId;
    log.info("Recording score {} for agent {} by verifier {}", score, agentId, verifier);
    return client.submit(
        settings.registryModuleAddress(),
        ContractFunctions.recordCrossValidationReputationScore(agentId, verifier, score),
        settings.gasLimit());
  }

  public List<ChainLog> logsForTransaction(String transactionHash) {
    return client.logsForTransaction(transactionHash);
  }
}
