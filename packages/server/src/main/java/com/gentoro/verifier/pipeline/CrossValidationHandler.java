package com.gentoro.verifier.pipeline;

import com.gentoro.verifier.chain.ChainAdapter;
import com.gentoro.verifier.chain.ChainJobDetails;
import com.gentoro.verifier.chain.ChainLog;
import com.gentoro.verifier.exception.ChainException;
import com.gentoro.verifier.exception.InferenceException;
import com.gentoro.verifier.jobs.JobContext;
import com.gentoro.verifier.jobs.JobHandler;
import com.gentoro.verifier.jobs.JobResult;
import com.gentoro.verifier.jobs.JobStepException;
import com.gentoro.verifier.scoring.AiScoringAdapter;
import java.util.List;
import java.util.Optional;

/**
 * Cross-validates an on-chain job: optional event confirmation, job retrieval, AI scoring and
 * score write-back. Steps run strictly in that order; the first failing step ends the run.
 */
public class CrossValidationHandler implements JobHandler<CrossValidationRequest> {
  private static final org.slf4j.Logger log =
      com.gentoro.verifier.logging.LoggingService.getLogger(CrossValidationHandler.class);

  static final String EVENT_NOT_FOUND = "Event not found";
  static final String JOB_NOT_FOUND = "Job not found";
  static final String JOB_HAS_NO_DATA = "Job exists but has no valid data";
  static final String SCORE_FAILED = "Failed to get AI validation score";
  static final String WRITE_BACK_FAILED = "Failed to record reputation score on-chain";

  private final ChainAdapter chain;
  private final AiScoringAdapter scoring;

  public CrossValidationHandler(ChainAdapter chain, AiScoringAdapter scoring) {
    this.chain = chain;
    this.scoring = scoring;
  }

  @Override
  public JobResult execute(JobContext ctx, CrossValidationRequest request)
      throws JobStepException {
    boolean eventFound = false;
    if (request.requiresEventConfirmation()) {
      confirmEvent(request);
      eventFound = true;
    }

    ChainJobDetails details = readJob(request);
    String context = scoring.renderContext(details);

    int score;
    try {
      score = scoring.score(context);
    } catch (InferenceException e) {
      throw new JobStepException(SCORE_FAILED, details, e);
    }
    log.info("Job {} scored {}", request.jobReference(), score);

    String txHash;
    try {
      txHash = chain.writeScore(details.agentId(), request.verifierAgentId(), score);
    } catch (ChainException e) {
      throw new JobStepException(WRITE_BACK_FAILED, details, e);
    }
    return new CrossValidationResult(score, txHash, eventFound, details);
  }

  private void confirmEvent(CrossValidationRequest request) throws JobStepException {
    List<ChainLog> logs;
    try {
      logs = chain.logsForTransaction(request.transactionHash());
    } catch (ChainException e) {
      throw new JobStepException(EVENT_NOT_FOUND, null, e);
    }
    if (!CrossValidationEventMatcher.matches(
        logs, request.jobReference(), request.verifierAgentId())) {
      log.debug(
          "No matching event among {} logs of {}", logs.size(), request.transactionHash());
      throw new JobStepException(EVENT_NOT_FOUND);
    }
  }

  private ChainJobDetails readJob(CrossValidationRequest request) throws JobStepException {
    Optional<ChainJobDetails> job;
    try {
      job = chain.readJob(request.jobReference());
    } catch (ChainException e) {
      throw new JobStepException(JOB_NOT_FOUND, null, e);
    }
    if (job.isEmpty()) {
      throw new JobStepException(JOB_NOT_FOUND);
    }
    if (job.get().hasNoData()) {
      throw new JobStepException(JOB_HAS_NO_DATA, job.get());
    }
    return job.get();
  }
}
