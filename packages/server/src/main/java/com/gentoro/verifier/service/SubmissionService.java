package com.gentoro.verifier.service;

import com.gentoro.verifier.exception.StateException;
import com.gentoro.verifier.exception.ValidationException;
import com.gentoro.verifier.jobs.JobManager;
import com.gentoro.verifier.jobs.JobStatus;
import com.gentoro.verifier.jobs.JobType;
import com.gentoro.verifier.pipeline.CrossValidationRequest;
import com.gentoro.verifier.pipeline.VerificationRequest;
import java.time.Clock;

/**
 * Foreground half of both workflows: validates input synchronously and hands accepted work to the
 * {@link JobManager}. Rejected input never creates a job.
 */
public class SubmissionService {
  private static final org.slf4j.Logger log =
      com.gentoro.verifier.logging.LoggingService.getLogger(SubmissionService.class);

  public static final String VERIFY_PATH = "/verify";
  public static final String VALIDATE_PATH = "/validate";

  private final JobManager jobs;
  private final int minTextLength;
  private final int maxTextLength;
  private final String provider;
  private final Clock clock;

  public SubmissionService(
      JobManager jobs, int minTextLength, int maxTextLength, String provider, Clock clock) {
    this.jobs = jobs;
    this.minTextLength = minTextLength;
    this.maxTextLength = maxTextLength;
    this.provider = provider;
    this.clock = clock;
  }

  /**
   * Lengths are counted in code points, so a supplementary character counts once.
   *
   * @throws ValidationException when the text is missing or its length is outside the bounds
   */
  public SubmissionReceipt submitVerification(String text) {
    if (text == null) {
      throw new ValidationException("job_data is required");
    }
    int length = text.codePointCount(0, text.length());
    if (length < minTextLength) {
      throw new ValidationException(
          "Job data too short. Minimum length is %d characters.".formatted(minTextLength));
    }
    if (length > maxTextLength) {
      throw new ValidationException(
          "Job data too long. Maximum length is %d characters.".formatted(maxTextLength));
    }
    String id = jobs.submit(JobType.VERIFICATION, new VerificationRequest(text));
    log.info("Accepted verification job {} ({} chars)", id, length);
    return receipt(id, VERIFY_PATH, provider);
  }

  /**
   * @throws StateException when cross-validation is not configured on this instance
   */
  public SubmissionReceipt submitCrossValidation(CrossValidationRequest request) {
    if (!isCrossValidationEnabled()) {
      throw new StateException("Cross-validation is not configured");
    }
    String id = jobs.submit(JobType.CROSS_VALIDATION, request);
    log.info("Accepted cross-validation job {} for {}", id, request.jobReference());
    return receipt(id, VALIDATE_PATH, null);
  }

  public boolean isCrossValidationEnabled() {
    return jobs.supports(JobType.CROSS_VALIDATION);
  }

  private SubmissionReceipt receipt(String id, String basePath, String provider) {
    return new SubmissionReceipt(
        id,
        JobStatus.PROCESSING.wireName(),
        basePath + "/" + id,
        provider,
        clock.instant().getEpochSecond());
  }
}
