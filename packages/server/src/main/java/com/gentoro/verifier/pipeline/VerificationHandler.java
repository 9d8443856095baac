package com.gentoro.verifier.pipeline;

import com.gentoro.verifier.exception.InferenceException;
import com.gentoro.verifier.jobs.JobContext;
import com.gentoro.verifier.jobs.JobHandler;
import com.gentoro.verifier.jobs.JobResult;
import com.gentoro.verifier.jobs.JobStepException;
import com.gentoro.verifier.scoring.AiScoringAdapter;
import org.apache.commons.lang3.StringUtils;

/** Dispute verdict for free text, plus word count and reading time. */
public class VerificationHandler implements JobHandler<VerificationRequest> {
  private static final org.slf4j.Logger log =
      com.gentoro.verifier.logging.LoggingService.getLogger(VerificationHandler.class);

  static final int WORDS_PER_MINUTE = 200;

  private final AiScoringAdapter scoring;

  public VerificationHandler(AiScoringAdapter scoring) {
    this.scoring = scoring;
  }

  @Override
  public JobResult execute(JobContext ctx, VerificationRequest request) throws JobStepException {
    String verdict;
    try {
      verdict = scoring.resolveDispute(request.text());
    } catch (InferenceException e) {
      throw new JobStepException(e.getMessage(), null, e);
    }
    int words = wordCount(request.text());
    log.debug("Verdict for job {}: {} ({} words)", ctx.jobId(), verdict, words);
    return new VerificationResult(verdict, words, readingTimeMinutes(words));
  }

  /** Number of whitespace separated tokens. */
  static int wordCount(String text) {
    return StringUtils.split(text).length;
  }

  static int readingTimeMinutes(int wordCount) {
    return Math.max(1, wordCount / WORDS_PER_MINUTE);
  }
}
