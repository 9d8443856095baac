package com.gentoro.verifier.pipeline;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.gentoro.verifier.jobs.JobResult;

/**
 * Verdict and text statistics of a completed verification.
 *
 * @param readingTimeMinutes estimated whole minutes at 200 words per minute, at least 1
 */
public record VerificationResult(
    @JsonProperty("result") String verdict,
    @JsonProperty("word_count") int wordCount,
    @JsonProperty("reading_time_minutes") int readingTimeMinutes)
    implements JobResult {

  @JsonProperty("reading_time")
  public String readingTime() {
    return readingTimeMinutes + (readingTimeMinutes == 1 ? " minute" : " minutes");
  }
}
