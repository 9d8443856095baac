package com.gentoro.verifier.service;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Immediate answer to a submission.
 *
 * @param provider inference backend, reported for verification submissions only
 * @param timestamp epoch seconds
 */
public record SubmissionReceipt(
    @JsonProperty("job_id") String jobId,
    @JsonProperty("status") String status,
    @JsonProperty("status_url") String statusUrl,
    @JsonProperty("provider") String provider,
    @JsonProperty("timestamp") long timestamp) {}
