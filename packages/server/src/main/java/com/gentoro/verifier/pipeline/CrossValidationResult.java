package com.gentoro.verifier.pipeline;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.gentoro.verifier.chain.ChainJobDetails;
import com.gentoro.verifier.jobs.JobResult;

/**
 * Outcome of a completed cross-validation.
 *
 * @param reputationTransactionHash confirmed write-back transaction
 * @param eventFound whether a request event was confirmed; false when confirmation was skipped
 */
public record CrossValidationResult(
    @JsonProperty("ai_score") int score,
    @JsonProperty("reputation_tx_id") String reputationTransactionHash,
    @JsonProperty("event_found") boolean eventFound,
    @JsonProperty("job_details") ChainJobDetails jobDetails)
    implements JobResult {}
