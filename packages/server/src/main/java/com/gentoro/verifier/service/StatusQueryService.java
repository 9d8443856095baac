package com.gentoro.verifier.service;

import com.gentoro.verifier.exception.JobNotFoundException;
import com.gentoro.verifier.jobs.JobManager;
import com.gentoro.verifier.jobs.JobRecord;
import com.gentoro.verifier.jobs.JobType;
import com.gentoro.verifier.signing.SigningEnvelope;
import com.gentoro.verifier.utility.JacksonUtility;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Read side of the job store. Every call renders the current snapshot and signs it again; no
 * signature is cached.
 */
public class StatusQueryService {
  private final JobManager jobs;
  private final SigningEnvelope envelope;

  public StatusQueryService(JobManager jobs, SigningEnvelope envelope) {
    this.jobs = jobs;
    this.envelope = envelope;
  }

  /**
   * @param expectedType when non-null, records of another type are reported as not found
   * @throws JobNotFoundException when no such job exists
   */
  public Map<String, Object> get(String jobId, JobType expectedType) {
    JobRecord record =
        jobs.find(jobId)
            .filter(r -> expectedType == null || r.type() == expectedType)
            .orElseThrow(() -> new JobNotFoundException(jobId));
    return envelope.sign(toPayload(record));
  }

  static Map<String, Object> toPayload(JobRecord record) {
    Map<String, Object> payload = new LinkedHashMap<>();
    payload.put("job_id", record.id());
    payload.put("type", record.type().wireName());
    payload.put("status", record.status().wireName());
    payload.put("created_at", record.createdAt().getEpochSecond());
    if (record.finishedAt() != null) {
      payload.put("finished_at", record.finishedAt().getEpochSecond());
    }
    if (record.result() != null) {
      payload.putAll(JacksonUtility.toMap(record.result()));
    }
    if (record.failure() != null) {
      payload.putAll(JacksonUtility.toMap(record.failure()));
    }
    return payload;
  }
}
