package com.gentoro.verifier.jobs;

/**
 * Marker for the result payload of a completed job. Implementations are immutable and serialize
 * to flat JSON fields that are merged into the status record.
 */
public interface JobResult {}
