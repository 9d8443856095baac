package com.gentoro.verifier.jobs;

/**
 * SPI implemented by pipeline executors.
 *
 * @param <Q> request type accepted by the handler
 */
public interface JobHandler<Q> {
  /**
   * Run the pipeline to completion.
   *
   * @return the result stored on the Completed record
   * @throws JobStepException when a step fails in an expected way; its message and context become
   *     the Failed record
   * @throws Exception any other failure; recorded as Failed with the exception's message
   */
  JobResult execute(JobContext ctx, Q request) throws Exception;
}
