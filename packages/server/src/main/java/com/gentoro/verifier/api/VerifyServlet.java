package com.gentoro.verifier.api;

import com.fasterxml.jackson.databind.JsonNode;
import com.gentoro.verifier.exception.JobNotFoundException;
import com.gentoro.verifier.exception.ValidationException;
import com.gentoro.verifier.jobs.JobType;
import com.gentoro.verifier.service.StatusQueryService;
import com.gentoro.verifier.service.SubmissionService;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;

/**
 * POST /verify submits free text for a dispute verdict; GET /verify/{id} returns the signed status.
 */
public final class VerifyServlet extends JsonServlet {
  private final transient SubmissionService submissions;
  private final transient StatusQueryService status;

  public VerifyServlet(SubmissionService submissions, StatusQueryService status) {
    this.submissions = submissions;
    this.status = status;
  }

  @Override
  protected void doPost(HttpServletRequest req, HttpServletResponse resp) throws IOException {
    try {
      JsonNode body = readObject(req);
      JsonNode jobData = body.get("job_data");
      if (jobData == null || !jobData.isTextual()) {
        throw new ValidationException("job_data must be a string");
      }
      writeJson(resp, 200, submissions.submitVerification(jobData.asText()));
    } catch (Exception e) {
      writeError(resp, e);
    }
  }

  @Override
  protected void doGet(HttpServletRequest req, HttpServletResponse resp) throws IOException {
    try {
      String id = pathId(req);
      if (id == null) {
        throw new JobNotFoundException(null);
      }
      writeJson(resp, 200, status.get(id, JobType.VERIFICATION));
    } catch (Exception e) {
      writeError(resp, e);
    }
  }
}
