package com.gentoro.verifier.api;

import com.fasterxml.jackson.databind.JsonNode;
import com.gentoro.verifier.chain.JobReference;
import com.gentoro.verifier.exception.JobNotFoundException;
import com.gentoro.verifier.exception.ValidationException;
import com.gentoro.verifier.jobs.JobType;
import com.gentoro.verifier.pipeline.CrossValidationRequest;
import com.gentoro.verifier.service.StatusQueryService;
import com.gentoro.verifier.service.SubmissionReceipt;
import com.gentoro.verifier.service.SubmissionService;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.math.BigInteger;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * POST /validate starts a cross-validation of an on-chain job; GET /validate/{id} returns the
 * signed status.
 *
 * <p>Request body: {@code {"job_id": "0x..", "transaction_id": "0x..", "verifier_agent_id": 7}},
 * the last two optional.
 */
public final class ValidateServlet extends JsonServlet {
  private final transient SubmissionService submissions;
  private final transient StatusQueryService status;

  public ValidateServlet(SubmissionService submissions, StatusQueryService status) {
    this.submissions = submissions;
    this.status = status;
  }

  @Override
  protected void doPost(HttpServletRequest req, HttpServletResponse resp) throws IOException {
    try {
      JsonNode body = readObject(req);
      CrossValidationRequest request =
          new CrossValidationRequest(
              JobReference.parse(optionalText(body, "job_id")),
              optionalText(body, "transaction_id"),
              verifierId(body.get("verifier_agent_id")));
      SubmissionReceipt receipt = submissions.submitCrossValidation(request);

      Map<String, Object> out = new LinkedHashMap<>();
      out.put("validation_id", receipt.jobId());
      out.put("status", receipt.status());
      out.put("status_url", receipt.statusUrl());
      out.put("timestamp", receipt.timestamp());
      writeJson(resp, 200, out);
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
      writeJson(resp, 200, status.get(id, JobType.CROSS_VALIDATION));
    } catch (Exception e) {
      writeError(resp, e);
    }
  }

  private static String optionalText(JsonNode body, String field) {
    JsonNode node = body.get(field);
    if (node == null || node.isNull()) return null;
    if (!node.isTextual()) {
      throw new ValidationException(field + " must be a string");
    }
    return node.asText();
  }

  private static BigInteger verifierId(JsonNode node) {
    if (node == null || node.isNull()) return null;
    if (node.isIntegralNumber()) return node.bigIntegerValue();
    if (node.isTextual()) {
      try {
        return new BigInteger(node.asText().trim());
      } catch (NumberFormatException e) {
        throw new ValidationException("verifier_agent_id must be an integer", e);
      }
    }
    throw new ValidationException("verifier_agent_id must be an integer");
  }
}
