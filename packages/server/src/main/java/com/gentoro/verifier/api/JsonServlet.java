package com.gentoro.verifier.api;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.gentoro.verifier.exception.ErrorDetails;
import com.gentoro.verifier.exception.ExceptionUtil;
import com.gentoro.verifier.exception.ValidationException;
import com.gentoro.verifier.exception.VerifierErrorCode;
import com.gentoro.verifier.utility.JacksonUtility;
import jakarta.servlet.http.HttpServlet;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.io.InputStream;
import java.util.Map;

/**
 * Shared JSON plumbing for the public endpoints. Errors are rendered as {@code {"detail": "..."}}
 * with the status derived from the exception's error code.
 */
abstract class JsonServlet extends HttpServlet {
  private static final org.slf4j.Logger log =
      com.gentoro.verifier.logging.LoggingService.getLogger(JsonServlet.class);

  protected final transient ObjectMapper mapper = JacksonUtility.getJsonMapper();

  protected void writeJson(HttpServletResponse resp, int status, Object body) throws IOException {
    resp.setStatus(status);
    resp.setContentType("application/json");
    resp.setCharacterEncoding("UTF-8");
    mapper.writeValue(resp.getWriter(), body);
  }

  protected void writeError(HttpServletResponse resp, Exception e) throws IOException {
    ErrorDetails error = ExceptionUtil.toErrorDetails(e);
    int status = statusFor(error.code());
    String detail = error.message();
    if (status == 500) {
      log.error("Request failed [{}] {}", error.code(), error.context(), e);
      detail = "Internal server error: " + detail;
    }
    writeJson(resp, status, Map.of("detail", detail));
  }

  static int statusFor(VerifierErrorCode code) {
    return switch (code) {
      case VALIDATION_ERROR -> 400;
      case NOT_FOUND -> 404;
      case STATE_ERROR -> 503;
      default -> 500;
    };
  }

  /**
   * @throws ValidationException when the body is empty, not JSON, or not an object
   */
  protected JsonNode readObject(HttpServletRequest req) throws IOException {
    JsonNode node;
    try (InputStream in = req.getInputStream()) {
      byte[] body = in.readAllBytes();
      if (body.length == 0) {
        throw new ValidationException("Empty request body");
      }
      node = mapper.readTree(body);
    } catch (com.fasterxml.jackson.core.JsonProcessingException e) {
      throw new ValidationException("Request body is not valid JSON", e);
    }
    if (node == null || !node.isObject()) {
      throw new ValidationException("Request body must be a JSON object");
    }
    return node;
  }

  /** Single path segment after the servlet mapping, or {@code null}. */
  protected static String pathId(HttpServletRequest req) {
    String pathInfo = req.getPathInfo();
    if (pathInfo == null || pathInfo.length() <= 1) return null;
    String id = pathInfo.substring(1);
    return id.contains("/") ? null : id;
  }
}
