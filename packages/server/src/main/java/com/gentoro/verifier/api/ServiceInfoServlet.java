package com.gentoro.verifier.api;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** GET / returns service information. Mapped as the default servlet, so other paths get 404. */
public final class ServiceInfoServlet extends JsonServlet {
  private final transient Map<String, Object> info;

  public ServiceInfoServlet(ServiceInfo info) {
    Map<String, Object> out = new LinkedHashMap<>();
    out.put("service", info.serviceName());
    out.put("endpoint", "POST /verify");
    out.put("endpoint_url", info.endpointUrl());
    out.put(
        "endpoints",
        info.crossValidationEnabled()
            ? List.of(
                "POST /verify",
                "GET /verify/{job_id}",
                "POST /validate",
                "GET /validate/{validation_id}")
            : List.of("POST /verify", "GET /verify/{job_id}"));
    out.put("ai_provider", info.provider());
    out.put("model", info.model());
    out.put("cross_validation_enabled", info.crossValidationEnabled());
    out.put("signing_enabled", info.publicKey() != null);
    if (info.publicKey() != null) {
      out.put("public_key", info.publicKey());
    }
    this.info = Collections.unmodifiableMap(out);
  }

  @Override
  protected void doGet(HttpServletRequest req, HttpServletResponse resp) throws IOException {
    String path = req.getServletPath() + (req.getPathInfo() == null ? "" : req.getPathInfo());
    if (!path.isEmpty() && !"/".equals(path)) {
      writeJson(resp, 404, Map.of("detail", "Not Found"));
      return;
    }
    writeJson(resp, 200, info);
  }

  /**
   * @param endpointUrl public URL this agent advertises for verification requests
   * @param publicKey signer public key, {@code null} when responses are not signed
   */
  public record ServiceInfo(
      String serviceName,
      String endpointUrl,
      String provider,
      String model,
      boolean crossValidationEnabled,
      String publicKey) {}
}
