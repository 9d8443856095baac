package com.gentoro.verifier.api;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

/** GET /logo.png serves the configured agent logo, or 404 when none is present. */
public final class LogoServlet extends JsonServlet {
  private final transient Path logoFile;

  public LogoServlet(Path logoFile) {
    this.logoFile = logoFile;
  }

  @Override
  protected void doGet(HttpServletRequest req, HttpServletResponse resp) throws IOException {
    if (logoFile == null || !Files.isRegularFile(logoFile)) {
      writeJson(resp, 404, Map.of("detail", "Logo not found"));
      return;
    }
    resp.setStatus(200);
    resp.setContentType("image/png");
    resp.setContentLengthLong(Files.size(logoFile));
    Files.copy(logoFile, resp.getOutputStream());
  }
}
