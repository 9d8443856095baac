package com.gentoro.verifier.api;

import static org.junit.jupiter.api.Assertions.*;

import com.gentoro.verifier.utility.JacksonUtility;
import java.nio.file.Files;
import java.nio.file.Path;
import org.eclipse.jetty.ee10.servlet.ServletHolder;
import org.eclipse.jetty.ee10.servlet.ServletTester;
import org.eclipse.jetty.http.HttpTester;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class LogoServletTest {
  private static final byte[] PNG_HEADER = {(byte) 0x89, 'P', 'N', 'G', '\r', '\n', 0x1a, '\n'};

  private static HttpTester.Response fetchLogo(Path logoFile) throws Exception {
    ServletTester tester = new ServletTester();
    tester.addServlet(new ServletHolder(new LogoServlet(logoFile)), "/logo.png");
    tester.start();
    try {
      HttpTester.Request req = HttpTester.newRequest();
      req.setMethod("GET");
      req.setURI("/logo.png");
      req.setVersion("HTTP/1.1");
      req.setHeader("Host", "tester");
      return HttpTester.parseResponse(tester.getResponses(req.generate()));
    } finally {
      tester.stop();
    }
  }

  @Test
  void servesConfiguredImage(@TempDir Path dir) throws Exception {
    Path logo = dir.resolve("logo.png");
    Files.write(logo, PNG_HEADER);

    HttpTester.Response resp = fetchLogo(logo);

    assertEquals(200, resp.getStatus());
    assertEquals("image/png", resp.get("Content-Type"));
    assertArrayEquals(PNG_HEADER, resp.getContentBytes());
  }

  @Test
  void missingOrUnconfiguredLogoIsNotFound(@TempDir Path dir) throws Exception {
    for (Path logo : new Path[] {null, dir.resolve("absent.png")}) {
      HttpTester.Response resp = fetchLogo(logo);
      assertEquals(404, resp.getStatus());
      assertEquals(
          "Logo not found",
          JacksonUtility.getJsonMapper().readTree(resp.getContent()).get("detail").asText());
    }
  }
}
