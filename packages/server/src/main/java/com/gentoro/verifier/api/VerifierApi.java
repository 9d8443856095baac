package com.gentoro.verifier.api;

import com.gentoro.verifier.service.StatusQueryService;
import com.gentoro.verifier.service.SubmissionService;
import java.nio.file.Path;
import org.eclipse.jetty.ee10.servlet.ServletContextHandler;
import org.eclipse.jetty.ee10.servlet.ServletHolder;

/** Registers the public endpoints on a servlet context. */
public final class VerifierApi {
  private static final org.slf4j.Logger log =
      com.gentoro.verifier.logging.LoggingService.getLogger(VerifierApi.class);

  private final SubmissionService submissions;
  private final StatusQueryService status;
  private final ServiceInfoServlet.ServiceInfo info;
  private final Path logoFile;

  /**
   * @param logoFile image served at {@code /logo.png}, or {@code null} when the agent has none
   */
  public VerifierApi(
      SubmissionService submissions,
      StatusQueryService status,
      ServiceInfoServlet.ServiceInfo info,
      Path logoFile) {
    this.submissions = submissions;
    this.status = status;
    this.info = info;
    this.logoFile = logoFile;
  }

  public void register(ServletContextHandler context) {
    context.addServlet(new ServletHolder(new ServiceInfoServlet(info)), "/");
    context.addServlet(new ServletHolder(new LogoServlet(logoFile)), "/logo.png");
    context.addServlet(new ServletHolder(new VerifyServlet(submissions, status)), "/verify/*");
    context.addServlet(new ServletHolder(new ValidateServlet(submissions, status)), "/validate/*");
    if (!info.crossValidationEnabled()) {
      log.warn("Chain access is not configured; POST /validate will answer 503");
    }
  }
}
