package com.gentoro.verifier;

public class VerifierAgentApp {

  private static final org.slf4j.Logger log =
      com.gentoro.verifier.logging.LoggingService.getLogger(VerifierAgentApp.class);

  public static void main(String[] args) {
    try {
      VerifierAgent app = new VerifierAgent(args);
      app.initialize();
      app.waitShutdownSignal();
    } catch (Exception e) {
      log.error("Application failed to start", e);
      System.exit(1);
    }
  }
}
