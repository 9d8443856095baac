package com.gentoro.verifier;

import com.gentoro.verifier.api.ServiceInfoServlet;
import com.gentoro.verifier.api.VerifierApi;
import com.gentoro.verifier.chain.ChainAdapter;
import com.gentoro.verifier.chain.ChainClient;
import com.gentoro.verifier.chain.Web3jChainClient;
import com.gentoro.verifier.config.ServiceSettings;
import com.gentoro.verifier.exception.NetworkException;
import com.gentoro.verifier.exception.StateException;
import com.gentoro.verifier.http.EmbeddedJettyServer;
import com.gentoro.verifier.http.OkHttpFactory;
import com.gentoro.verifier.inference.InferenceClient;
import com.gentoro.verifier.inference.InferenceClientFactory;
import com.gentoro.verifier.jobs.InMemoryJobStore;
import com.gentoro.verifier.jobs.JobManager;
import com.gentoro.verifier.jobs.JobType;
import com.gentoro.verifier.pipeline.CrossValidationHandler;
import com.gentoro.verifier.pipeline.VerificationHandler;
import com.gentoro.verifier.prompt.PromptRepository;
import com.gentoro.verifier.scoring.AiScoringAdapter;
import com.gentoro.verifier.service.StatusQueryService;
import com.gentoro.verifier.service.SubmissionService;
import com.gentoro.verifier.signing.Secp256k1ResponseSigner;
import com.gentoro.verifier.signing.SigningEnvelope;
import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.atomic.AtomicBoolean;
import org.apache.commons.configuration2.Configuration;

/** Owns the service's components and their lifecycle. */
public class VerifierAgent {
  private static final org.slf4j.Logger log =
      com.gentoro.verifier.logging.LoggingService.getLogger(VerifierAgent.class);

  private final StartupParameters startupParameters;
  private ConfigurationProvider configurationProvider;
  private ServiceSettings settings;
  private EmbeddedJettyServer httpServer;
  private JobManager jobManager;
  private ChainClient chainClient;
  private SubmissionService submissionService;
  private StatusQueryService statusQueryService;
  private final AtomicBoolean shuttingDown = new AtomicBoolean(false);
  private final CountDownLatch shutdownLatch = new CountDownLatch(1);
  private volatile Thread shutdownHook;

  public VerifierAgent(String[] applicationArgs) {
    this.startupParameters = new StartupParameters(applicationArgs);
  }

  public void initialize() {
    this.configurationProvider = new ConfigurationProvider(startupParameters.configFile());
    // apply logging levels as early as possible
    com.gentoro.verifier.logging.LoggingService.applyConfiguration(configuration());
    this.settings = ServiceSettings.from(configuration());
    log.info("Starting {} with {}", settings.serviceName(), settings.inference());

    PromptRepository prompts = new PromptRepository();
    InferenceClient inference = InferenceClientFactory.create(settings.inference());
    AiScoringAdapter scoring = new AiScoringAdapter(inference, prompts);

    this.jobManager = new JobManager(new InMemoryJobStore(), settings.workerThreads());
    jobManager.register(JobType.VERIFICATION, new VerificationHandler(scoring));

    if (settings.chain().isConfigured()) {
      log.info("Cross-validation enabled: {}", settings.chain());
      this.chainClient =
          new Web3jChainClient(settings.chain(), OkHttpFactory.create(Duration.ofSeconds(30)));
      jobManager.register(
          JobType.CROSS_VALIDATION,
          new CrossValidationHandler(new ChainAdapter(chainClient, settings.chain()), scoring));
    } else {
      log.warn(
          "Cross-validation disabled: chain.private-key and chain.jobs-module-address are required");
    }

    SigningEnvelope envelope =
        new SigningEnvelope(
            settings.signing().isEnabled()
                ? new Secp256k1ResponseSigner(settings.signing().privateKey())
                : null);
    envelope.publicKey().ifPresentOrElse(
        key -> log.info("Signing responses with public key {}", key),
        () -> log.info("Response signing disabled"));

    this.submissionService =
        new SubmissionService(
            jobManager,
            settings.minTextLength(),
            settings.maxTextLength(),
            inference.provider(),
            Clock.systemUTC());
    this.statusQueryService = new StatusQueryService(jobManager, envelope);

    this.httpServer = new EmbeddedJettyServer(settings.httpHostname(), settings.httpPort());
    httpServer.prepare();
    try {
      new VerifierApi(
              submissionService,
              statusQueryService,
              new ServiceInfoServlet.ServiceInfo(
                  settings.serviceName(),
                  settings.endpointUrl(),
                  inference.provider(),
                  inference.model(),
                  submissionService.isCrossValidationEnabled(),
                  envelope.publicKey().orElse(null)),
              settings.logoFile())
          .register(httpServer.getContextHandler());
      httpServer.start();
    } catch (RuntimeException e) {
      shutdown();
      throw new NetworkException("Could not start http server", e);
    }
  }

  /**
   * Block the current thread until a shutdown signal is received (e.g., Ctrl+C or JVM termination).
   * When signaled, this method invokes {@link #shutdown()} to release resources before returning.
   */
  public void waitShutdownSignal() {
    if (shutdownHook == null) {
      synchronized (this) {
        if (shutdownHook == null) {
          shutdownHook = new Thread(this::shutdown, "verifier-shutdown-hook");
          Runtime.getRuntime().addShutdownHook(shutdownHook);
        }
      }
    }
    try {
      shutdownLatch.await();
    } catch (InterruptedException ie) {
      Thread.currentThread().interrupt();
    }
  }

  /** Release resources. Safe to call multiple times; executed only once. */
  public void shutdown() {
    if (!shuttingDown.compareAndSet(false, true)) return;
    try {
      closeQuietly("http server", httpServer);
      closeQuietly("job manager", jobManager);
      closeQuietly("chain client", chainClient);
    } finally {
      shutdownLatch.countDown();
    }
  }

  private void closeQuietly(String name, AutoCloseable closeable) {
    if (closeable == null) return;
    try {
      closeable.close();
    } catch (Exception e) {
      log.warn("Failed to close {}", name, e);
    }
  }

  public Configuration configuration() {
    if (configurationProvider == null) {
      throw new StateException("VerifierAgent not initialized. Call initialize() first.");
    }
    return configurationProvider.config();
  }

  public ServiceSettings settings() {
    return settings;
  }

  public EmbeddedJettyServer httpServer() {
    return httpServer;
  }

  public SubmissionService submissionService() {
    return submissionService;
  }

  public StatusQueryService statusQueryService() {
    return statusQueryService;
  }
}
