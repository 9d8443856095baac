package com.gentoro.verifier.http;

import com.gentoro.verifier.exception.ConfigException;
import com.gentoro.verifier.exception.ExceptionUtil;
import com.gentoro.verifier.exception.NetworkException;
import org.eclipse.jetty.ee10.servlet.ServletContextHandler;
import org.eclipse.jetty.server.Server;
import org.eclipse.jetty.server.ServerConnector;
import org.eclipse.jetty.util.thread.QueuedThreadPool;

/**
 * Embedded Jetty 12 server with a root {@link ServletContextHandler}.
 *
 * <p>This class owns the Jetty lifecycle (prepare/start/stop/join). Components register their
 * servlets on {@link #getContextHandler()} between {@link #prepare()} and {@link #start()}.
 */
public class EmbeddedJettyServer implements AutoCloseable {
  private static final org.slf4j.Logger log =
      com.gentoro.verifier.logging.LoggingService.getLogger(EmbeddedJettyServer.class);

  private final String hostname;
  private final int port;
  private final Object lifecycleLock = new Object();
  private Server server;
  private ServletContextHandler contextHandler;

  /** @param port listening port, 0 picks a free one */
  public EmbeddedJettyServer(String hostname, int port) {
    if (hostname == null || hostname.isBlank()) {
      throw new ConfigException("Missing http.hostname configuration");
    }
    this.hostname = hostname.trim();
    this.port = port;
  }

  /** Prepare the Jetty Server and root ServletContextHandler without starting it. */
  public void prepare() {
    synchronized (lifecycleLock) {
      if (server != null) {
        log.trace("Server already prepared");
        return;
      }
      try {
        QueuedThreadPool threadPool = new QueuedThreadPool();
        threadPool.setDaemon(true);
        threadPool.setName("jetty-http");
        server = new Server(threadPool);

        ServerConnector connector = new ServerConnector(server);
        if (!hostname.equals("0.0.0.0")) {
          connector.setHost(hostname);
        }
        connector.setPort(port);
        server.addConnector(connector);

        contextHandler = new ServletContextHandler();
        contextHandler.setContextPath("/");
        server.setHandler(contextHandler);
      } catch (Exception e) {
        throw new NetworkException("Failed to initialize the HTTP server", e);
      }
    }
  }

  /** Start Jetty if not already started. */
  public void start() {
    synchronized (lifecycleLock) {
      if (server != null && server.isStarted()) {
        log.trace("Server already started");
        return;
      }
      if (server == null) {
        log.warn("Called start() before prepare()");
        prepare();
      }
      try {
        server.start();
        log.info("Jetty listening on http://{}:{}", hostname, getPort());
      } catch (Exception e) {
        throw ExceptionUtil.rethrowIfUnchecked(
            e,
            ex ->
                new NetworkException(
                    "Could not start the HTTP listener on %s:%d. Check that the address is free and this process may bind it"
                        .formatted(hostname, port),
                    ex));
      }
    }
  }

  public void stop() {
    synchronized (lifecycleLock) {
      if (server == null) return;
      Server s = server;
      try {
        if (s.isRunning() || s.isStarting()) {
          s.setStopTimeout(2000);
          s.stop();
        }
      } catch (Exception e) {
        log.error("Error stopping Jetty server; continuing shutdown", e);
      } finally {
        server = null;
        contextHandler = null;
      }
    }
  }

  public void join() throws InterruptedException {
    Server s;
    synchronized (lifecycleLock) {
      s = this.server;
    }
    if (s != null) s.join();
  }

  public boolean isRunning() {
    synchronized (lifecycleLock) {
      return server != null && server.isRunning();
    }
  }

  /** Bound port once started, the configured port otherwise. */
  public int getPort() {
    synchronized (lifecycleLock) {
      if (server != null && server.isStarted()) {
        return ((ServerConnector) server.getConnectors()[0]).getLocalPort();
      }
      return port;
    }
  }

  public ServletContextHandler getContextHandler() {
    synchronized (lifecycleLock) {
      return contextHandler;
    }
  }

  @Override
  public void close() {
    stop();
  }
}
