package com.gentoro.verifier.config;

import com.gentoro.verifier.exception.ConfigException;
import java.nio.file.Path;
import org.apache.commons.configuration2.Configuration;

/**
 * Immutable snapshot of everything the service reads from configuration, resolved once at startup
 * and handed to each component's constructor.
 */
public record ServiceSettings(
    String serviceName,
    String endpointUrl,
    Path logoFile,
    String httpHostname,
    int httpPort,
    int workerThreads,
    int minTextLength,
    int maxTextLength,
    InferenceSettings inference,
    ChainSettings chain,
    SigningSettings signing) {

  public static ServiceSettings from(Configuration config) {
    int min = ConfigValues.positiveInt(config, "jobs.min-text-length", 50);
    int max = ConfigValues.positiveInt(config, "jobs.max-text-length", 400_000);
    if (min > max) {
      throw new ConfigException(
          "jobs.min-text-length (%d) exceeds jobs.max-text-length (%d)".formatted(min, max));
    }
    return new ServiceSettings(
        ConfigValues.string(config, "service.name", "Verifier Agent"),
        ConfigValues.string(config, "service.endpoint-url", "http://localhost:4021/verify"),
        logoFile(config),
        ConfigValues.string(config, "http.hostname", "0.0.0.0"),
        ConfigValues.positiveInt(config, "http.port", 4021),
        ConfigValues.positiveInt(config, "jobs.worker-threads", 4),
        min,
        max,
        InferenceSettings.from(config),
        ChainSettings.from(config),
        SigningSettings.from(config));
  }

  private static Path logoFile(Configuration config) {
    String value = ConfigValues.string(config, "service.logo-file", "");
    return value.isEmpty() ? null : Path.of(value);
  }
}
