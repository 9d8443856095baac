package com.gentoro.verifier.config;

import com.gentoro.verifier.exception.ConfigException;
import java.time.Duration;
import java.util.Locale;
import org.apache.commons.configuration2.Configuration;

/** Inference backend selection and connection parameters. */
public record InferenceSettings(
    Provider provider, String endpoint, String model, String apiKey, Duration timeout) {

  public enum Provider {
    /** Ollama native chat API ({@code POST /api/chat}). */
    OLLAMA,
    /** Any OpenAI compatible Chat Completions endpoint. */
    OPENAI
  }

  public static InferenceSettings from(Configuration config) {
    String providerName = ConfigValues.string(config, "inference.provider", "ollama");
    Provider provider;
    try {
      provider = Provider.valueOf(providerName.toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException e) {
      throw new ConfigException("Unsupported inference.provider: " + providerName, e);
    }
    String endpoint = ConfigValues.string(config, "inference.endpoint", "http://localhost:11434");
    String model = ConfigValues.string(config, "inference.model", "qwen2:0.5b");
    String apiKey = ConfigValues.string(config, "inference.api-key", "");
    long timeoutSeconds = ConfigValues.positiveLong(config, "inference.timeout-seconds", 120);
    return new InferenceSettings(
        provider, stripTrailingSlash(endpoint), model, apiKey, Duration.ofSeconds(timeoutSeconds));
  }

  private static String stripTrailingSlash(String url) {
    String result = url;
    while (result.endsWith("/")) result = result.substring(0, result.length() - 1);
    return result;
  }

  @Override
  public String toString() {
    return "InferenceSettings[provider=%s, endpoint=%s, model=%s, timeout=%s]"
        .formatted(provider, endpoint, model, timeout);
  }
}
