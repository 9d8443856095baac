package com.gentoro.verifier.inference;

import com.gentoro.verifier.config.InferenceSettings;
import com.gentoro.verifier.exception.ConfigException;
import com.gentoro.verifier.http.OkHttpFactory;
import com.openai.client.okhttp.OpenAIOkHttpClient;
import org.apache.commons.lang3.StringUtils;

/** Creates the {@link InferenceClient} selected by {@code inference.provider}. */
public final class InferenceClientFactory {
  private static final org.slf4j.Logger log =
      com.gentoro.verifier.logging.LoggingService.getLogger(InferenceClientFactory.class);

  private InferenceClientFactory() {}

  public static InferenceClient create(InferenceSettings settings) {
    log.info("Using inference backend {}", settings);
    return switch (settings.provider()) {
      case OLLAMA ->
          new OllamaInferenceClient(
              OkHttpFactory.create(settings.timeout()),
              settings.endpoint(),
              settings.model(),
              settings.timeout());
      case OPENAI -> {
        if (StringUtils.isBlank(settings.apiKey())) {
          throw new ConfigException("inference.api-key is required for the openai provider");
        }
        yield new OpenAiInferenceClient(
            OpenAIOkHttpClient.builder()
                .apiKey(settings.apiKey())
                .baseUrl(settings.endpoint())
                .timeout(settings.timeout())
                .maxRetries(0)
                .build(),
            settings.model(),
            settings.timeout());
      }
    };
  }
}
