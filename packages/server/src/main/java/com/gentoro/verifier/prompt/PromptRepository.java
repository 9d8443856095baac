package com.gentoro.verifier.prompt;

import com.gentoro.verifier.exception.ConfigException;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/** Loads prompt templates from {@code prompts/<name>.txt} on the classpath and caches them. */
public final class PromptRepository {
  private static final org.slf4j.Logger log =
      com.gentoro.verifier.logging.LoggingService.getLogger(PromptRepository.class);

  public static final String DISPUTE_RESOLUTION = "dispute-resolution";
  public static final String CROSS_VALIDATION_RUBRIC = "cross-validation-rubric";
  public static final String JOB_CONTEXT = "job-context";

  private final ClassLoader classLoader;
  private final Map<String, PromptTemplate> cache = new ConcurrentHashMap<>();

  public PromptRepository() {
    this(PromptRepository.class.getClassLoader());
  }

  public PromptRepository(ClassLoader classLoader) {
    this.classLoader = classLoader;
  }

  public PromptTemplate get(String name) {
    return cache.computeIfAbsent(name, this::load);
  }

  private PromptTemplate load(String name) {
    String resource = "prompts/" + name + ".txt";
    try (InputStream in = classLoader.getResourceAsStream(resource)) {
      if (in == null) {
        throw new ConfigException("Prompt resource not found: " + resource);
      }
      String text = new String(in.readAllBytes(), StandardCharsets.UTF_8).strip();
      log.debug("Loaded prompt '{}' ({} chars)", name, text.length());
      return new PromptTemplate(name, text);
    } catch (IOException e) {
      throw new ConfigException("Failed to read prompt resource: " + resource, e);
    }
  }
}
