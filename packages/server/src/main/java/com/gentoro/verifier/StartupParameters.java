package com.gentoro.verifier;

import com.gentoro.verifier.exception.ConfigException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.Map;

/**
 * Parses {@code --name=value} command-line arguments. A bare {@code --flag} is stored as {@code
 * "true"}.
 */
public final class StartupParameters {
  private final Map<String, String> parameters = new HashMap<>();

  public StartupParameters(String[] args) {
    if (args == null) return;
    for (String arg : args) {
      if (arg == null || !arg.startsWith("--") || arg.length() <= 2) {
        throw new ConfigException("Unrecognized argument: " + arg);
      }
      String body = arg.substring(2);
      int eq = body.indexOf('=');
      if (eq < 0) {
        parameters.put(body, "true");
      } else {
        parameters.put(body.substring(0, eq), body.substring(eq + 1));
      }
    }
  }

  /** External configuration file given by {@code --config}, or {@code null} when absent. */
  public Path configFile() {
    String value = parameters.get("config");
    if (value == null || value.isBlank()) return null;
    Path path = Path.of(value);
    if (!Files.isRegularFile(path)) {
      throw new ConfigException("Configuration file not found: " + path.toAbsolutePath());
    }
    return path;
  }
}
