package com.gentoro.verifier;

import com.gentoro.verifier.exception.ConfigException;
import java.io.InputStream;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import org.apache.commons.configuration2.CombinedConfiguration;
import org.apache.commons.configuration2.Configuration;
import org.apache.commons.configuration2.YAMLConfiguration;
import org.apache.commons.configuration2.tree.OverrideCombiner;

/**
 * Loads the bundled {@code application.yaml} and, when given, an external YAML file whose values
 * override the bundled ones. Values may reference environment variables as {@code ${env:NAME}}.
 */
public final class ConfigurationProvider {
  static final String DEFAULT_RESOURCE = "application.yaml";

  private static final org.slf4j.Logger log =
      com.gentoro.verifier.logging.LoggingService.getLogger(ConfigurationProvider.class);

  private final Configuration config;

  public ConfigurationProvider(Path externalFile) {
    CombinedConfiguration combined = new CombinedConfiguration(new OverrideCombiner());
    if (externalFile != null) {
      combined.addConfiguration(loadFile(externalFile), "external");
      log.info("Loaded configuration overrides from {}", externalFile.toAbsolutePath());
    }
    combined.addConfiguration(loadResource(DEFAULT_RESOURCE), "defaults");
    this.config = combined;
  }

  public Configuration config() {
    return config;
  }

  private static YAMLConfiguration loadResource(String resource) {
    YAMLConfiguration yaml = new YAMLConfiguration();
    try (InputStream in =
        ConfigurationProvider.class.getClassLoader().getResourceAsStream(resource)) {
      if (in == null) {
        throw new ConfigException("Missing bundled configuration resource: " + resource);
      }
      yaml.read(in);
      return yaml;
    } catch (ConfigException e) {
      throw e;
    } catch (Exception e) {
      throw new ConfigException("Failed to read bundled configuration: " + resource, e);
    }
  }

  private static YAMLConfiguration loadFile(Path file) {
    YAMLConfiguration yaml = new YAMLConfiguration();
    try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
      yaml.read(reader);
      return yaml;
    } catch (Exception e) {
      throw new ConfigException("Failed to read configuration file: " + file, e);
    }
  }
}
