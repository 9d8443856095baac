package com.gentoro.verifier;

import static org.junit.jupiter.api.Assertions.*;

import com.gentoro.verifier.exception.ConfigException;
import java.nio.file.Files;
import java.nio.file.Path;
import org.apache.commons.configuration2.Configuration;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ConfigurationProviderTest {

  @Test
  void bundledDefaultsAreLoaded() {
    Configuration config = new ConfigurationProvider(null).config();
    assertEquals(4021, config.getInt("http.port"));
    assertEquals("qwen2:0.5b", config.getString("inference.model"));
    assertEquals(296, config.getInt("chain.id"));
  }

  @Test
  void externalFileOverridesDefaults(@TempDir Path dir) throws Exception {
    Path file = dir.resolve("override.yaml");
    Files.writeString(file, "http:\n  port: 9090\ninference:\n  model: \"llama3\"\n");

    StartupParameters params = new StartupParameters(new String[] {"--config=" + file});
    Configuration config = new ConfigurationProvider(params.configFile()).config();

    assertEquals(9090, config.getInt("http.port"));
    assertEquals("llama3", config.getString("inference.model"));
    assertEquals("0.0.0.0", config.getString("http.hostname"));
  }

  @Test
  void missingExternalFileIsAConfigurationError() {
    StartupParameters params = new StartupParameters(new String[] {"--config=/no/such/file.yaml"});
    assertThrows(ConfigException.class, params::configFile);
  }

  @Test
  void argumentsMustUseDoubleDashSyntax() {
    assertThrows(ConfigException.class, () -> new StartupParameters(new String[] {"config"}));
    assertNull(new StartupParameters(new String[] {"--debug"}).configFile());
    assertNull(new StartupParameters(new String[] {"--config="}).configFile());
  }
}
