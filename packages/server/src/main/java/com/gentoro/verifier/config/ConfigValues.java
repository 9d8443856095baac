package com.gentoro.verifier.config;

import com.gentoro.verifier.exception.ConfigException;
import org.apache.commons.configuration2.Configuration;
import org.apache.commons.lang3.StringUtils;

/** Typed reads over a {@link Configuration} that treat unresolved placeholders as absent. */
final class ConfigValues {
  private ConfigValues() {}

  static String string(Configuration config, String key, String defaultValue) {
    String value;
    try {
      value = config.getString(key, defaultValue);
    } catch (Exception e) {
      throw new ConfigException("Failed to resolve configuration key: " + key, e);
    }
    if (value == null) return defaultValue;
    value = value.trim();
    // an environment lookup that did not resolve is left verbatim by the interpolator
    if (value.startsWith("${") && value.endsWith("}")) return defaultValue;
    return value;
  }

  static int positiveInt(Configuration config, String key, int defaultValue) {
    String raw = string(config, key, null);
    if (StringUtils.isBlank(raw)) return defaultValue;
    try {
      int value = Integer.parseInt(raw);
      if (value <= 0) {
        throw new ConfigException("Configuration " + key + " must be positive, got " + value);
      }
      return value;
    } catch (NumberFormatException e) {
      throw new ConfigException("Configuration " + key + " is not an integer: " + raw, e);
    }
  }

  static long positiveLong(Configuration config, String key, long defaultValue) {
    String raw = string(config, key, null);
    if (StringUtils.isBlank(raw)) return defaultValue;
    try {
      long value = Long.parseLong(raw);
      if (value <= 0) {
        throw new ConfigException("Configuration " + key + " must be positive, got " + value);
      }
      return value;
    } catch (NumberFormatException e) {
      throw new ConfigException("Configuration " + key + " is not an integer: " + raw, e);
    }
  }
}
