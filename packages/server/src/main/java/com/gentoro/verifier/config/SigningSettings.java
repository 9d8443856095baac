package com.gentoro.verifier.config;

import org.apache.commons.configuration2.Configuration;
import org.apache.commons.lang3.StringUtils;

/** Response signing key material. An empty key disables signing. */
public record SigningSettings(String privateKey) {

  public static SigningSettings from(Configuration config) {
    return new SigningSettings(ConfigValues.string(config, "signing.private-key", ""));
  }

  public boolean isEnabled() {
    return StringUtils.isNotBlank(privateKey);
  }

  @Override
  public String toString() {
    return "SigningSettings[enabled=" + isEnabled() + "]";
  }
}
