package com.gentoro.verifier.config;

import java.math.BigInteger;
import java.time.Duration;
import org.apache.commons.configuration2.Configuration;
import org.apache.commons.lang3.StringUtils;

/**
 * Remote ledger access. Cross-validation is only available when both the operator key and the
 * jobs module address are present.
 */
public record ChainSettings(
    String rpcUrl,
    String privateKey,
    String jobsModuleAddress,
    String registryModuleAddress,
    long chainId,
    BigInteger gasLimit,
    Duration receiptPollInterval,
    int receiptAttempts) {

  public static final String DEFAULT_REGISTRY_MODULE = "0xa041ec83d30ef5f7ffc4bc7a62bf1aaeee5544b6";

  public static ChainSettings from(Configuration config) {
    return new ChainSettings(
        ConfigValues.string(config, "chain.rpc-url", "https://testnet.hashio.io/api"),
        ConfigValues.string(config, "chain.private-key", ""),
        ConfigValues.string(config, "chain.jobs-module-address", ""),
        ConfigValues.string(config, "chain.registry-module-address", DEFAULT_REGISTRY_MODULE),
        ConfigValues.positiveLong(config, "chain.id", 296),
        BigInteger.valueOf(ConfigValues.positiveLong(config, "chain.gas-limit", 500_000)),
        Duration.ofMillis(ConfigValues.positiveLong(config, "chain.receipt-poll-millis", 1_000)),
        ConfigValues.positiveInt(config, "chain.receipt-attempts", 60));
  }

  public boolean isConfigured() {
    return StringUtils.isNoneBlank(rpcUrl, privateKey, jobsModuleAddress, registryModuleAddress);
  }

  // keeps the operator key out of logs
  @Override
  public String toString() {
    return "ChainSettings[rpcUrl=%s, jobsModule=%s, registryModule=%s, chainId=%d, gasLimit=%s]"
        .formatted(rpcUrl, jobsModuleAddress, registryModuleAddress, chainId, gasLimit);
  }
}
