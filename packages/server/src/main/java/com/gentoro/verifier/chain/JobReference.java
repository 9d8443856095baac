package com.gentoro.verifier.chain;

import com.gentoro.verifier.exception.ValidationException;
import java.util.Locale;
import java.util.regex.Pattern;
import org.web3j.utils.Numeric;

/**
 * On-chain job reference normalized to its fixed-width {@code bytes32} form. Input may carry a
 * {@code 0x} prefix and fewer than 64 hex digits; it is left-padded with zeros.
 */
public final class JobReference {
  private static final Pattern HEX = Pattern.compile("[0-9a-fA-F]{1,64}");

  private final String hex;

  private JobReference(String hex) {
    this.hex = hex;
  }

  /**
   * @throws ValidationException when the input is empty, not hexadecimal, or longer than 32 bytes
   */
  public static JobReference parse(String raw) {
    if (raw == null || raw.isBlank()) {
      throw new ValidationException("Job reference is required");
    }
    String digits = raw.trim();
    if (digits.startsWith("0x") || digits.startsWith("0X")) {
      digits = digits.substring(2);
    }
    if (!HEX.matcher(digits).matches()) {
      throw new ValidationException(
          "Job reference must be a hex string of at most 64 digits: " + raw.trim());
    }
    return new JobReference(leftPad64(digits.toLowerCase(Locale.ROOT)));
  }

  /** Left-pad a hex string without prefix to 64 digits. */
  static String leftPad64(String digits) {
    if (digits.length() >= 64) return digits;
    return "0".repeat(64 - digits.length()) + digits;
  }

  /** 64 lower-case hex digits, no prefix. */
  public String hex() {
    return hex;
  }

  public String prefixedHex() {
    return "0x" + hex;
  }

  public byte[] toBytes32() {
    return Numeric.hexStringToByteArray(hex);
  }

  @Override
  public boolean equals(Object o) {
    return o instanceof JobReference other && other.hex.equals(hex);
  }

  @Override
  public int hashCode() {
    return hex.hashCode();
  }

  @Override
  public String toString() {
    return prefixedHex();
  }
}
