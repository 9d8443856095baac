package com.gentoro.verifier.scoring;

import java.math.BigInteger;
import java.util.OptionalInt;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Extracts a score from a free-text model reply: the first run of decimal digits anywhere in the
 * reply, clamped to [0, 100]. Signs and decimal points are not interpreted, so {@code "-5"} reads
 * as 5 and {@code "87.5"} as 87.
 */
public final class ScoreParser {
  private static final Pattern DIGITS = Pattern.compile("\\d+");
  private static final BigInteger MAX = BigInteger.valueOf(100);

  private ScoreParser() {}

  public static OptionalInt parse(String reply) {
    if (reply == null) return OptionalInt.empty();
    Matcher m = DIGITS.matcher(reply);
    if (!m.find()) return OptionalInt.empty();
    // digit runs can exceed the range of int
    BigInteger value = new BigInteger(m.group());
    return OptionalInt.of(value.min(MAX).intValue());
  }
}
