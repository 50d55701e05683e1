package org.labrad.awg.util;

import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;

import com.google.common.base.Preconditions;

/**
 * Conversions between exact SI times and sample indices.
 */
public class Timing {
  private Timing() {}

  /**
   * Sample index of a time, rounded half-up.
   */
  public static long toSamples(BigDecimal seconds, BigDecimal sampleRate) {
    Preconditions.checkArgument(sampleRate.signum() > 0, "Sample rate must be positive");
    return seconds.multiply(sampleRate).setScale(0, RoundingMode.HALF_UP).longValueExact();
  }

  /**
   * Time of a sample index.
   */
  public static BigDecimal toSeconds(long samples, BigDecimal sampleRate) {
    Preconditions.checkArgument(sampleRate.signum() > 0, "Sample rate must be positive");
    return BigDecimal.valueOf(samples).divide(sampleRate, MathContext.DECIMAL128).stripTrailingZeros();
  }

  /**
   * Human-readable rendering of a time, in the largest unit that keeps it at least one.
   */
  public static String format(BigDecimal seconds) {
    BigDecimal abs = seconds.abs();
    if (abs.signum() == 0) {
      return "0s";
    }
    if (abs.compareTo(BigDecimal.ONE) >= 0) {
      return seconds.stripTrailingZeros().toPlainString() + "s";
    }
    if (abs.compareTo(new BigDecimal("1E-3")) >= 0) {
      return seconds.movePointRight(3).stripTrailingZeros().toPlainString() + "ms";
    }
    if (abs.compareTo(new BigDecimal("1E-6")) >= 0) {
      return seconds.movePointRight(6).stripTrailingZeros().toPlainString() + "us";
    }
    return seconds.movePointRight(9).stripTrailingZeros().toPlainString() + "ns";
  }
}
