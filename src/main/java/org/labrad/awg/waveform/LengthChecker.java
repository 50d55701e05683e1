package org.labrad.awg.waveform;

import com.google.common.base.Preconditions;

public class LengthChecker {
  public static void checkLengths(long actual, long expected) {
    Preconditions.checkArgument(actual == expected,
        "Incorrect waveform length: expected %s but got %s", expected, actual);
  }

  public static void checkGranularity(long length, int granularity) {
    Preconditions.checkArgument(length % granularity == 0,
        "Waveform length %s is not a multiple of %s", length, granularity);
  }
}
