package org.labrad.awg.util;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cooperative cancellation flag, checked by long-running stages between scan points.
 */
public class AbortFlag {
  private final AtomicBoolean aborted = new AtomicBoolean(false);

  public void abort() {
    aborted.set(true);
  }

  public boolean isAborted() {
    return aborted.get();
  }

  /**
   * A flag that is never raised.
   */
  public static AbortFlag never() {
    return new AbortFlag();
  }
}
