package org.labrad.awg.builder;

import org.labrad.awg.util.AbortFlag;

import com.google.common.base.Preconditions;

/**
 * How a build treats failing scan points and cancellation.
 */
public final class BuildOptions {
  private final boolean bestEffort;
  private final AbortFlag abortFlag;

  private BuildOptions(boolean bestEffort, AbortFlag abortFlag) {
    this.bestEffort = bestEffort;
    this.abortFlag = Preconditions.checkNotNull(abortFlag);
  }

  /**
   * Abort on the first failing scan point, never cancelled.
   */
  public static BuildOptions defaults() {
    return new BuildOptions(false, AbortFlag.never());
  }

  /**
   * Continue past failing scan points and report them in the result.
   */
  public BuildOptions bestEffort() {
    return new BuildOptions(true, abortFlag);
  }

  public BuildOptions withAbortFlag(AbortFlag flag) {
    return new BuildOptions(bestEffort, flag);
  }

  public boolean isBestEffort() {
    return bestEffort;
  }

  public AbortFlag getAbortFlag() {
    return abortFlag;
  }
}
