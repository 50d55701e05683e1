package org.labrad.awg.builder;

import java.util.List;

import com.google.common.collect.ImmutableList;

public final class BuildResult {
  private final ImmutableList<ConcreteSequence> sequences;
  private final ImmutableList<ScanPointFailure> failures;

  public BuildResult(List<ConcreteSequence> sequences, List<ScanPointFailure> failures) {
    this.sequences = ImmutableList.copyOf(sequences);
    this.failures = ImmutableList.copyOf(failures);
  }

  /**
   * Successfully built scan points, in scan order.
   */
  public List<ConcreteSequence> getSequences() {
    return sequences;
  }

  public List<ScanPointFailure> getFailures() {
    return failures;
  }

  public boolean isComplete() {
    return failures.isEmpty();
  }
}
