package org.labrad.awg.builder;

import org.labrad.awg.errors.SemanticException;

/**
 * A scan point skipped by a best-effort build.
 */
public final class ScanPointFailure {
  private final ScanPoint point;
  private final SemanticException error;

  public ScanPointFailure(ScanPoint point, SemanticException error) {
    this.point = point;
    this.error = error;
  }

  public ScanPoint getPoint() {
    return point;
  }

  public SemanticException getError() {
    return error;
  }

  @Override
  public String toString() {
    return point + ": " + error.getMessage();
  }
}
