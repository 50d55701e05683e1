package org.labrad.awg.waveform;

import com.google.common.base.Objects;
import com.google.common.base.Preconditions;

/**
 * A constant-level stretch of output with no pulse activity, kept as a
 * (start, end, value) triple and never expanded into samples.
 */
public final class DeadTimeSpan {
  private final long start;
  private final long end;
  private final double value;

  public DeadTimeSpan(long start, long end, double value) {
    Preconditions.checkArgument(start >= 0 && end > start, "Invalid dead time span [%s, %s)", start, end);
    this.start = start;
    this.end = end;
    this.value = value;
  }

  public long getStart() {
    return start;
  }

  public long getEnd() {
    return end;
  }

  public long getLength() {
    return end - start;
  }

  public double getValue() {
    return value;
  }

  @Override
  public boolean equals(Object obj) {
    if (!(obj instanceof DeadTimeSpan)) {
      return false;
    }
    DeadTimeSpan other = (DeadTimeSpan) obj;
    return start == other.start && end == other.end && Double.compare(value, other.value) == 0;
  }

  @Override
  public int hashCode() {
    return Objects.hashCode(start, end, value);
  }

  @Override
  public String toString() {
    return String.format("dead[%d, %d)=%s", start, end, value);
  }
}
