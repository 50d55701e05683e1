package org.labrad.awg.waveform;

import com.google.common.base.Objects;
import com.google.common.base.Preconditions;

/**
 * A run of samples with one marker bit set.
 */
public final class MarkerSpan {
  private final int bit;
  private final long offset;
  private final long length;

  public MarkerSpan(int bit, long offset, long length) {
    Preconditions.checkArgument(bit == 0 || bit == 1, "Invalid marker bit %s", bit);
    Preconditions.checkArgument(offset >= 0 && length > 0, "Invalid marker span %s+%s", offset, length);
    this.bit = bit;
    this.offset = offset;
    this.length = length;
  }

  /**
   * Bit position in the marker byte: 0 for marker 1, 1 for marker 2.
   */
  public int getBit() {
    return bit;
  }

  public long getOffset() {
    return offset;
  }

  public long getLength() {
    return length;
  }

  public long getEnd() {
    return offset + length;
  }

  public MarkerSpan withOffset(long newOffset) {
    return new MarkerSpan(bit, newOffset, length);
  }

  @Override
  public boolean equals(Object obj) {
    if (!(obj instanceof MarkerSpan)) {
      return false;
    }
    MarkerSpan other = (MarkerSpan) obj;
    return bit == other.bit && offset == other.offset && length == other.length;
  }

  @Override
  public int hashCode() {
    return Objects.hashCode(bit, offset, length);
  }

  @Override
  public String toString() {
    return String.format("M%d@%d+%d", bit + 1, offset, length);
  }
}
