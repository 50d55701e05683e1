package org.labrad.awg.waveform;

import org.labrad.awg.enums.PulseShape;

import com.google.common.base.Objects;
import com.google.common.base.Preconditions;

/**
 * A parametric pulse inside a channel waveform. Samples are produced only when rendered.
 */
public final class ShapeDescriptor {
  private final PulseShape shape;
  private final long offset;
  private final long length;
  private final double amplitude;
  private final double phaseDegrees;
  private final double cyclesPerSample;
  private final String file;

  public ShapeDescriptor(PulseShape shape, long offset, long length, double amplitude,
      double phaseDegrees, double cyclesPerSample, String file) {
    Preconditions.checkArgument(offset >= 0, "Negative shape offset %s", offset);
    Preconditions.checkArgument(length > 0, "Shape length must be positive, got %s", length);
    this.shape = Preconditions.checkNotNull(shape);
    this.offset = offset;
    this.length = length;
    this.amplitude = amplitude;
    this.phaseDegrees = phaseDegrees;
    this.cyclesPerSample = cyclesPerSample;
    this.file = file;
  }

  public PulseShape getShape() {
    return shape;
  }

  /**
   * First sample of the shape within its waveform.
   */
  public long getOffset() {
    return offset;
  }

  public long getLength() {
    return length;
  }

  public long getEnd() {
    return offset + length;
  }

  /**
   * Peak amplitude as a fraction of full scale.
   */
  public double getAmplitude() {
    return amplitude;
  }

  public double getPhaseDegrees() {
    return phaseDegrees;
  }

  /**
   * Carrier frequency of a sine shape divided by the sample rate.
   */
  public double getCyclesPerSample() {
    return cyclesPerSample;
  }

  public String getFile() {
    return file;
  }

  public ShapeDescriptor withOffset(long newOffset) {
    return new ShapeDescriptor(shape, newOffset, length, amplitude, phaseDegrees, cyclesPerSample, file);
  }

  @Override
  public boolean equals(Object obj) {
    if (!(obj instanceof ShapeDescriptor)) {
      return false;
    }
    ShapeDescriptor other = (ShapeDescriptor) obj;
    return shape == other.shape
        && offset == other.offset
        && length == other.length
        && Double.compare(amplitude, other.amplitude) == 0
        && Double.compare(phaseDegrees, other.phaseDegrees) == 0
        && Double.compare(cyclesPerSample, other.cyclesPerSample) == 0
        && Objects.equal(file, other.file);
  }

  @Override
  public int hashCode() {
    return Objects.hashCode(shape, offset, length, amplitude, phaseDegrees, cyclesPerSample, file);
  }

  @Override
  public String toString() {
    return String.format("%s@%d+%d*%s", shape, offset, length, amplitude);
  }
}
