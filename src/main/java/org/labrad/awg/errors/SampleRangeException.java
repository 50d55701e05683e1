package org.labrad.awg.errors;

/**
 * A rendered sample does not fit the signed 16-bit output format.
 */
public class SampleRangeException extends CompilationException {
  private static final long serialVersionUID = 1L;

  private final long index;
  private final double value;

  public SampleRangeException(String waveform, long index, double value) {
    super(String.format("Sample %d of waveform %s is out of range: %s", index, waveform, value));
    this.index = index;
    this.value = value;
  }

  public long getIndex() {
    return index;
  }

  public double getValue() {
    return value;
  }
}
