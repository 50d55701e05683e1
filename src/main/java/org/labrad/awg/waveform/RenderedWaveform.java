package org.labrad.awg.waveform;

import com.google.common.base.Preconditions;

/**
 * Materialized samples of a waveform: analog levels as fractions of full
 * scale and one marker byte per sample.
 */
public final class RenderedWaveform {
  private final double[] levels;
  private final byte[] markers;

  public RenderedWaveform(double[] levels, byte[] markers) {
    Preconditions.checkArgument(levels.length == markers.length,
        "Sample and marker counts differ: %s vs %s", levels.length, markers.length);
    this.levels = levels;
    this.markers = markers;
  }

  public int getLength() {
    return levels.length;
  }

  public double[] getLevels() {
    return levels;
  }

  public byte[] getMarkers() {
    return markers;
  }

  public boolean getMarker(int sample, int bit) {
    return (markers[sample] & (1 << bit)) != 0;
  }
}
