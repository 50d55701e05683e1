package org.labrad.awg.waveform;

/**
 * Supplies sample data for pulses that reference an external waveform by name.
 */
public interface ExternalWaveformSource {
  /**
   * Load the named waveform resampled to the given number of samples, normalized to
   * the range [-1, 1].
   */
  double[] load(String name, int length);
}
