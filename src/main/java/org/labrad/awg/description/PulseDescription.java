package org.labrad.awg.description;

import java.util.List;

import org.labrad.awg.enums.OutputChannel;
import org.labrad.awg.enums.PulseShape;

import com.google.common.base.Preconditions;
import com.google.common.collect.Lists;

/**
 * A pulse as written in the sequence. Start, duration, amplitude, phase and
 * frequency may each reference a scan variable.
 */
public final class PulseDescription implements SequenceNode {
  private final String label;
  private final OutputChannel channel;
  private final ParameterValue start;
  private final PulseShape shape;
  private final ParameterValue duration;
  private final ParameterValue amplitude;
  private final ParameterValue phase;
  private final ParameterValue frequency;
  private final String file;
  private final boolean fixed;
  private final boolean concurrent;
  private final int line;

  private PulseDescription(Builder b) {
    this.label = b.label;
    this.channel = b.channel;
    this.start = b.start;
    this.shape = b.shape;
    this.duration = b.duration;
    this.amplitude = b.amplitude;
    this.phase = b.phase;
    this.frequency = b.frequency;
    this.file = b.file;
    this.fixed = b.fixed;
    this.concurrent = b.concurrent;
    this.line = b.line;
  }

  public static Builder builder(String label, OutputChannel channel) {
    return new Builder(label, channel);
  }

  public String getLabel() {
    return label;
  }

  public OutputChannel getChannel() {
    return channel;
  }

  public ParameterValue getStart() {
    return start;
  }

  public PulseShape getShape() {
    return shape;
  }

  public ParameterValue getDuration() {
    return duration;
  }

  public ParameterValue getAmplitude() {
    return amplitude;
  }

  /**
   * Phase, or null for zero.
   */
  public ParameterValue getPhase() {
    return phase;
  }

  /**
   * Carrier frequency, only set for sine pulses.
   */
  public ParameterValue getFrequency() {
    return frequency;
  }

  /**
   * External waveform name, only set for loadfile pulses.
   */
  public String getFile() {
    return file;
  }

  /**
   * A fixed pulse keeps its written start time regardless of earlier duration changes.
   */
  public boolean isFixed() {
    return fixed;
  }

  /**
   * A concurrent pulse may overlap the previous pulse on its channel.
   */
  public boolean isConcurrent() {
    return concurrent;
  }

  @Override
  public int getLine() {
    return line;
  }

  /**
   * All parameters that may carry a variable reference.
   */
  public List<ParameterValue> getParameters() {
    List<ParameterValue> params = Lists.newArrayList(start, duration, amplitude);
    if (phase != null) params.add(phase);
    if (frequency != null) params.add(frequency);
    return params;
  }

  @Override
  public String toString() {
    return String.format("%s on channel %s at %s", label, channel, start);
  }

  public static class Builder {
    private final String label;
    private final OutputChannel channel;
    private ParameterValue start;
    private PulseShape shape;
    private ParameterValue duration;
    private ParameterValue amplitude;
    private ParameterValue phase;
    private ParameterValue frequency;
    private String file;
    private boolean fixed;
    private boolean concurrent;
    private int line;

    private Builder(String label, OutputChannel channel) {
      this.label = Preconditions.checkNotNull(label);
      this.channel = Preconditions.checkNotNull(channel);
    }

    public Builder start(ParameterValue start) {
      this.start = start;
      return this;
    }

    public Builder shape(PulseShape shape) {
      this.shape = shape;
      return this;
    }

    public Builder duration(ParameterValue duration) {
      this.duration = duration;
      return this;
    }

    public Builder amplitude(ParameterValue amplitude) {
      this.amplitude = amplitude;
      return this;
    }

    public Builder phase(ParameterValue phase) {
      this.phase = phase;
      return this;
    }

    public Builder frequency(ParameterValue frequency) {
      this.frequency = frequency;
      return this;
    }

    public Builder file(String file) {
      this.file = file;
      return this;
    }

    public Builder fixed(boolean fixed) {
      this.fixed = fixed;
      return this;
    }

    public Builder concurrent(boolean concurrent) {
      this.concurrent = concurrent;
      return this;
    }

    public Builder line(int line) {
      this.line = line;
      return this;
    }

    public PulseDescription build() {
      Preconditions.checkNotNull(start, "start of pulse %s", label);
      Preconditions.checkNotNull(shape, "shape of pulse %s", label);
      Preconditions.checkNotNull(duration, "duration of pulse %s", label);
      Preconditions.checkNotNull(amplitude, "amplitude of pulse %s", label);
      return new PulseDescription(this);
    }
  }
}
