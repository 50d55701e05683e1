package org.labrad.awg.builder;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;

import org.labrad.awg.description.Quantity;
import org.labrad.awg.enums.OutputChannel;
import org.labrad.awg.util.Timing;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Lists;

/**
 * One scan point of a sequence with every pulse placed at an absolute time.
 */
public final class ConcreteSequence {
  private final String name;
  private final int scanIndex;
  private final ImmutableMap<String, Quantity> scanValues;
  private final BigDecimal sampleRate;
  private final BigDecimal nominalDuration;
  private final BigDecimal duration;
  private final long repeatCount;
  private final ImmutableList<ConcretePulse> pulses;

  public ConcreteSequence(String name, int scanIndex, Map<String, Quantity> scanValues,
      BigDecimal sampleRate, BigDecimal nominalDuration, BigDecimal duration, long repeatCount,
      List<ConcretePulse> pulses) {
    Preconditions.checkArgument(sampleRate.signum() > 0, "Sample rate must be positive");
    Preconditions.checkArgument(repeatCount >= 1, "Repeat count must be at least 1");
    this.name = name;
    this.scanIndex = scanIndex;
    this.scanValues = ImmutableMap.copyOf(scanValues);
    this.sampleRate = sampleRate;
    this.nominalDuration = nominalDuration;
    this.duration = duration;
    this.repeatCount = repeatCount;
    this.pulses = ImmutableList.copyOf(pulses);
  }

  public String getName() {
    return name;
  }

  public int getScanIndex() {
    return scanIndex;
  }

  /**
   * Values of the scan variables at this point, in declaration order.
   */
  public Map<String, Quantity> getScanValues() {
    return scanValues;
  }

  public BigDecimal getSampleRate() {
    return sampleRate;
  }

  /**
   * Duration of the sequence as written, before any scan variable changed it.
   */
  public BigDecimal getNominalDuration() {
    return nominalDuration;
  }

  public BigDecimal getDuration() {
    return duration;
  }

  public long getDurationSamples() {
    return Timing.toSamples(duration, sampleRate);
  }

  public long getRepeatCount() {
    return repeatCount;
  }

  /**
   * Pulses in source order, loops unrolled.
   */
  public List<ConcretePulse> getPulses() {
    return pulses;
  }

  public List<ConcretePulse> getPulses(OutputChannel channel) {
    List<ConcretePulse> result = Lists.newArrayList();
    for (ConcretePulse p : pulses) {
      if (p.getChannel() == channel) {
        result.add(p);
      }
    }
    return result;
  }

  public ConcreteSequence withRepeatCount(long repeat) {
    return new ConcreteSequence(name, scanIndex, scanValues, sampleRate, nominalDuration, duration,
        repeat, pulses);
  }

  @Override
  public String toString() {
    return String.format("%s#%d%s [%s, %d pulses]", name, scanIndex, scanValues,
        Timing.format(duration), pulses.size());
  }
}
