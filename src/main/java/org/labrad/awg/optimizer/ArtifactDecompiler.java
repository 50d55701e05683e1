package org.labrad.awg.optimizer;

import java.math.BigDecimal;
import java.util.List;

import org.labrad.awg.builder.ConcretePulse;
import org.labrad.awg.builder.ConcreteSequence;
import org.labrad.awg.description.Quantity;
import org.labrad.awg.enums.OutputChannel;
import org.labrad.awg.enums.PulseShape;
import org.labrad.awg.table.TableEntry;
import org.labrad.awg.table.WaveformEntry;
import org.labrad.awg.util.Timing;
import org.labrad.awg.waveform.ChannelWaveform;
import org.labrad.awg.waveform.MarkerSpan;
import org.labrad.awg.waveform.ShapeDescriptor;

import com.google.common.collect.Lists;

/**
 * Recovers timing-resolved scan points from a compiled artifact. Pulses come
 * back quantized to samples, with amplitudes as fractions of full scale.
 */
public class ArtifactDecompiler {

  public List<ConcreteSequence> decompile(OptimizedArtifact artifact) {
    List<ConcreteSequence> result = Lists.newArrayList();
    for (ScanPointBlock block : artifact.getBlocks()) {
      result.add(decompile(artifact, block));
    }
    return result;
  }

  public ConcreteSequence decompile(OptimizedArtifact artifact, ScanPointBlock block) {
    BigDecimal rate = artifact.getSampleRate();
    List<ConcretePulse> pulses = Lists.newArrayList();
    for (int line = block.getFirstLine(); line <= block.getLastLine(); line++) {
      TableEntry entry = artifact.getTable().getLine(line);
      if (!(entry instanceof WaveformEntry)) {
        continue;
      }
      long offset = ((WaveformEntry) entry).getOffset();
      List<ChannelWaveform> waveforms = entry.getWaveforms();
      for (int c = 0; c < waveforms.size(); c++) {
        ChannelWaveform w = waveforms.get(c);
        if (w != null) {
          addPulses(w, c + 1, offset, rate, pulses);
        }
      }
    }
    return new ConcreteSequence(artifact.getName(), block.getScanIndex(), block.getScanValues(), rate,
        Timing.toSeconds(block.getNominalSamples(), rate), Timing.toSeconds(block.getDurationSamples(), rate),
        block.getRepeatCount(), pulses);
  }

  private static void addPulses(ChannelWaveform w, int analogChannel, long offset, BigDecimal rate,
      List<ConcretePulse> pulses) {
    for (ShapeDescriptor s : w.getShapes()) {
      BigDecimal frequency = s.getShape() == PulseShape.SINE
          ? BigDecimal.valueOf(s.getCyclesPerSample()).multiply(rate) : null;
      pulses.add(new ConcretePulse(s.getShape().toString(), OutputChannel.fromId(analogChannel), s.getShape(),
          Timing.toSeconds(offset + s.getOffset(), rate), Timing.toSeconds(s.getLength(), rate),
          Quantity.dimensionless(BigDecimal.valueOf(s.getAmplitude())), BigDecimal.valueOf(s.getPhaseDegrees()),
          frequency, s.getFile(), false));
    }
    for (MarkerSpan m : w.getMarkers()) {
      pulses.add(new ConcretePulse("marker", OutputChannel.marker(analogChannel, m.getBit()), PulseShape.SQUARE,
          Timing.toSeconds(offset + m.getOffset(), rate), Timing.toSeconds(m.getLength(), rate),
          Quantity.dimensionless(BigDecimal.ONE), BigDecimal.ZERO, null, null, false));
    }
  }
}
