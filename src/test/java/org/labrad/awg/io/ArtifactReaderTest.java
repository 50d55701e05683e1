package org.labrad.awg.io;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.io.IOException;
import java.math.BigDecimal;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.labrad.awg.HardwareProfile;
import org.labrad.awg.builder.ConcretePulse;
import org.labrad.awg.builder.ConcreteSequence;
import org.labrad.awg.builder.SequenceBuilder;
import org.labrad.awg.enums.JumpMode;
import org.labrad.awg.enums.OutputChannel;
import org.labrad.awg.optimizer.HardwareOptimizer;
import org.labrad.awg.parser.SequenceParser;
import org.labrad.awg.waveform.WaveformRenderer;

public class ArtifactReaderTest {

  private static List<ConcreteSequence> build(int repeat) {
    return new SequenceBuilder().build(new SequenceParser().parse(String.join("\n",
        "sequence: name=t1, duration=20ms, repeat=" + repeat,
        "variable tau, start=100ns, stop=200ns, steps=2",
        "pi pulse on channel 1 at tau, square, 100ns, 0.5",
        "laser on channel 3 at 10ms, square, 3us, 1.0",
        "readout on channel 2 at 10ms, square, 200ns, 0.25")));
  }

  private static Path write(List<ConcreteSequence> seqs, Path out) throws IOException {
    new ArtifactWriter(new WaveformRenderer()).write(
        new HardwareOptimizer(HardwareProfile.awg520()).optimize(seqs), out);
    return out;
  }

  private static ConcretePulse onChannel(ConcreteSequence seq, OutputChannel channel) {
    for (ConcretePulse p : seq.getPulses()) {
      if (p.getChannel() == channel) {
        return p;
      }
    }
    throw new AssertionError("No pulse on channel " + channel + " in " + seq);
  }

  @Test
  void pulseTimingComesBackFromTheWrittenFiles(@TempDir Path tmp) throws IOException {
    List<ConcreteSequence> seqs = build(1000);
    Path out = write(seqs, tmp.resolve("out"));
    ArtifactReader.WrittenArtifact written = new ArtifactReader().read(out, "t1");

    TriggerScheduleReader.Schedule schedule = written.getSchedule();
    assertEquals(9, schedule.getLineCount());
    assertEquals(20000000 - 256, schedule.getHoldSamples(1));
    // the dead time from the padded first stretch to the second one
    assertEquals(10000000 - 256 - 256, schedule.getHoldSamples(3));

    List<TriggerScheduleReader.Block> blocks = schedule.getBlocks();
    assertEquals(2, blocks.size());
    for (int i = 0; i < blocks.size(); i++) {
      ConcreteSequence seq = seqs.get(i);
      BigDecimal rate = seq.getSampleRate();
      TriggerScheduleReader.Block block = blocks.get(i);
      assertEquals(i, block.getScanIndex());
      assertEquals(1000, block.getRepeat());
      assertEquals(seq.getDurationSamples(), block.getDurationSamples());
      assertEquals(block.getDurationSamples(), written.getPlayedSamples(block));

      List<RecoveredPulse> recovered = written.recoverPulses(block);
      assertEquals(seq.getPulses().size(), recovered.size(), recovered.toString());
      for (RecoveredPulse r : recovered) {
        ConcretePulse p = onChannel(seq, r.getChannel());
        assertEquals(p.getStartSample(rate), r.getStart(), r.toString());
        assertEquals(p.getEndSample(rate) - p.getStartSample(rate), r.getLength(), r.toString());
        assertEquals(p.getAmplitude().getValue().doubleValue(), r.getAmplitude(), 1.0 / 32767, r.toString());
      }
    }
    assertEquals(100, written.recoverPulses(blocks.get(0)).get(0).getStart());
    assertEquals(200, written.recoverPulses(blocks.get(1)).get(0).getStart());
  }

  @Test
  void chainedBlocksFollowEachOtherInTheWrittenTable(@TempDir Path tmp) throws IOException {
    Path out = write(build(1000), tmp.resolve("out"));
    SequenceTableReader.Table table = new SequenceTableReader().read(out.resolve("t1.seq"));
    assertEquals(9, table.getLines().size());
    for (int line = 1; line <= 8; line++) {
      assertEquals(JumpMode.NEXT, table.getLines().get(line - 1).getJumpMode(), "jump of line " + line);
    }
    assertEquals(JumpMode.GOTO, table.getLines().get(8).getJumpMode());
    assertEquals(2, table.getLines().get(8).getJumpTarget());
  }

  @Test
  void statisticsRepeatIsWrittenForChainedBlocks(@TempDir Path tmp) throws IOException {
    Path few = write(build(1000), tmp.resolve("few"));
    Path many = write(build(50000), tmp.resolve("many"));

    assertArrayEquals(Files.readAllBytes(few.resolve("t1.seq")), Files.readAllBytes(many.resolve("t1.seq")));
    for (SequenceTableReader.Line line : new SequenceTableReader().read(few.resolve("t1.seq")).getLines()) {
      for (String name : line.getWaveforms()) {
        if (!name.isEmpty()) {
          assertArrayEquals(Files.readAllBytes(few.resolve(name)), Files.readAllBytes(many.resolve(name)), name);
        }
      }
    }
    assertFalse(Arrays.equals(Files.readAllBytes(few.resolve("t1.sched")),
        Files.readAllBytes(many.resolve("t1.sched"))));

    ArtifactReader reader = new ArtifactReader();
    for (TriggerScheduleReader.Block block : reader.read(few, "t1").getSchedule().getBlocks()) {
      assertEquals(1000, block.getRepeat());
    }
    for (TriggerScheduleReader.Block block : reader.read(many, "t1").getSchedule().getBlocks()) {
      assertEquals(50000, block.getRepeat());
    }
  }

  @Test
  void scheduleMustMatchTheTable(@TempDir Path tmp) throws IOException {
    Path out = write(build(1000), tmp.resolve("out"));
    Files.write(out.resolve("t1.sched"), String.join("\r\n",
        "SCHEDULE 1", "CLOCK 1.0000000000E+09", "LINES 1", "1,0", "BLOCKS 0", "").getBytes("US-ASCII"));
    assertThrows(IOException.class, () -> new ArtifactReader().read(out, "t1"));
  }

  @Test
  void blocksOutsideTheTableAreRejected() {
    TriggerScheduleReader reader = new TriggerScheduleReader();
    assertThrows(IOException.class, () -> reader.parse(String.join("\r\n",
        "SCHEDULE 1", "CLOCK 1.0000000000E+09", "LINES 1", "1,0", "BLOCKS 1", "0,1,2,1,1000,1000", "")));
    assertThrows(IOException.class, () -> reader.parse("SCHEDULE 2\r\n"));
  }
}
