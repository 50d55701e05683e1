package org.labrad.awg.calibration;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.math.BigDecimal;
import java.util.List;
import java.util.Properties;

import org.junit.jupiter.api.Test;
import org.labrad.awg.builder.ConcretePulse;
import org.labrad.awg.builder.ConcreteSequence;
import org.labrad.awg.builder.SequenceBuilder;
import org.labrad.awg.enums.OutputChannel;
import org.labrad.awg.errors.TimingOrderException;
import org.labrad.awg.parser.SequenceParser;

import com.google.common.collect.ImmutableList;

public class HardwareCalibratorTest {

  private static final BigDecimal GHZ = new BigDecimal("1E9");

  private final HardwareCalibrator standard = HardwareCalibrator.standard();

  private static ConcreteSequence build(String... lines) {
    return new SequenceBuilder().build(new SequenceParser().parse(String.join("\n", lines))).get(0);
  }

  private static long start(ConcreteSequence seq, int pulse) {
    return seq.getPulses().get(pulse).getStartSample(GHZ);
  }

  @Test
  void bundledWiringDelays() {
    assertEquals(30, standard.getDelaySamples(OutputChannel.CH1, GHZ));
    assertEquals(30, standard.getDelaySamples(OutputChannel.CH2, GHZ));
    assertEquals(0, standard.getDelaySamples(OutputChannel.CH1_MARKER1, GHZ));
    assertEquals(50, standard.getDelaySamples(OutputChannel.CH1_MARKER2, GHZ));
    assertEquals(15, standard.getDelaySamples(OutputChannel.CH2_MARKER2, GHZ));
    assertEquals("laser_switch", standard.getConnection(OutputChannel.CH1_MARKER2).getName());
    assertEquals(25, standard.getDelaySamples(OutputChannel.CH2_MARKER2, new BigDecimal("1.7E9")));
    assertTrue(standard.getSummary().contains("output 4 -> laser_switch (laser_delay)"));
  }

  @Test
  void pulsesMoveEarlierByTheirOutputDelay() {
    ConcreteSequence seq = build(
        "sequence: duration=1us",
        "pi pulse on channel 1 at 100ns, square, 50ns, 1.0",
        "laser on channel 4 at 500ns, square, 300ns, 1.0",
        "spare on channel 3 at 500ns, square, 10ns, 1.0");
    ConcreteSequence calibrated = standard.calibrate(seq);
    assertEquals(70, start(calibrated, 0));
    assertEquals(450, start(calibrated, 1));
    assertEquals(500, start(calibrated, 2));
    ConcretePulse laser = calibrated.getPulses().get(1);
    assertEquals(300, laser.getEndSample(GHZ) - laser.getStartSample(GHZ));
    assertEquals(seq.getDurationSamples(), calibrated.getDurationSamples());
    assertEquals(seq.getScanIndex(), calibrated.getScanIndex());
  }

  @Test
  void pulseThatWouldStartBeforeZeroStartsAtZero() {
    ConcreteSequence calibrated = standard.calibrate(build(
        "sequence: duration=1us",
        "laser on channel 4 at 20ns, square, 100ns, 1.0"));
    ConcretePulse laser = calibrated.getPulses().get(0);
    assertEquals(0, laser.getStartSample(GHZ));
    assertEquals(100, laser.getEndSample(GHZ));
  }

  @Test
  void clampingIntoTheNextPulseIsAnError() {
    ConcreteSequence seq = build(
        "sequence: duration=1us",
        "a on channel 4 at 0ns, square, 30ns, 1.0",
        "b on channel 4 at 60ns, square, 10ns, 1.0");
    assertThrows(TimingOrderException.class, () -> standard.calibrate(seq));
  }

  @Test
  void withoutDelaysNothingChanges() {
    ConcreteSequence seq = build("sequence: duration=1us", "a on channel 1 at 10ns, square, 30ns, 1.0");
    assertSame(seq, HardwareCalibrator.none().calibrate(seq));
    List<ConcreteSequence> all = ImmutableList.of(seq);
    assertEquals(all, HardwareCalibrator.none().calibrate(all));
  }

  @Test
  void delaysRoundDownToWholeSamples() {
    Properties props = new Properties();
    props.setProperty("channel.1", "mixer, slow");
    props.setProperty("delay.slow", "12.7");
    HardwareCalibrator calibrator = HardwareCalibrator.fromProperties(props);
    assertEquals(12, calibrator.getDelaySamples(OutputChannel.CH1, GHZ));
    assertEquals(0, calibrator.getDelaySamples(OutputChannel.CH2, GHZ));
  }

  @Test
  void missingConnectionsOfAnExperiment() {
    assertTrue(standard.validateConnections("rabi").isEmpty());
    assertTrue(standard.validateConnections("custom").isEmpty());

    Properties props = new Properties();
    props.setProperty("channel.1", "IQ_modulator_I_input");
    props.setProperty("channel.4", "unassigned");
    props.setProperty("experiment.odmr", "1, 2, 4");
    HardwareCalibrator partial = HardwareCalibrator.fromProperties(props);
    assertEquals(ImmutableList.of(OutputChannel.CH2, OutputChannel.CH1_MARKER2), partial.validateConnections("odmr"));
  }

  @Test
  void malformedWiringIsRejected() {
    Properties undefinedDelay = new Properties();
    undefinedDelay.setProperty("channel.1", "mixer, nowhere");
    assertThrows(IllegalArgumentException.class, () -> HardwareCalibrator.fromProperties(undefinedDelay));

    Properties badChannel = new Properties();
    badChannel.setProperty("channel.9", "mixer");
    assertThrows(IllegalArgumentException.class, () -> HardwareCalibrator.fromProperties(badChannel));

    Properties unknown = new Properties();
    unknown.setProperty("wiring.1", "mixer");
    assertThrows(IllegalArgumentException.class, () -> HardwareCalibrator.fromProperties(unknown));
  }
}
