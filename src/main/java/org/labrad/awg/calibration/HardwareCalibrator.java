package org.labrad.awg.calibration;

import java.io.IOException;
import java.io.Reader;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.net.URL;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Properties;

import org.labrad.awg.Constants;
import org.labrad.awg.builder.ConcretePulse;
import org.labrad.awg.builder.ConcreteSequence;
import org.labrad.awg.enums.OutputChannel;
import org.labrad.awg.errors.TimingOrderException;
import org.labrad.awg.util.Timing;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.base.Joiner;
import com.google.common.base.Preconditions;
import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Lists;
import com.google.common.collect.Maps;
import com.google.common.io.Resources;

/**
 * Compensates for the delay between an AWG output and the device it drives.
 * Every pulse is moved earlier by the delay of its output's connection, in
 * whole samples, so that the devices respond at the times the sequence asks for.
 *
 * The wiring is read from properties:
 * <pre>
 * channel.4=laser_switch, laser_delay
 * delay.laser_delay=50
 * experiment.rabi=1,2,4,6
 * </pre>
 * Delays are in nanoseconds.
 */
public class HardwareCalibrator {
  private static final Logger log = LoggerFactory.getLogger(HardwareCalibrator.class);

  private static final String CHANNEL = "channel.";
  private static final String DELAY = "delay.";
  private static final String EXPERIMENT = "experiment.";
  private static final Splitter FIELDS = Splitter.on(',').trimResults().omitEmptyStrings();
  private static final BigDecimal NS = new BigDecimal("1E-9");

  private final ImmutableMap<OutputChannel, Connection> connections;
  private final ImmutableMap<String, BigDecimal> delays;
  private final ImmutableMap<String, ImmutableList<OutputChannel>> requirements;

  /**
   * Where one output is wired.
   */
  public static final class Connection {
    private final String name;
    private final String delayName;

    Connection(String name, String delayName) {
      this.name = name;
      this.delayName = delayName;
    }

    public String getName() {
      return name;
    }

    /**
     * Name of the delay that applies, or null if none does.
     */
    public String getDelayName() {
      return delayName;
    }

    public boolean isAssigned() {
      return !name.equals(Constants.UNASSIGNED);
    }

    @Override
    public String toString() {
      return delayName == null ? name : name + " (" + delayName + ")";
    }
  }

  HardwareCalibrator(Map<OutputChannel, Connection> connections, Map<String, BigDecimal> delays,
      Map<String, List<OutputChannel>> requirements) {
    for (Connection c : connections.values()) {
      Preconditions.checkArgument(c.getDelayName() == null || delays.containsKey(c.getDelayName()),
          "Connection %s refers to undefined delay %s", c.getName(), c.getDelayName());
    }
    for (Map.Entry<String, BigDecimal> e : delays.entrySet()) {
      Preconditions.checkArgument(e.getValue().signum() >= 0, "Delay %s is negative", e.getKey());
    }
    this.connections = ImmutableMap.copyOf(connections);
    this.delays = ImmutableMap.copyOf(delays);
    ImmutableMap.Builder<String, ImmutableList<OutputChannel>> b = ImmutableMap.builder();
    for (Map.Entry<String, List<OutputChannel>> e : requirements.entrySet()) {
      b.put(e.getKey(), ImmutableList.copyOf(e.getValue()));
    }
    this.requirements = b.build();
  }

  /**
   * A calibrator that leaves every pulse where it is.
   */
  public static HardwareCalibrator none() {
    return new HardwareCalibrator(ImmutableMap.<OutputChannel, Connection>of(),
        ImmutableMap.<String, BigDecimal>of(), ImmutableMap.<String, List<OutputChannel>>of());
  }

  /**
   * The bundled AWG520 wiring.
   */
  public static HardwareCalibrator standard() {
    return fromResource(Constants.AWG520_CONNECTIONS);
  }

  public static HardwareCalibrator fromResource(String resource) {
    URL url = Resources.getResource(HardwareCalibrator.class, resource);
    Properties props = new Properties();
    try (Reader reader = Resources.asCharSource(url, StandardCharsets.UTF_8).openStream()) {
      props.load(reader);
    } catch (IOException e) {
      throw new IllegalStateException("Failed to load connections from " + resource, e);
    }
    return fromProperties(props);
  }

  public static HardwareCalibrator fromFile(Path file) throws IOException {
    Properties props = new Properties();
    try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
      props.load(reader);
    }
    return fromProperties(props);
  }

  public static HardwareCalibrator fromProperties(Properties props) {
    Map<OutputChannel, Connection> connections = Maps.newEnumMap(OutputChannel.class);
    Map<String, BigDecimal> delays = Maps.newHashMap();
    Map<String, List<OutputChannel>> requirements = Maps.newHashMap();
    for (String key : props.stringPropertyNames()) {
      String value = props.getProperty(key).trim();
      if (key.startsWith(CHANNEL)) {
        List<String> fields = FIELDS.splitToList(value);
        Preconditions.checkArgument(fields.size() == 1 || fields.size() == 2,
            "Connection %s must be '<name>' or '<name>, <delay>', not '%s'", key, value);
        connections.put(channel(key, key.substring(CHANNEL.length())),
            new Connection(fields.get(0), fields.size() == 2 ? fields.get(1) : null));
      } else if (key.startsWith(DELAY)) {
        try {
          delays.put(key.substring(DELAY.length()), new BigDecimal(value));
        } catch (NumberFormatException e) {
          throw new IllegalArgumentException(String.format("Delay %s has non-numeric value '%s'", key, value), e);
        }
      } else if (key.startsWith(EXPERIMENT)) {
        List<OutputChannel> channels = Lists.newArrayList();
        for (String id : FIELDS.split(value)) {
          channels.add(channel(key, id));
        }
        requirements.put(key.substring(EXPERIMENT.length()), channels);
      } else {
        throw new IllegalArgumentException("Unknown connection property " + key);
      }
    }
    return new HardwareCalibrator(connections, delays, requirements);
  }

  private static OutputChannel channel(String key, String id) {
    try {
      int n = Integer.parseInt(id.trim());
      Preconditions.checkArgument(OutputChannel.isValid(n), "%s names invalid output channel %s", key, id);
      return OutputChannel.fromId(n);
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException(String.format("%s names invalid output channel '%s'", key, id), e);
    }
  }

  public Connection getConnection(OutputChannel channel) {
    Connection c = connections.get(channel);
    return c == null ? new Connection(Constants.UNASSIGNED, null) : c;
  }

  /**
   * Delay of the device behind an output, in seconds. Zero for outputs
   * without a delay.
   */
  public BigDecimal getDelay(OutputChannel channel) {
    String name = getConnection(channel).getDelayName();
    return name == null ? BigDecimal.ZERO : delays.get(name).multiply(NS);
  }

  /**
   * Delay of an output in whole samples, rounded down.
   */
  public long getDelaySamples(OutputChannel channel, BigDecimal sampleRate) {
    return getDelay(channel).multiply(sampleRate).setScale(0, RoundingMode.DOWN).longValueExact();
  }

  public boolean isIdentity() {
    for (OutputChannel ch : OutputChannel.values()) {
      if (getDelay(ch).signum() != 0) {
        return false;
      }
    }
    return true;
  }

  /**
   * Outputs the experiment type needs that are not wired to anything. Types
   * without requirements need nothing.
   */
  public List<OutputChannel> validateConnections(String experimentType) {
    List<OutputChannel> missing = Lists.newArrayList();
    List<OutputChannel> required = requirements.get(experimentType);
    if (required != null) {
      for (OutputChannel ch : required) {
        if (!getConnection(ch).isAssigned()) {
          missing.add(ch);
        }
      }
    }
    return missing;
  }

  public List<ConcreteSequence> calibrate(List<ConcreteSequence> sequences) {
    List<ConcreteSequence> result = Lists.newArrayList();
    for (ConcreteSequence seq : sequences) {
      result.add(calibrate(seq));
    }
    return result;
  }

  /**
   * Move every pulse earlier by its output's delay. A pulse that would start
   * before zero starts at zero.
   *
   * @throws TimingOrderException if moving a pulse to zero makes it overlap
   *     the next pulse on its output
   */
  public ConcreteSequence calibrate(ConcreteSequence seq) {
    if (isIdentity()) {
      return seq;
    }
    BigDecimal rate = seq.getSampleRate();
    List<ConcretePulse> pulses = Lists.newArrayList();
    for (ConcretePulse p : seq.getPulses()) {
      long delay = getDelaySamples(p.getChannel(), rate);
      if (delay == 0) {
        pulses.add(p);
        continue;
      }
      long start = p.getStartSample(rate) - delay;
      if (start < 0) {
        log.warn("{}: pulse {} on output {} would start {} samples before zero after calibration, starting at 0",
            seq, p.getLabel(), p.getChannel(), -start);
        start = 0;
      }
      pulses.add(p.withStart(Timing.toSeconds(start, rate)));
    }
    checkOrder(seq, pulses, rate);
    return new ConcreteSequence(seq.getName(), seq.getScanIndex(), seq.getScanValues(), rate,
        seq.getNominalDuration(), seq.getDuration(), seq.getRepeatCount(), pulses);
  }

  private static void checkOrder(ConcreteSequence seq, List<ConcretePulse> pulses, final BigDecimal rate) {
    for (OutputChannel ch : OutputChannel.values()) {
      List<ConcretePulse> on = Lists.newArrayList();
      for (ConcretePulse p : pulses) {
        if (p.getChannel() == ch) {
          on.add(p);
        }
      }
      Collections.sort(on, new Comparator<ConcretePulse>() {
        @Override
        public int compare(ConcretePulse a, ConcretePulse b) {
          return Long.compare(a.getStartSample(rate), b.getStartSample(rate));
        }
      });
      for (int i = 1; i < on.size(); i++) {
        ConcretePulse prev = on.get(i - 1);
        ConcretePulse cur = on.get(i);
        if (!cur.isConcurrent() && cur.getStartSample(rate) < prev.getEndSample(rate)) {
          throw new TimingOrderException(String.format(
              "%s: after calibration pulse %s overlaps pulse %s on output %s", seq, cur.getLabel(),
              prev.getLabel(), ch));
        }
      }
    }
  }

  /**
   * One line per output: its connection and delay.
   */
  public String getSummary() {
    List<String> lines = Lists.newArrayList();
    for (OutputChannel ch : OutputChannel.values()) {
      lines.add(String.format("output %s -> %s, %s", ch, getConnection(ch), Timing.format(getDelay(ch))));
    }
    return Joiner.on('\n').join(lines);
  }

  @Override
  public String toString() {
    return String.format("calibrator with %d connections and %d delays", connections.size(), delays.size());
  }
}
