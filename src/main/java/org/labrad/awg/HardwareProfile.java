package org.labrad.awg;

import java.io.IOException;
import java.io.Reader;
import java.net.URL;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.Properties;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Maps;
import com.google.common.io.Resources;

/**
 * Memory and sequencer limits of the target instrument, kept as a map of
 * named integer properties the same way board build properties are.
 */
public class HardwareProfile {

  public static final String MAX_WAVEFORM_SAMPLES = "MAX_WAVEFORM_SAMPLES";
  public static final String MAX_SEQUENCE_LINES = "MAX_SEQUENCE_LINES";
  public static final String WAVEFORM_GRANULARITY = "WAVEFORM_GRANULARITY";
  public static final String MIN_WAVEFORM_LENGTH = "MIN_WAVEFORM_LENGTH";
  public static final String DEAD_TIME_THRESHOLD = "DEAD_TIME_THRESHOLD";
  public static final String ANALOG_CHANNELS = "ANALOG_CHANNELS";
  public static final String FULL_SCALE_MILLIVOLTS = "FULL_SCALE_MILLIVOLTS";

  private static final String[] REQUIRED = {
    MAX_WAVEFORM_SAMPLES, MAX_SEQUENCE_LINES, WAVEFORM_GRANULARITY, MIN_WAVEFORM_LENGTH,
    DEAD_TIME_THRESHOLD, ANALOG_CHANNELS, FULL_SCALE_MILLIVOLTS
  };

  private final String name;
  private final ImmutableMap<String, Long> properties;

  private HardwareProfile(String name, Map<String, Long> properties) {
    for (String key : REQUIRED) {
      Preconditions.checkArgument(properties.containsKey(key),
          "Hardware profile '%s' is missing property %s", name, key);
      Preconditions.checkArgument(properties.get(key) > 0,
          "Hardware profile '%s': %s must be positive", name, key);
    }
    long min = properties.get(MIN_WAVEFORM_LENGTH);
    Preconditions.checkArgument(min % properties.get(WAVEFORM_GRANULARITY) == 0,
        "Hardware profile '%s': MIN_WAVEFORM_LENGTH must be a multiple of WAVEFORM_GRANULARITY", name);
    Preconditions.checkArgument(properties.get(DEAD_TIME_THRESHOLD) >= 2 * min,
        "Hardware profile '%s': DEAD_TIME_THRESHOLD must be at least twice MIN_WAVEFORM_LENGTH", name);
    Preconditions.checkArgument(properties.get(MAX_WAVEFORM_SAMPLES) >= min,
        "Hardware profile '%s': MAX_WAVEFORM_SAMPLES is below MIN_WAVEFORM_LENGTH", name);
    this.name = name;
    this.properties = ImmutableMap.copyOf(properties);
  }

  /**
   * The bundled AWG520 profile.
   */
  public static HardwareProfile awg520() {
    return fromResource("AWG520", Constants.AWG520_PROFILE);
  }

  public static HardwareProfile fromResource(String name, String resource) {
    URL url = Resources.getResource(HardwareProfile.class, resource);
    Properties props = new Properties();
    try (Reader reader = Resources.asCharSource(url, StandardCharsets.UTF_8).openStream()) {
      props.load(reader);
    } catch (IOException e) {
      throw new IllegalStateException("Failed to load hardware profile from " + resource, e);
    }
    return fromProperties(name, props);
  }

  public static HardwareProfile fromProperties(String name, Properties props) {
    Map<String, Long> values = Maps.newHashMap();
    for (String key : props.stringPropertyNames()) {
      String value = props.getProperty(key).trim();
      try {
        values.put(key, Long.valueOf(value));
      } catch (NumberFormatException e) {
        throw new IllegalArgumentException(String.format(
            "Hardware profile '%s': property %s has non-integer value '%s'", name, key, value), e);
      }
    }
    return new HardwareProfile(name, values);
  }

  /**
   * Copy of this profile with one property replaced.
   */
  public HardwareProfile withProperty(String key, long value) {
    Map<String, Long> values = Maps.newHashMap(properties);
    values.put(key, value);
    return new HardwareProfile(name, values);
  }

  public String getName() {
    return name;
  }

  public long get(String key) {
    Preconditions.checkArgument(properties.containsKey(key),
        "Property %s is undefined for hardware profile %s", key, name);
    return properties.get(key);
  }

  public Map<String, Long> getProperties() {
    return properties;
  }

  public long getMaxWaveformSamples() {
    return get(MAX_WAVEFORM_SAMPLES);
  }

  public int getMaxSequenceLines() {
    return (int) get(MAX_SEQUENCE_LINES);
  }

  public int getWaveformGranularity() {
    return (int) get(WAVEFORM_GRANULARITY);
  }

  public int getMinWaveformLength() {
    return (int) get(MIN_WAVEFORM_LENGTH);
  }

  public long getDeadTimeThreshold() {
    return get(DEAD_TIME_THRESHOLD);
  }

  public int getAnalogChannels() {
    return (int) get(ANALOG_CHANNELS);
  }

  public double getFullScaleVolts() {
    return get(FULL_SCALE_MILLIVOLTS) / 1000.0;
  }

  /**
   * Get the proper length for a waveform after padding.
   * The length should be a multiple of the granularity and at least the minimum length.
   */
  public long getPaddedLength(long len) {
    int granularity = getWaveformGranularity();
    if (len % granularity == 0 && len >= getMinWaveformLength()) return len;
    long paddedLen = Math.max(len + ((granularity - len % granularity) % granularity), getMinWaveformLength());
    return paddedLen;
  }

  @Override
  public String toString() {
    return name + properties;
  }
}
