package org.labrad.awg;

import java.math.BigDecimal;

public class Constants {
  /*
   * Sample rate used when the sequence header does not give one (1 GHz)
   */
  public static final BigDecimal DEFAULT_SAMPLE_RATE = new BigDecimal("1E+9");

  /*
   * Header defaults
   */
  public static final String DEFAULT_SEQUENCE_NAME = "parsed_sequence";
  public static final String DEFAULT_EXPERIMENT_TYPE = "custom";
  public static final long DEFAULT_REPEAT_COUNT = 1;

  /*
   * Pulse defaults when the shape, duration or amplitude field is omitted
   */
  public static final String DEFAULT_PULSE_SHAPE = "gaussian";
  public static final String DEFAULT_PULSE_DURATION = "100ns";
  public static final String DEFAULT_PULSE_AMPLITUDE = "1.0";

  /*
   * Hardware profile bundled for the Tektronix AWG520
   */
  public static final String AWG520_PROFILE = "/org/labrad/awg/awg520.properties";

  /*
   * Default wiring of the AWG520 outputs and the delays of the devices they drive
   */
  public static final String AWG520_CONNECTIONS = "/org/labrad/awg/awg520-connections.properties";

  /*
   * Connection name of an output that drives nothing
   */
  public static final String UNASSIGNED = "unassigned";

  /*
   * Presets shipped on the classpath, one DSL file each
   */
  public static final String PRESET_PATH = "/org/labrad/awg/presets/";
  public static final String[] STANDARD_PRESETS = {"rabi", "ramsey", "spin_echo"};

  /*
   * Output level of analog channels during dead time and arming
   */
  public static final double SAFE_LEVEL = 0.0;
}
