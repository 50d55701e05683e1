package org.labrad.awg.enums;

import java.util.Map;

import com.google.common.base.Preconditions;
import com.google.common.collect.Maps;

public enum PulseShape {
  SQUARE("square"),
  GAUSSIAN("gaussian"),
  SECH("sech"),
  LORENTZIAN("lorentzian"),
  SINE("sine"),
  LOADFILE("loadfile");

  private final String name;
  private static final Map<String, PulseShape> map = Maps.newHashMap();

  PulseShape(String name) {
    this.name = name;
  }

  public String toString() {
    return name;
  }

  public static boolean isKnown(String name) {
    return map.containsKey(name.toLowerCase());
  }

  static {
    for (PulseShape s : values()) {
      map.put(s.name, s);
    }
    map.put("file", LOADFILE);
    map.put("external", LOADFILE);
  }

  public static PulseShape fromString(String name) {
    String key = name.toLowerCase();
    Preconditions.checkArgument(map.containsKey(key),
        "Invalid pulse shape '%s'", name);
    return map.get(key);
  }
}
