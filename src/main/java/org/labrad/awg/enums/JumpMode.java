package org.labrad.awg.enums;

import java.util.Map;

import com.google.common.base.Preconditions;
import com.google.common.collect.Maps;

public enum JumpMode {
  NEXT("NEXT"),
  GOTO("GOTO");

  private final String name;
  private static final Map<String, JumpMode> map = Maps.newHashMap();

  JumpMode(String name) {
    this.name = name;
  }

  public String toString() {
    return name;
  }

  static {
    for (JumpMode m : values()) {
      map.put(m.name, m);
    }
  }

  public static JumpMode fromString(String name) {
    String key = name.toUpperCase();
    Preconditions.checkArgument(map.containsKey(key),
        "Invalid jump mode '%s'", name);
    return map.get(key);
  }
}
