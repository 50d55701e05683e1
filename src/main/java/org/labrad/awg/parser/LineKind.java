package org.labrad.awg.parser;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Kinds of sequence lines, tried in declaration order. The first pattern
 * that matches classifies the line.
 */
enum LineKind {
  HEADER("^sequence\\s*:\\s*(.*)$"),
  VARIABLE("^variable:?\\s+([A-Za-z_][A-Za-z0-9_]*)\\s*[,:]\\s*(.*)$"),
  PRESET("^load\\s+preset\\s+(\\S+)$"),
  LOOP("^loop:?\\s+(\\S+?)(?:\\s+at\\s+(\\S+?))?\\s*:?$"),
  IF("^if\\s+(.+?)\\s*:?$"),
  ELSE("^else\\s*:?$"),
  END("^end$"),
  PULSE("^(\\S+)\\s+(?:pulse\\s+)?on\\s+channel\\s+(\\S+)\\s+at\\s+(.+)$");

  private final Pattern pattern;

  LineKind(String regex) {
    this.pattern = Pattern.compile(regex, Pattern.CASE_INSENSITIVE);
  }

  /**
   * Match a trimmed, non-comment line against this kind. Returns null when it does not match.
   */
  public Matcher match(String line) {
    Matcher m = pattern.matcher(line);
    return m.matches() ? m : null;
  }
}
