package org.labrad.awg.io;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.labrad.awg.enums.JumpMode;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Lists;
import com.google.common.collect.Maps;
import com.google.common.io.MoreFiles;

/**
 * Reads sequence tables written by {@link SequenceTableWriter}.
 */
public class SequenceTableReader {
  private static final Pattern ENTRY = Pattern.compile("^((?:\"[^\"]*\",)+)(\\d+),(ON|OFF),(NEXT|GOTO),(\\d+)$");
  private static final Pattern NAME = Pattern.compile("\"([^\"]*)\",");

  public static final class Line {
    private final List<String> waveforms;
    private final long repeat;
    private final boolean waitTrigger;
    private final JumpMode jumpMode;
    private final int jumpTarget;

    Line(List<String> waveforms, long repeat, boolean waitTrigger, JumpMode jumpMode, int jumpTarget) {
      this.waveforms = ImmutableList.copyOf(waveforms);
      this.repeat = repeat;
      this.waitTrigger = waitTrigger;
      this.jumpMode = jumpMode;
      this.jumpTarget = jumpTarget;
    }

    /**
     * Waveform file per analog channel, empty for an unused channel.
     */
    public List<String> getWaveforms() {
      return waveforms;
    }

    public long getRepeat() {
      return repeat;
    }

    public boolean isWaitTrigger() {
      return waitTrigger;
    }

    public JumpMode getJumpMode() {
      return jumpMode;
    }

    public int getJumpTarget() {
      return jumpTarget;
    }
  }

  public static final class Table {
    private final ImmutableList<Line> lines;
    private final ImmutableMap<String, String> settings;

    Table(List<Line> lines, Map<String, String> settings) {
      this.lines = ImmutableList.copyOf(lines);
      this.settings = ImmutableMap.copyOf(settings);
    }

    public List<Line> getLines() {
      return lines;
    }

    /**
     * Trailing settings such as JUMP_MODE, keyed by name.
     */
    public Map<String, String> getSettings() {
      return settings;
    }
  }

  public Table read(Path file) throws IOException {
    return parse(MoreFiles.asCharSource(file, StandardCharsets.US_ASCII).read());
  }

  public Table parse(String text) throws IOException {
    List<String> rows = Lists.newArrayList(text.split("\r\n", -1));
    if (rows.isEmpty() || !(rows.get(0) + "\r\n").equals(SequenceTableWriter.MAGIC)) {
      throw new IOException("Not a sequence file: bad magic");
    }
    if (rows.size() < 2 || !rows.get(1).startsWith("LINES ")) {
      throw new IOException("Missing LINES header");
    }
    int count;
    try {
      count = Integer.parseInt(rows.get(1).substring("LINES ".length()).trim());
    } catch (NumberFormatException e) {
      throw new IOException("Bad LINES header '" + rows.get(1) + "'", e);
    }
    if (rows.size() < 2 + count) {
      throw new IOException("Expected " + count + " entries");
    }
    List<Line> lines = Lists.newArrayList();
    for (int i = 0; i < count; i++) {
      String row = rows.get(2 + i);
      Matcher m = ENTRY.matcher(row);
      if (!m.matches()) {
        throw new IOException("Malformed sequence entry '" + row + "'");
      }
      List<String> names = Lists.newArrayList();
      Matcher nm = NAME.matcher(m.group(1));
      while (nm.find()) {
        names.add(nm.group(1));
      }
      lines.add(new Line(names, Long.parseLong(m.group(2)), m.group(3).equals("ON"),
          JumpMode.fromString(m.group(4)), Integer.parseInt(m.group(5))));
    }
    Map<String, String> settings = Maps.newLinkedHashMap();
    for (String row : rows.subList(2 + count, rows.size())) {
      if (row.isEmpty()) continue;
      int space = row.indexOf(' ');
      if (space < 0) {
        throw new IOException("Malformed setting '" + row + "'");
      }
      settings.put(row.substring(0, space), row.substring(space + 1));
    }
    return new Table(lines, settings);
  }
}
