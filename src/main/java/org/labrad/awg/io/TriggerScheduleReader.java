package org.labrad.awg.io;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.List;

import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;
import com.google.common.io.MoreFiles;

/**
 * Reads trigger schedules written by {@link TriggerScheduleWriter}.
 */
public class TriggerScheduleReader {
  private static final Splitter FIELDS = Splitter.on(',').trimResults();

  public static final class Block {
    private final int scanIndex;
    private final int firstLine;
    private final int lastLine;
    private final long repeat;
    private final long nominalSamples;
    private final long durationSamples;

    Block(int scanIndex, int firstLine, int lastLine, long repeat, long nominalSamples, long durationSamples) {
      this.scanIndex = scanIndex;
      this.firstLine = firstLine;
      this.lastLine = lastLine;
      this.repeat = repeat;
      this.nominalSamples = nominalSamples;
      this.durationSamples = durationSamples;
    }

    public int getScanIndex() {
      return scanIndex;
    }

    public int getFirstLine() {
      return firstLine;
    }

    public int getLastLine() {
      return lastLine;
    }

    public long getRepeat() {
      return repeat;
    }

    public long getNominalSamples() {
      return nominalSamples;
    }

    public long getDurationSamples() {
      return durationSamples;
    }
  }

  public static final class Schedule {
    private final double clock;
    private final long[] holds;
    private final ImmutableList<Block> blocks;

    Schedule(double clock, long[] holds, List<Block> blocks) {
      this.clock = clock;
      this.holds = holds;
      this.blocks = ImmutableList.copyOf(blocks);
    }

    public double getClock() {
      return clock;
    }

    public int getLineCount() {
      return holds.length;
    }

    /**
     * Hold after a 1-based table line, in samples.
     */
    public long getHoldSamples(int line) {
      return holds[line - 1];
    }

    public List<Block> getBlocks() {
      return blocks;
    }
  }

  public Schedule read(Path file) throws IOException {
    return parse(MoreFiles.asCharSource(file, StandardCharsets.US_ASCII).read());
  }

  public Schedule parse(String text) throws IOException {
    List<String> rows = Lists.newArrayList();
    for (String row : text.split("\r\n")) {
      if (!row.isEmpty()) {
        rows.add(row);
      }
    }
    if (rows.isEmpty() || !rows.get(0).equals(TriggerScheduleWriter.MAGIC)) {
      throw new IOException("Not a trigger schedule: bad magic");
    }
    int pos = 1;
    double clock;
    try {
      clock = Double.parseDouble(value(rows, pos++, "CLOCK"));
    } catch (NumberFormatException e) {
      throw new IOException("Bad CLOCK row", e);
    }
    int lineCount = count(rows, pos++, "LINES");
    long[] holds = new long[lineCount];
    for (int i = 0; i < lineCount; i++) {
      long[] fields = numbers(rows, pos++, 2);
      if (fields[0] != i + 1) {
        throw new IOException("Expected line " + (i + 1) + " but found " + fields[0]);
      }
      holds[i] = fields[1];
    }
    int blockCount = count(rows, pos++, "BLOCKS");
    List<Block> blocks = Lists.newArrayList();
    for (int i = 0; i < blockCount; i++) {
      long[] f = numbers(rows, pos++, 6);
      if (f[1] < 1 || f[2] > lineCount || f[2] < f[1]) {
        throw new IOException("Block " + f[0] + " refers to lines outside the table");
      }
      blocks.add(new Block((int) f[0], (int) f[1], (int) f[2], f[3], f[4], f[5]));
    }
    return new Schedule(clock, holds, blocks);
  }

  private static String value(List<String> rows, int pos, String key) throws IOException {
    if (pos >= rows.size() || !rows.get(pos).startsWith(key + " ")) {
      throw new IOException("Missing " + key + " row");
    }
    return rows.get(pos).substring(key.length() + 1).trim();
  }

  private static int count(List<String> rows, int pos, String key) throws IOException {
    try {
      return Integer.parseInt(value(rows, pos, key));
    } catch (NumberFormatException e) {
      throw new IOException("Bad " + key + " row '" + rows.get(pos) + "'", e);
    }
  }

  private static long[] numbers(List<String> rows, int pos, int expected) throws IOException {
    if (pos >= rows.size()) {
      throw new IOException("Trigger schedule ends early");
    }
    List<String> fields = FIELDS.splitToList(rows.get(pos));
    if (fields.size() != expected) {
      throw new IOException("Malformed schedule row '" + rows.get(pos) + "'");
    }
    long[] result = new long[expected];
    try {
      for (int i = 0; i < expected; i++) {
        result[i] = Long.parseLong(fields.get(i));
      }
    } catch (NumberFormatException e) {
      throw new IOException("Malformed schedule row '" + rows.get(pos) + "'", e);
    }
    return result;
  }
}
