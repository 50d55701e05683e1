package org.labrad.awg.io;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Map;

import org.labrad.awg.enums.OutputChannel;
import org.labrad.awg.waveform.RenderedWaveform;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Lists;
import com.google.common.collect.Maps;

/**
 * Reads back a directory written by {@link ArtifactWriter} and recovers the
 * pulse timing of each scan point from the files alone.
 */
public class ArtifactReader {
  private static final Logger log = LoggerFactory.getLogger(ArtifactReader.class);

  private final SequenceTableReader tableReader = new SequenceTableReader();
  private final TriggerScheduleReader scheduleReader = new TriggerScheduleReader();
  private final WaveformFileReader waveformReader = new WaveformFileReader();

  /**
   * Files of one written artifact.
   */
  public static final class WrittenArtifact {
    private final SequenceTableReader.Table table;
    private final TriggerScheduleReader.Schedule schedule;
    private final ImmutableMap<String, WaveformFileReader.Contents> waveforms;

    WrittenArtifact(SequenceTableReader.Table table, TriggerScheduleReader.Schedule schedule,
        Map<String, WaveformFileReader.Contents> waveforms) {
      this.table = table;
      this.schedule = schedule;
      this.waveforms = ImmutableMap.copyOf(waveforms);
    }

    public SequenceTableReader.Table getTable() {
      return table;
    }

    public TriggerScheduleReader.Schedule getSchedule() {
      return schedule;
    }

    public WaveformFileReader.Contents getWaveform(String name) {
      WaveformFileReader.Contents w = waveforms.get(name);
      Preconditions.checkArgument(w != null, "No waveform file %s", name);
      return w;
    }

    /**
     * Samples one pass of the block takes, waveforms and holds together.
     */
    public long getPlayedSamples(TriggerScheduleReader.Block block) {
      long position = 0;
      for (int line = block.getFirstLine(); line <= block.getLastLine(); line++) {
        position += lineLength(line) + schedule.getHoldSamples(line);
      }
      return position;
    }

    /**
     * Pulses of one block, ordered by start and then by channel.
     */
    public List<RecoveredPulse> recoverPulses(TriggerScheduleReader.Block block) {
      List<RecoveredPulse> pulses = Lists.newArrayList();
      long position = 0;
      for (int line = block.getFirstLine(); line <= block.getLastLine(); line++) {
        List<String> names = table.getLines().get(line - 1).getWaveforms();
        for (int c = 0; c < names.size(); c++) {
          if (names.get(c).isEmpty()) {
            continue;
          }
          RenderedWaveform w = getWaveform(names.get(c)).toRendered();
          addAnalogRuns(w, c + 1, position, pulses);
          addMarkerRuns(w, c + 1, 0, position, pulses);
          addMarkerRuns(w, c + 1, 1, position, pulses);
        }
        position += lineLength(line) + schedule.getHoldSamples(line);
      }
      Collections.sort(pulses, new Comparator<RecoveredPulse>() {
        @Override
        public int compare(RecoveredPulse a, RecoveredPulse b) {
          int c = Long.compare(a.getStart(), b.getStart());
          return c != 0 ? c : Integer.compare(a.getChannel().getId(), b.getChannel().getId());
        }
      });
      return pulses;
    }

    private long lineLength(int line) {
      for (String name : table.getLines().get(line - 1).getWaveforms()) {
        if (!name.isEmpty()) {
          return getWaveform(name).getLength();
        }
      }
      throw new IllegalStateException("Table line " + line + " plays no waveform");
    }

    private static void addAnalogRuns(RenderedWaveform w, int analogChannel, long offset,
        List<RecoveredPulse> pulses) {
      double[] levels = w.getLevels();
      int i = 0;
      while (i < levels.length) {
        if (levels[i] == 0.0) {
          i++;
          continue;
        }
        int start = i;
        double peak = 0.0;
        while (i < levels.length && levels[i] != 0.0) {
          if (Math.abs(levels[i]) > Math.abs(peak)) {
            peak = levels[i];
          }
          i++;
        }
        pulses.add(new RecoveredPulse(OutputChannel.fromId(analogChannel), offset + start, i - start, peak));
      }
    }

    private static void addMarkerRuns(RenderedWaveform w, int analogChannel, int bit, long offset,
        List<RecoveredPulse> pulses) {
      int len = w.getLength();
      int i = 0;
      while (i < len) {
        if (!w.getMarker(i, bit)) {
          i++;
          continue;
        }
        int start = i;
        while (i < len && w.getMarker(i, bit)) {
          i++;
        }
        pulses.add(new RecoveredPulse(OutputChannel.marker(analogChannel, bit), offset + start, i - start, 1.0));
      }
    }
  }

  /**
   * Read the table, the trigger schedule and every waveform the table names.
   *
   * @param fileBase name stem shared by the artifact's files
   */
  public WrittenArtifact read(Path dir, String fileBase) throws IOException {
    SequenceTableReader.Table table = tableReader.read(dir.resolve(fileBase + ".seq"));
    TriggerScheduleReader.Schedule schedule = scheduleReader.read(dir.resolve(fileBase + ".sched"));
    if (schedule.getLineCount() != table.getLines().size()) {
      throw new IOException(String.format("Schedule covers %d lines but the table has %d",
          schedule.getLineCount(), table.getLines().size()));
    }
    Map<String, WaveformFileReader.Contents> waveforms = Maps.newHashMap();
    for (SequenceTableReader.Line line : table.getLines()) {
      for (String name : line.getWaveforms()) {
        if (!name.isEmpty() && !waveforms.containsKey(name)) {
          Path file = dir.resolve(name);
          if (!Files.exists(file)) {
            throw new IOException("Table refers to missing waveform file " + file);
          }
          waveforms.put(name, waveformReader.read(file));
        }
      }
    }
    log.debug("Read {} from {}: {} lines, {} waveforms", fileBase, dir, table.getLines().size(), waveforms.size());
    return new WrittenArtifact(table, schedule, waveforms);
  }
}
