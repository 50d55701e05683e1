package org.labrad.awg.waveform;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;
import java.util.Map;

import org.labrad.awg.errors.InvalidParameterException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.base.Preconditions;
import com.google.common.base.Splitter;
import com.google.common.collect.Lists;
import com.google.common.collect.Maps;
import com.google.common.io.MoreFiles;

/**
 * External waveforms stored as CSV files of time,amplitude rows under one
 * directory. The first row is a header. Files are resampled linearly.
 */
public class CsvWaveformSource implements ExternalWaveformSource {
  private static final Logger log = LoggerFactory.getLogger(CsvWaveformSource.class);
  private static final Splitter FIELDS = Splitter.on(',').trimResults();

  private final Path directory;
  private final Map<String, double[][]> cache = Maps.newHashMap();

  public CsvWaveformSource(Path directory) {
    this.directory = Preconditions.checkNotNull(directory);
  }

  @Override
  public synchronized double[] load(String name, int length) {
    Preconditions.checkArgument(length > 0, "length must be positive");
    double[][] table = cache.get(name);
    if (table == null) {
      table = read(name);
      cache.put(name, table);
    }
    return resample(table[0], table[1], length);
  }

  private double[][] read(String name) {
    Path file = directory.resolve(name.endsWith(".csv") ? name : name + ".csv");
    List<String> lines;
    try {
      lines = MoreFiles.asCharSource(file, StandardCharsets.UTF_8).readLines();
    } catch (IOException e) {
      throw new InvalidParameterException("Cannot read external waveform " + file, e);
    }
    List<double[]> rows = Lists.newArrayList();
    for (int i = 1; i < lines.size(); i++) {
      String line = lines.get(i).trim();
      if (line.isEmpty()) {
        continue;
      }
      List<String> fields = FIELDS.splitToList(line);
      if (fields.size() < 2) {
        throw new InvalidParameterException(String.format("%s line %d: expected time,amplitude", file, i + 1));
      }
      try {
        rows.add(new double[] {Double.parseDouble(fields.get(0)), Double.parseDouble(fields.get(1))});
      } catch (NumberFormatException e) {
        throw new InvalidParameterException(String.format("%s line %d: %s", file, i + 1, e.getMessage()), e);
      }
    }
    if (rows.isEmpty()) {
      throw new InvalidParameterException("External waveform " + file + " has no samples");
    }
    double[] times = new double[rows.size()];
    double[] values = new double[rows.size()];
    for (int i = 0; i < rows.size(); i++) {
      times[i] = rows.get(i)[0];
      values[i] = rows.get(i)[1];
      if (i > 0 && times[i] <= times[i - 1]) {
        throw new InvalidParameterException(String.format("%s: times must increase (row %d)", file, i + 2));
      }
    }
    log.debug("Read external waveform {} ({} points)", file, rows.size());
    return new double[][] {times, values};
  }

  /**
   * Linear interpolation of (times, values) onto length evenly spaced points
   * spanning the first to the last time.
   */
  static double[] resample(double[] times, double[] values, int length) {
    double[] out = new double[length];
    if (times.length == 1 || length == 1) {
      Arrays.fill(out, values[0]);
      return out;
    }
    double t0 = times[0];
    double span = times[times.length - 1] - t0;
    int j = 0;
    for (int i = 0; i < length; i++) {
      double t = t0 + span * i / (length - 1);
      while (j < times.length - 2 && times[j + 1] < t) {
        j++;
      }
      double frac = (t - times[j]) / (times[j + 1] - times[j]);
      frac = Math.max(0.0, Math.min(1.0, frac));
      out[i] = values[j] + frac * (values[j + 1] - values[j]);
    }
    return out;
  }
}
