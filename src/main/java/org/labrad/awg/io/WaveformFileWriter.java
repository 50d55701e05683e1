package org.labrad.awg.io;

import java.io.BufferedOutputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;

import org.labrad.awg.errors.SampleRangeException;
import org.labrad.awg.waveform.LengthChecker;
import org.labrad.awg.waveform.RenderedWaveform;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.io.LittleEndianDataOutputStream;

/**
 * Writes waveform files: an ASCII header, a block of samples, each a signed
 * 16-bit little-endian level followed by one marker byte, and an ASCII clock trailer.
 */
public class WaveformFileWriter {
  private static final Logger log = LoggerFactory.getLogger(WaveformFileWriter.class);

  static final String MAGIC = "MAGIC 1000 \r\n";
  static final int BYTES_PER_SAMPLE = 3;
  static final int FULL_SCALE = 32767;
  static final int GRANULARITY = 4;

  public void writeWaveform(String name, RenderedWaveform waveform, BigDecimal sampleRate, Path file)
      throws IOException {
    try (OutputStream out = new BufferedOutputStream(Files.newOutputStream(file))) {
      writeWaveform(name, waveform, sampleRate, out);
    }
    log.debug("Wrote {} ({} samples)", file, waveform.getLength());
  }

  public byte[] toBytes(String name, RenderedWaveform waveform, BigDecimal sampleRate) {
    ByteArrayOutputStream out = new ByteArrayOutputStream();
    try {
      writeWaveform(name, waveform, sampleRate, out);
    } catch (IOException e) {
      throw new IllegalStateException("In-memory write failed", e);
    }
    return out.toByteArray();
  }

  public void writeWaveform(String name, RenderedWaveform waveform, BigDecimal sampleRate, OutputStream out)
      throws IOException {
    int len = waveform.getLength();
    LengthChecker.checkGranularity(len, GRANULARITY);
    double[] levels = waveform.getLevels();
    byte[] markers = waveform.getMarkers();

    String nbytes = Long.toString((long) len * BYTES_PER_SAMPLE);
    out.write(MAGIC.getBytes(StandardCharsets.US_ASCII));
    out.write(("#" + nbytes.length() + nbytes).getBytes(StandardCharsets.US_ASCII));

    LittleEndianDataOutputStream data = new LittleEndianDataOutputStream(out);
    for (int i = 0; i < len; i++) {
      data.writeShort(toSample(name, i, levels[i]));
      data.writeByte(markers[i] & 0x03);
    }
    data.flush();
    out.write(clockTrailer(sampleRate).getBytes(StandardCharsets.US_ASCII));
  }

  static String clockTrailer(BigDecimal sampleRate) {
    return String.format(Locale.ROOT, "CLOCK %.10E\r\n", sampleRate.doubleValue());
  }

  /**
   * Convert a level in [-1, 1] to the signed 16-bit output format.
   *
   * @throws SampleRangeException if the level does not fit
   */
  static short toSample(String name, int index, double level) {
    if (Double.isNaN(level)) {
      throw rangeError(name, index, level);
    }
    long value = Math.round(level * FULL_SCALE);
    if (value < Short.MIN_VALUE || value > Short.MAX_VALUE) {
      throw rangeError(name, index, level);
    }
    return (short) value;
  }

  private static SampleRangeException rangeError(String name, int index, double level) {
    SampleRangeException e = new SampleRangeException(name, index, level);
    // amplitudes are limited to full scale before rendering
    log.error("Internal invariant violated: {}", e.getMessage());
    return e;
  }
}
