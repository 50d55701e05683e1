package org.labrad.awg.io;

import java.io.BufferedInputStream;
import java.io.DataInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import org.labrad.awg.waveform.RenderedWaveform;

import com.google.common.io.ByteStreams;
import com.google.common.io.LittleEndianDataInputStream;

/**
 * Reads waveform files written by {@link WaveformFileWriter}.
 */
public class WaveformFileReader {

  public static final class Contents {
    private final short[] samples;
    private final byte[] markers;
    private final double clock;

    Contents(short[] samples, byte[] markers, double clock) {
      this.samples = samples;
      this.markers = markers;
      this.clock = clock;
    }

    public short[] getSamples() {
      return samples;
    }

    public byte[] getMarkers() {
      return markers;
    }

    /**
     * Sample rate in Hz.
     */
    public double getClock() {
      return clock;
    }

    public int getLength() {
      return samples.length;
    }

    /**
     * Levels as fractions of full scale.
     */
    public RenderedWaveform toRendered() {
      double[] levels = new double[samples.length];
      for (int i = 0; i < samples.length; i++) {
        levels[i] = samples[i] / (double) WaveformFileWriter.FULL_SCALE;
      }
      return new RenderedWaveform(levels, markers.clone());
    }
  }

  public Contents read(Path file) throws IOException {
    try (InputStream in = new BufferedInputStream(Files.newInputStream(file))) {
      return read(in);
    }
  }

  public Contents read(InputStream in) throws IOException {
    DataInputStream din = new DataInputStream(in);
    byte[] magic = new byte[WaveformFileWriter.MAGIC.length()];
    din.readFully(magic);
    if (!new String(magic, StandardCharsets.US_ASCII).equals(WaveformFileWriter.MAGIC)) {
      throw new IOException("Not a waveform file: bad magic");
    }
    if (din.readByte() != '#') {
      throw new IOException("Missing data block marker");
    }
    int digits = din.readByte() - '0';
    if (digits < 1 || digits > 9) {
      throw new IOException("Bad data block length digit count " + digits);
    }
    byte[] countBytes = new byte[digits];
    din.readFully(countBytes);
    long nbytes = Long.parseLong(new String(countBytes, StandardCharsets.US_ASCII));
    if (nbytes % WaveformFileWriter.BYTES_PER_SAMPLE != 0) {
      throw new IOException("Data block of " + nbytes + " bytes is not a whole number of samples");
    }
    int len = (int) (nbytes / WaveformFileWriter.BYTES_PER_SAMPLE);
    short[] samples = new short[len];
    byte[] markers = new byte[len];
    LittleEndianDataInputStream data = new LittleEndianDataInputStream(din);
    for (int i = 0; i < len; i++) {
      samples[i] = data.readShort();
      markers[i] = data.readByte();
    }
    String trailer = new String(ByteStreams.toByteArray(din), StandardCharsets.US_ASCII).trim();
    if (!trailer.startsWith("CLOCK ")) {
      throw new IOException("Missing CLOCK trailer");
    }
    double clock;
    try {
      clock = Double.parseDouble(trailer.substring("CLOCK ".length()).trim());
    } catch (NumberFormatException e) {
      throw new IOException("Bad CLOCK trailer '" + trailer + "'", e);
    }
    return new Contents(samples, markers, clock);
  }
}
