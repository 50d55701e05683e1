package org.labrad.awg.io;

import java.io.IOException;
import java.io.StringWriter;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import org.labrad.awg.optimizer.OptimizedArtifact;
import org.labrad.awg.table.TableEntry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes the sequence table as text, one line per entry:
 * {@code "<ch1 file>","<ch2 file>",<repeat>,<ON|OFF>,<NEXT|GOTO>,<target>}.
 */
public class SequenceTableWriter {
  private static final Logger log = LoggerFactory.getLogger(SequenceTableWriter.class);

  static final String MAGIC = "MAGIC 3002 \r\n";
  static final String EOL = "\r\n";

  public void writeSequenceTable(OptimizedArtifact artifact, Path file) throws IOException {
    try (Writer out = Files.newBufferedWriter(file, StandardCharsets.US_ASCII)) {
      writeSequenceTable(artifact, out);
    }
    log.debug("Wrote {} ({} lines)", file, artifact.getTable().size());
  }

  public String toString(OptimizedArtifact artifact) {
    StringWriter out = new StringWriter();
    try {
      writeSequenceTable(artifact, out);
    } catch (IOException e) {
      throw new IllegalStateException("In-memory write failed", e);
    }
    return out.toString();
  }

  public void writeSequenceTable(OptimizedArtifact artifact, Writer out) throws IOException {
    int channels = artifact.getProfile().getAnalogChannels();
    out.write(MAGIC);
    out.write("LINES " + artifact.getTable().size() + EOL);
    for (TableEntry entry : artifact.getTable().getEntries()) {
      StringBuilder line = new StringBuilder();
      for (int ch = 1; ch <= channels; ch++) {
        line.append('"').append(artifact.getWaveformName(entry.getWaveform(ch))).append("\",");
      }
      line.append(entry.getRepeat()).append(',')
          .append(entry.isWaitTrigger() ? "ON" : "OFF").append(',')
          .append(entry.getJumpMode()).append(',')
          .append(entry.getJumpTarget());
      out.write(line.toString() + EOL);
    }
    out.write("JUMP_MODE SOFTWARE" + EOL);
    out.write("JUMP_TIMING SYNC" + EOL);
    out.write("STROBE 0" + EOL);
  }
}
