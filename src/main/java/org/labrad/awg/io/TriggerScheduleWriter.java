package org.labrad.awg.io;

import java.io.IOException;
import java.io.StringWriter;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import org.labrad.awg.optimizer.OptimizedArtifact;
import org.labrad.awg.optimizer.ScanPointBlock;
import org.labrad.awg.table.SequenceTable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes what the trigger source needs to play a sequence table with the right
 * timing: the hold after every line, in samples, and the statistics repeat of
 * every scan point block.
 *
 * <pre>
 * SCHEDULE 1
 * CLOCK 1.0000000000E+09
 * LINES &lt;n&gt;
 * &lt;line&gt;,&lt;hold samples&gt;
 * BLOCKS &lt;m&gt;
 * &lt;scan index&gt;,&lt;first line&gt;,&lt;last line&gt;,&lt;repeat&gt;,&lt;nominal samples&gt;,&lt;duration samples&gt;
 * </pre>
 */
public class TriggerScheduleWriter {
  private static final Logger log = LoggerFactory.getLogger(TriggerScheduleWriter.class);

  static final String MAGIC = "SCHEDULE 1";
  static final String EOL = "\r\n";

  public void writeSchedule(OptimizedArtifact artifact, Path file) throws IOException {
    try (Writer out = Files.newBufferedWriter(file, StandardCharsets.US_ASCII)) {
      writeSchedule(artifact, out);
    }
    log.debug("Wrote {} ({} blocks)", file, artifact.getBlocks().size());
  }

  public String toString(OptimizedArtifact artifact) {
    StringWriter out = new StringWriter();
    try {
      writeSchedule(artifact, out);
    } catch (IOException e) {
      throw new IllegalStateException("In-memory write failed", e);
    }
    return out.toString();
  }

  public void writeSchedule(OptimizedArtifact artifact, Writer out) throws IOException {
    SequenceTable table = artifact.getTable();
    out.write(MAGIC + EOL);
    out.write(WaveformFileWriter.clockTrailer(artifact.getSampleRate()));
    out.write("LINES " + table.size() + EOL);
    for (int line = 1; line <= table.size(); line++) {
      out.write(line + "," + table.getLine(line).getHoldSamples() + EOL);
    }
    out.write("BLOCKS " + artifact.getBlocks().size() + EOL);
    for (ScanPointBlock b : artifact.getBlocks()) {
      out.write(b.getScanIndex() + "," + b.getFirstLine() + "," + b.getLastLine() + ","
          + b.getRepeatCount() + "," + b.getNominalSamples() + "," + b.getDurationSamples() + EOL);
    }
  }
}
