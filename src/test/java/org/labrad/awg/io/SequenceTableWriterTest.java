package org.labrad.awg.io;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.util.List;

import org.junit.jupiter.api.Test;
import org.labrad.awg.HardwareProfile;
import org.labrad.awg.builder.SequenceBuilder;
import org.labrad.awg.enums.JumpMode;
import org.labrad.awg.optimizer.HardwareOptimizer;
import org.labrad.awg.optimizer.OptimizedArtifact;
import org.labrad.awg.parser.SequenceParser;

public class SequenceTableWriterTest {

  private final SequenceTableWriter writer = new SequenceTableWriter();

  private static OptimizedArtifact compile(String... lines) {
    return new HardwareOptimizer(HardwareProfile.awg520()).optimize(
        new SequenceBuilder().build(new SequenceParser().parse(String.join("\n", lines))));
  }

  @Test
  void singleWaveformTable() {
    OptimizedArtifact artifact = compile(
        "sequence: duration=1us",
        "pi pulse on channel 1 at 0ns, gaussian, 100ns, 1.0");
    assertEquals("MAGIC 3002 \r\n"
        + "LINES 1\r\n"
        + "\"parsed_sequence_0000.wfm\",\"\",1,OFF,GOTO,1\r\n"
        + "JUMP_MODE SOFTWARE\r\n"
        + "JUMP_TIMING SYNC\r\n"
        + "STROBE 0\r\n", writer.toString(artifact));
  }

  @Test
  void fileNamesFollowTheSequenceName() {
    OptimizedArtifact artifact = compile(
        "sequence: name=echo test, duration=1us, repeat=20",
        "a on channel 2 at 0ns, square, 100ns, 0.5");
    String text = writer.toString(artifact);
    assertTrue(text.contains("\"\",\"echo_test_0000.wfm\",20,OFF,GOTO,1\r\n"), text);
    assertEquals("echo_test.seq", artifact.getTableName());
  }

  @Test
  void deadTimeTableReadsBack() throws IOException {
    OptimizedArtifact artifact = compile(
        "sequence: name=long, duration=20ms",
        "pi pulse on channel 1 at 0ns, square, 100ns, 1.0");
    SequenceTableReader.Table table = new SequenceTableReader().parse(writer.toString(artifact));
    List<SequenceTableReader.Line> lines = table.getLines();
    assertEquals(3, lines.size());

    assertTrue(lines.get(0).isWaitTrigger());
    assertEquals(JumpMode.NEXT, lines.get(0).getJumpMode());
    assertEquals("long_0000.wfm", lines.get(1).getWaveforms().get(0));
    assertEquals("", lines.get(1).getWaveforms().get(1));
    assertFalse(lines.get(1).isWaitTrigger());
    assertTrue(lines.get(2).isWaitTrigger());
    assertEquals(JumpMode.GOTO, lines.get(2).getJumpMode());
    assertEquals(2, lines.get(2).getJumpTarget());

    assertEquals("SOFTWARE", table.getSettings().get("JUMP_MODE"));
    assertEquals("0", table.getSettings().get("STROBE"));
  }

  @Test
  void readerRejectsTruncatedTables() {
    SequenceTableReader reader = new SequenceTableReader();
    assertThrows(IOException.class, () -> reader.parse("MAGIC 3002 \r\nLINES 2\r\n\"a.wfm\",\"\",1,OFF,NEXT,0\r\n"));
    assertThrows(IOException.class, () -> reader.parse("MAGIC 1000 \r\nLINES 0\r\n"));
  }
}
