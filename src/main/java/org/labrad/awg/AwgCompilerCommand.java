package org.labrad.awg;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.Callable;

import org.labrad.awg.builder.BuildOptions;
import org.labrad.awg.calibration.HardwareCalibrator;
import org.labrad.awg.errors.CompilationException;
import org.labrad.awg.parser.PresetRegistry;
import org.labrad.awg.waveform.CsvWaveformSource;
import org.labrad.awg.waveform.WaveformRenderer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

/**
 * Command line front end: awg-compiler &lt;input.seq&gt; &lt;output-dir&gt;
 * <p>
 * Exits with 0 on success, 1 when the sequence does not compile or a file
 * cannot be read or written, and 2 on bad arguments.
 */
@Command(name = "awg-compiler", mixinStandardHelpOptions = true,
    description = "Compile a pulse sequence into AWG520 waveform, sequence table and trigger schedule files")
public class AwgCompilerCommand implements Callable<Integer> {
  private static final Logger log = LoggerFactory.getLogger(AwgCompilerCommand.class);

  @Parameters(index = "0", description = "Sequence source file")
  private Path input;

  @Parameters(index = "1", description = "Directory the files are written to")
  private Path output;

  @Option(names = "--best-effort", description = "Skip scan points that fail instead of stopping")
  private boolean bestEffort;

  @Option(names = "--batches", description = "Split the scan into as many artifacts as the device memory needs")
  private boolean batches;

  @Option(names = "--waveforms", paramLabel = "<dir>", description = "Directory of CSV files for loadfile pulses")
  private Path waveformDir;

  @Option(names = "--calibrate", description = "Compensate output delays using the bundled AWG520 wiring")
  private boolean calibrate;

  @Option(names = "--connections", paramLabel = "<file>",
      description = "Compensate output delays using the wiring in this properties file")
  private Path connections;

  @Override
  public Integer call() {
    BuildOptions options = BuildOptions.defaults();
    if (bestEffort) {
      options = options.bestEffort();
    }
    WaveformRenderer renderer = waveformDir == null
        ? new WaveformRenderer()
        : new WaveformRenderer(new CsvWaveformSource(waveformDir));
    try {
      HardwareCalibrator calibrator = HardwareCalibrator.none();
      if (connections != null) {
        calibrator = HardwareCalibrator.fromFile(connections);
      } else if (calibrate) {
        calibrator = HardwareCalibrator.standard();
      }
      AwgCompiler compiler = new AwgCompiler(HardwareProfile.awg520(), PresetRegistry.standard(),
          renderer, options, calibrator);
      List<Path> files = batches
          ? compiler.compileFileInBatches(input, output)
          : compiler.compileFile(input, output);
      log.info("Wrote {} files for {}", files.size(), input);
      return 0;
    } catch (CompilationException e) {
      log.error("Compilation of {} failed: {}", input, e.getMessage());
      return 1;
    } catch (IOException e) {
      log.error("I/O error compiling {}", input, e);
      return 1;
    }
  }
}
