package org.labrad.awg;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

import org.labrad.awg.builder.BuildOptions;
import org.labrad.awg.builder.BuildResult;
import org.labrad.awg.builder.ConcreteSequence;
import org.labrad.awg.builder.SequenceBuilder;
import org.labrad.awg.calibration.HardwareCalibrator;
import org.labrad.awg.description.SequenceDescription;
import org.labrad.awg.enums.OutputChannel;
import org.labrad.awg.io.ArtifactWriter;
import org.labrad.awg.optimizer.HardwareOptimizer;
import org.labrad.awg.optimizer.OptimizedArtifact;
import org.labrad.awg.parser.PresetRegistry;
import org.labrad.awg.parser.SequenceParser;
import org.labrad.awg.util.AbortFlag;
import org.labrad.awg.waveform.WaveformRenderer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;

import picocli.CommandLine;

/**
 * Runs the whole pipeline: parse, build every scan point, optimize for the
 * device and write the files.
 */
public class AwgCompiler {
  private static final Logger log = LoggerFactory.getLogger(AwgCompiler.class);

  private final HardwareProfile profile;
  private final SequenceParser parser;
  private final SequenceBuilder builder = new SequenceBuilder();
  private final HardwareOptimizer optimizer;
  private final ArtifactWriter writer;
  private final BuildOptions buildOptions;
  private final HardwareCalibrator calibrator;

  public AwgCompiler() {
    this(HardwareProfile.awg520(), PresetRegistry.standard(), new WaveformRenderer(),
        BuildOptions.defaults());
  }

  public AwgCompiler(HardwareProfile profile, PresetRegistry presets, WaveformRenderer renderer,
      BuildOptions buildOptions) {
    this(profile, presets, renderer, buildOptions, HardwareCalibrator.none());
  }

  public AwgCompiler(HardwareProfile profile, PresetRegistry presets, WaveformRenderer renderer,
      BuildOptions buildOptions, HardwareCalibrator calibrator) {
    this.profile = Preconditions.checkNotNull(profile);
    this.buildOptions = Preconditions.checkNotNull(buildOptions);
    this.calibrator = Preconditions.checkNotNull(calibrator);
    AbortFlag abortFlag = buildOptions.getAbortFlag();
    this.parser = new SequenceParser(presets);
    this.optimizer = new HardwareOptimizer(profile, abortFlag);
    this.writer = new ArtifactWriter(renderer, abortFlag);
  }

  public HardwareProfile getProfile() {
    return profile;
  }

  public SequenceDescription parse(String source) {
    return parser.parse(source);
  }

  public BuildResult build(SequenceDescription desc) {
    BuildResult result = builder.build(desc, buildOptions);
    if (result.getSequences().isEmpty()) {
      // best effort with nothing left to compile
      throw result.getFailures().get(0).getError();
    }
    return result;
  }

  /**
   * Build every scan point and compensate the output delays.
   */
  public List<ConcreteSequence> buildCalibrated(SequenceDescription desc) {
    List<OutputChannel> missing = calibrator.validateConnections(desc.getType());
    if (!missing.isEmpty()) {
      log.warn("{} experiments need outputs {}, which are not connected", desc.getType(), missing);
    }
    return calibrator.calibrate(build(desc).getSequences());
  }

  /**
   * Compile source text into a single artifact holding every scan point.
   */
  public OptimizedArtifact compile(String source) {
    SequenceDescription desc = parse(source);
    OptimizedArtifact artifact = optimizer.optimize(buildCalibrated(desc));
    log.info("Compiled {}: {}", artifact.getName(), artifact.getSummary());
    return artifact;
  }

  /**
   * Compile source text into as many artifacts as the device memory requires.
   */
  public List<OptimizedArtifact> compileInBatches(String source) {
    SequenceDescription desc = parse(source);
    List<OptimizedArtifact> artifacts = optimizer.optimizeInBatches(buildCalibrated(desc));
    for (OptimizedArtifact artifact : artifacts) {
      log.info("Compiled {}: {}", artifact.getName(), artifact.getSummary());
    }
    return artifacts;
  }

  public List<Path> write(OptimizedArtifact artifact, Path outputDir) throws IOException {
    return writer.write(artifact, outputDir);
  }

  /**
   * Compile a DSL file and write the artifact into outputDir.
   */
  public List<Path> compileFile(Path input, Path outputDir) throws IOException {
    SequenceDescription desc = parser.parseFile(input);
    OptimizedArtifact artifact = optimizer.optimize(buildCalibrated(desc));
    log.info("Compiled {}: {}", artifact.getName(), artifact.getSummary());
    return write(artifact, outputDir);
  }

  /**
   * Compile a DSL file in batch mode, writing each artifact into its own
   * sub-directory of outputDir named after the artifact.
   */
  public List<Path> compileFileInBatches(Path input, Path outputDir) throws IOException {
    SequenceDescription desc = parser.parseFile(input);
    List<OptimizedArtifact> artifacts = optimizer.optimizeInBatches(buildCalibrated(desc));
    List<Path> files = Lists.newArrayList();
    for (OptimizedArtifact artifact : artifacts) {
      log.info("Compiled {}: {}", artifact.getName(), artifact.getSummary());
      files.addAll(write(artifact, outputDir.resolve(artifact.getFileBase())));
    }
    return ImmutableList.copyOf(files);
  }

  /**
   * Run the compiler from the command line.
   */
  public static void main(String[] args) {
    System.exit(new CommandLine(new AwgCompilerCommand()).execute(args));
  }
}
