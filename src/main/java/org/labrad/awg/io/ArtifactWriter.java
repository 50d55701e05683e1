package org.labrad.awg.io;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.List;

import org.labrad.awg.errors.CompilationAbortedException;
import org.labrad.awg.optimizer.OptimizedArtifact;
import org.labrad.awg.util.AbortFlag;
import org.labrad.awg.waveform.ChannelWaveform;
import org.labrad.awg.waveform.WaveformRenderer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.base.Preconditions;
import com.google.common.collect.Lists;
import com.google.common.io.MoreFiles;
import com.google.common.io.RecursiveDeleteOption;

/**
 * Writes all files of an artifact into a directory. Files are first written
 * to a staging directory next to the target, which replaces the target only
 * once everything has been written.
 */
public class ArtifactWriter {
  private static final Logger log = LoggerFactory.getLogger(ArtifactWriter.class);

  private final WaveformRenderer renderer;
  private final WaveformFileWriter waveformWriter = new WaveformFileWriter();
  private final SequenceTableWriter tableWriter = new SequenceTableWriter();
  private final TriggerScheduleWriter scheduleWriter = new TriggerScheduleWriter();
  private final AbortFlag abortFlag;

  public ArtifactWriter(WaveformRenderer renderer) {
    this(renderer, AbortFlag.never());
  }

  public ArtifactWriter(WaveformRenderer renderer, AbortFlag abortFlag) {
    this.renderer = Preconditions.checkNotNull(renderer);
    this.abortFlag = Preconditions.checkNotNull(abortFlag);
  }

  /**
   * Write the artifact into the target directory, replacing it if it exists.
   *
   * @return the files written: waveforms, then the sequence table, then the trigger schedule
   */
  public List<Path> write(OptimizedArtifact artifact, Path target) throws IOException {
    Path dir = target.toAbsolutePath();
    Path parent = dir.getParent();
    Files.createDirectories(parent);
    Path staging = Files.createTempDirectory(parent, "." + dir.getFileName() + ".staging");
    List<String> names = Lists.newArrayList();
    try {
      for (ChannelWaveform w : artifact.getWaveforms()) {
        if (abortFlag.isAborted()) {
          throw new CompilationAbortedException(artifact.getBlocks().size());
        }
        String name = artifact.getWaveformName(w);
        waveformWriter.writeWaveform(name, renderer.render(w), artifact.getSampleRate(), staging.resolve(name));
        names.add(name);
      }
      tableWriter.writeSequenceTable(artifact, staging.resolve(artifact.getTableName()));
      names.add(artifact.getTableName());
      scheduleWriter.writeSchedule(artifact, staging.resolve(artifact.getScheduleName()));
      names.add(artifact.getScheduleName());
    } catch (IOException | RuntimeException e) {
      log.warn("Discarding partial output for {}: {}", dir, e.getMessage());
      MoreFiles.deleteRecursively(staging, RecursiveDeleteOption.ALLOW_INSECURE);
      throw e;
    }

    Path previous = null;
    if (Files.exists(dir)) {
      previous = parent.resolve("." + dir.getFileName() + ".old-" + System.nanoTime());
      Files.move(dir, previous, StandardCopyOption.ATOMIC_MOVE);
    }
    try {
      moveIntoPlace(staging, dir);
    } catch (IOException | RuntimeException e) {
      log.warn("Could not move output into {}: {}", dir, e.getMessage());
      try {
        if (previous != null) {
          Files.move(previous, dir, StandardCopyOption.ATOMIC_MOVE);
        }
        MoreFiles.deleteRecursively(staging, RecursiveDeleteOption.ALLOW_INSECURE);
      } catch (IOException cleanup) {
        e.addSuppressed(cleanup);
      }
      throw e;
    }
    if (previous != null) {
      MoreFiles.deleteRecursively(previous, RecursiveDeleteOption.ALLOW_INSECURE);
    }
    log.info("Wrote {} files to {}", names.size(), dir);

    List<Path> files = Lists.newArrayList();
    for (String name : names) {
      files.add(dir.resolve(name));
    }
    return files;
  }

  /**
   * Rename the finished staging directory onto the target.
   */
  void moveIntoPlace(Path staging, Path target) throws IOException {
    Files.move(staging, target, StandardCopyOption.ATOMIC_MOVE);
  }
}
