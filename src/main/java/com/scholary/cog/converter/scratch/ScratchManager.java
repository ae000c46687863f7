package com.scholary.cog.converter.scratch;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.concurrent.atomic.AtomicLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Hands out per-job scratch scopes inside the configured temp directory.
 *
 * <p>In a Kubernetes setup the temp directory should point at an emptyDir volume.
 */
public class ScratchManager {

  private static final Logger LOGGER = LoggerFactory.getLogger(ScratchManager.class);

  private final Path tempDir;
  private final AtomicLong allocated = new AtomicLong();
  private final AtomicLong released = new AtomicLong();

  public ScratchManager(String tempDir) {
    this.tempDir = Paths.get(tempDir);
    try {
      Files.createDirectories(this.tempDir);
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to create temp directory: " + tempDir, e);
    }
    LOGGER.info("Scratch directory: {}", this.tempDir.toAbsolutePath());
  }

  public JobScratch openScope(String jobId) {
    return new JobScratch(jobId, tempDir, this);
  }

  public Path tempDir() {
    return tempDir;
  }

  /** Number of resources allocated and not yet released, across all jobs. */
  public long liveResources() {
    return allocated.get() - released.get();
  }

  void onAllocated() {
    allocated.incrementAndGet();
  }

  void onReleased() {
    released.incrementAndGet();
  }
}
