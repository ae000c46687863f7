package com.scholary.cog.converter.scratch;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.UUID;

/**
 * The scratch resources of one job.
 *
 * <p>Opened at the start of a job and closed when the job ends, whatever the outcome. Closing
 * releases every resource allocated through this scope exactly once. Use with try-with-resources.
 */
public final class JobScratch implements AutoCloseable {

  private final String jobId;
  private final Path directory;
  private final ScratchManager manager;
  private final List<ScratchResource> resources = new ArrayList<>();
  private boolean closed;

  JobScratch(String jobId, Path directory, ScratchManager manager) {
    this.jobId = jobId;
    this.directory = directory;
    this.manager = manager;
  }

  /**
   * Allocate a new scratch file path. The file itself is not created.
   *
   * @param suffix file name suffix, e.g. {@code ".tif"}
   * @return a resource in state CREATED whose path no other job can collide with
   */
  public synchronized ScratchResource allocate(String suffix) {
    if (closed) {
      throw new IllegalStateException("Scratch scope already closed for job " + jobId);
    }
    Path path = directory.resolve("cog-" + jobId + "-" + UUID.randomUUID() + suffix);
    ScratchResource resource = new ScratchResource(path);
    resources.add(resource);
    manager.onAllocated();
    return resource;
  }

  public String jobId() {
    return jobId;
  }

  public synchronized List<ScratchResource> resources() {
    return Collections.unmodifiableList(new ArrayList<>(resources));
  }

  /** Release every resource of this job. Safe to call more than once. */
  @Override
  public synchronized void close() {
    if (closed) {
      return;
    }
    closed = true;
    for (ScratchResource resource : resources) {
      if (resource.release()) {
        manager.onReleased();
      }
    }
  }
}
