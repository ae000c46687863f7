package com.scholary.cog.converter.scratch;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A local scratch file owned by exactly one job.
 *
 * <p>Lifecycle: {@code CREATED -> IN_USE -> RELEASED}. A resource may also go straight from
 * CREATED to RELEASED when the job fails before writing to it. Release happens once: the first
 * call deletes the file, later calls do nothing. After release the path is no longer handed out.
 */
public final class ScratchResource {

  private static final Logger LOGGER = LoggerFactory.getLogger(ScratchResource.class);

  public enum State {
    CREATED,
    IN_USE,
    RELEASED
  }

  private final Path path;
  private final AtomicReference<State> state = new AtomicReference<>(State.CREATED);

  ScratchResource(Path path) {
    this.path = path;
  }

  /**
   * The local path.
   *
   * @throws IllegalStateException if the resource was already released
   */
  public Path path() {
    if (state.get() == State.RELEASED) {
      throw new IllegalStateException("Scratch resource already released: " + path);
    }
    return path;
  }

  public State state() {
    return state.get();
  }

  /**
   * Mark the resource as holding data.
   *
   * @return this resource
   * @throws IllegalStateException if the resource was already released
   */
  public ScratchResource markInUse() {
    if (!state.compareAndSet(State.CREATED, State.IN_USE) && state.get() == State.RELEASED) {
      throw new IllegalStateException("Scratch resource already released: " + path);
    }
    return this;
  }

  /**
   * Delete the file and move to RELEASED.
   *
   * @return true if this call performed the release, false if it had already happened
   */
  boolean release() {
    State previous = state.getAndSet(State.RELEASED);
    if (previous == State.RELEASED) {
      return false;
    }
    try {
      Files.deleteIfExists(path);
      LOGGER.debug("Released scratch resource: {} (was {})", path, previous);
    } catch (IOException e) {
      // The resource is released from the job's point of view either way
      LOGGER.warn("Failed to delete scratch file {}: {}", path, e.getMessage());
    }
    return true;
  }

  @Override
  public String toString() {
    return "ScratchResource[" + path + ", " + state.get() + "]";
  }
}
