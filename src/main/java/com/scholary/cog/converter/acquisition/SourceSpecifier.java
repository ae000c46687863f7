package com.scholary.cog.converter.acquisition;

import java.nio.file.Path;
import java.util.Objects;

/**
 * The three ways a job may reference its input raster.
 *
 * <ul>
 *   <li>{@link LocalPath}: a file on local disk
 *   <li>{@link InMemoryBytes}: the raw bytes of a GeoTIFF
 *   <li>{@link RemoteHandle}: a dataset already opened against a remote URL
 * </ul>
 *
 * <p>Consumers handle each case through {@link Cases} instead of inspecting the runtime type.
 */
public interface SourceSpecifier {

  <R> R accept(Cases<R> cases);

  /** One method per kind of source. */
  interface Cases<R> {

    R localPath(Path path);

    R inMemoryBytes(byte[] data, String suffix);

    R remoteHandle(DatasetHandle handle);
  }

  static SourceSpecifier localPath(Path path) {
    return new LocalPath(path);
  }

  static SourceSpecifier inMemoryBytes(byte[] data, String suffix) {
    return new InMemoryBytes(data, suffix);
  }

  static SourceSpecifier remoteHandle(DatasetHandle handle) {
    return new RemoteHandle(handle);
  }

  record LocalPath(Path path) implements SourceSpecifier {

    public LocalPath {
      Objects.requireNonNull(path, "path must not be null");
    }

    @Override
    public <R> R accept(Cases<R> cases) {
      return cases.localPath(path);
    }
  }

  /**
   * Raw raster bytes.
   *
   * @param data the bytes
   * @param suffix file name suffix used when the bytes are spilled to disk, e.g. {@code ".tif"}
   */
  record InMemoryBytes(byte[] data, String suffix) implements SourceSpecifier {

    public InMemoryBytes {
      Objects.requireNonNull(data, "data must not be null");
      suffix = suffix == null || suffix.isEmpty() ? ".tif" : suffix;
    }

    @Override
    public <R> R accept(Cases<R> cases) {
      return cases.inMemoryBytes(data, suffix);
    }
  }

  record RemoteHandle(DatasetHandle handle) implements SourceSpecifier {

    public RemoteHandle {
      Objects.requireNonNull(handle, "handle must not be null");
    }

    @Override
    public <R> R accept(Cases<R> cases) {
      return cases.remoteHandle(handle);
    }
  }
}
