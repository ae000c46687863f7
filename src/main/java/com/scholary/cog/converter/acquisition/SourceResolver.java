package com.scholary.cog.converter.acquisition;

import com.scholary.cog.converter.scratch.JobScratch;
import com.scholary.cog.converter.scratch.ScratchResource;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Turns any {@link SourceSpecifier} into an opened {@link DatasetHandle}.
 *
 * <p>Local paths and byte arrays are checked before anything is allocated, so a bad reference
 * fails with {@link InvalidSourceException} and leaves no scratch file behind.
 */
@Component
public class SourceResolver {

  private static final Logger LOGGER = LoggerFactory.getLogger(SourceResolver.class);

  private final DatasetOpener datasetOpener;

  public SourceResolver(DatasetOpener datasetOpener) {
    this.datasetOpener = datasetOpener;
  }

  public DatasetHandle resolve(SourceSpecifier source, JobScratch scratch) {
    return source.accept(
        new SourceSpecifier.Cases<>() {
          @Override
          public DatasetHandle localPath(Path path) {
            Path resolved = path.toAbsolutePath().normalize();
            if (!Files.isRegularFile(resolved) || !Files.isReadable(resolved)) {
              throw new InvalidSourceException("Input file does not exist on disk: " + resolved);
            }
            LOGGER.debug("Opening local source: {}", resolved);
            return datasetOpener.open(resolved.toString());
          }

          @Override
          public DatasetHandle inMemoryBytes(byte[] data, String suffix) {
            if (data.length == 0) {
              throw new InvalidSourceException("Input bytes are empty");
            }
            ScratchResource resource = scratch.allocate(suffix);
            try {
              Files.write(resource.path(), data);
            } catch (IOException e) {
              throw new UncheckedIOException(
                  "Failed to spill input bytes to " + resource.path(), e);
            }
            resource.markInUse();
            LOGGER.debug("Spilled {} input bytes to {}", data.length, resource.path());
            return datasetOpener.open(resource.path().toString());
          }

          @Override
          public DatasetHandle remoteHandle(DatasetHandle handle) {
            return handle;
          }
        });
  }
}
