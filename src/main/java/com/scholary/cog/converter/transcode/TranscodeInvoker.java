package com.scholary.cog.converter.transcode;

import com.scholary.cog.converter.acquisition.DatasetHandle;
import com.scholary.cog.converter.profile.EncodingProfile;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Drives the transcode engine and refuses artifacts that fail structural validation.
 *
 * <p>A path returned from {@link #transcode} always points at a validated COG. On any failure the
 * artifact is deleted and a {@link TranscodeException} is thrown, so nothing unvalidated can reach
 * the upload step.
 */
@Component
public class TranscodeInvoker {

  private static final Logger LOGGER = LoggerFactory.getLogger(TranscodeInvoker.class);

  private final TranscodeEngine engine;
  private final EngineTuning tuning;

  @Autowired
  public TranscodeInvoker(TranscodeEngine engine, TranscodeProperties properties) {
    this(engine, properties.tuning());
  }

  public TranscodeInvoker(TranscodeEngine engine, EngineTuning tuning) {
    this.engine = engine;
    this.tuning = tuning;
  }

  public Path transcode(DatasetHandle source, Path destination, EncodingProfile profile) {
    Path artifact;
    try {
      artifact = engine.translate(source, destination, profile, tuning);
    } catch (TranscodeException e) {
      discard(destination);
      throw e;
    } catch (RuntimeException e) {
      discard(destination);
      throw new TranscodeException("Transcode engine failed for " + destination, e);
    }

    LOGGER.info("Validating generated COG file: {}", artifact);
    ValidationReport report;
    try {
      report = engine.validate(artifact);
    } catch (RuntimeException e) {
      discard(artifact);
      throw e instanceof TranscodeException
          ? e
          : new TranscodeException("Could not validate " + artifact, e);
    }

    report.warnings().forEach(warning -> LOGGER.warn("COG validation warning: {}", warning));
    if (!report.isValid()) {
      discard(artifact);
      throw new TranscodeException(
          String.format(
              "Generated file is not a valid COG: %s", String.join("; ", report.errors())));
    }
    return artifact;
  }

  private static void discard(Path artifact) {
    try {
      Files.deleteIfExists(artifact);
    } catch (IOException e) {
      LOGGER.warn("Failed to discard artifact {}: {}", artifact, e.getMessage());
    }
  }
}
