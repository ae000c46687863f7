package com.scholary.cog.converter.service;

import com.scholary.cog.converter.acquisition.DatasetHandle;
import com.scholary.cog.converter.profile.EncodingProfile;
import com.scholary.cog.converter.transcode.EngineTuning;
import com.scholary.cog.converter.transcode.TranscodeEngine;
import com.scholary.cog.converter.transcode.TranscodeException;
import com.scholary.cog.converter.transcode.ValidationReport;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Engine that writes a marker file per call. Local sources whose content starts with {@code
 * CORRUPT} fail the way a broken raster makes gdal_translate fail.
 */
class CountingTranscodeEngine implements TranscodeEngine {

  static final byte[] CORRUPT = "CORRUPT".getBytes(StandardCharsets.UTF_8);

  private final List<String> translated = new ArrayList<>();

  int translations() {
    return translated.size();
  }

  @Override
  public Path translate(
      DatasetHandle source, Path destination, EncodingProfile profile, EngineTuning tuning) {
    try {
      Path input = Path.of(source.location());
      if (Files.isRegularFile(input)
          && new String(Files.readAllBytes(input), StandardCharsets.UTF_8).startsWith("CORRUPT")) {
        throw new TranscodeException("gdal_translate exited with code 1: not a TIFF file");
      }
      translated.add(source.location());
      Files.write(
          destination,
          ("COG " + profile.profileId() + " of " + source.location())
              .getBytes(StandardCharsets.UTF_8));
    } catch (IOException e) {
      throw new UncheckedIOException(e);
    }
    return destination;
  }

  @Override
  public ValidationReport validate(Path artifact) {
    return ValidationReport.valid();
  }
}
