package com.scholary.cog.converter.transcode;

import com.scholary.cog.converter.acquisition.DatasetHandle;
import com.scholary.cog.converter.profile.EncodingProfile;
import java.nio.file.Path;

/**
 * The external engine that does the pixel work: tiling, overviews and compression.
 *
 * <p>The pipeline never touches pixels itself. It hands the engine a dataset, a destination and an
 * encoding profile, and checks the result.
 */
public interface TranscodeEngine {

  /**
   * Write a Cloud-Optimized GeoTIFF.
   *
   * @param source the dataset to convert
   * @param destination where to write the artifact
   * @param profile the encoding profile
   * @param tuning engine knobs
   * @return the path of the artifact
   * @throws TranscodeException if the engine fails
   */
  Path translate(
      DatasetHandle source, Path destination, EncodingProfile profile, EngineTuning tuning);

  /**
   * Check the structure of an artifact: tiled layout, ordered overviews and a COG header.
   *
   * @param artifact the file to check
   * @return the validation outcome
   * @throws TranscodeException if the artifact cannot be inspected at all
   */
  ValidationReport validate(Path artifact);
}
