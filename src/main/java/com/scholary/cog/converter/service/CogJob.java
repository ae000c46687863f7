package com.scholary.cog.converter.service;

import com.scholary.cog.converter.acquisition.AcquisitionMode;
import com.scholary.cog.converter.acquisition.SourceSpecifier;
import com.scholary.cog.converter.profile.RasterClassification;
import java.util.Map;
import java.util.Objects;

/**
 * One conversion: a source object, where its COG goes and how to produce it.
 *
 * <p>Created by {@link CogBatchService} for one pass and owned by that pass only.
 *
 * @param jobId unique id, also used to name the job's scratch files
 * @param bucket the working bucket holding source and destination
 * @param sourceKey the source object key
 * @param profileId the encoding profile identifier the destination key was derived from
 * @param destinationKey where the COG is uploaded
 * @param classification how the raster is treated
 * @param overwrite convert even if the destination already exists
 * @param acquisitionMode how the source is read from the store
 * @param replicateFrom bucket to copy the source from before processing, or null
 * @param profileOptions extra creation options, applied after the selected profile
 * @param inlineSource a source supplied directly instead of read from the store, or null
 * @throws IllegalArgumentException if a profile option has a blank name or no value
 */
public record CogJob(
    String jobId,
    String bucket,
    String sourceKey,
    String profileId,
    String destinationKey,
    RasterClassification classification,
    boolean overwrite,
    AcquisitionMode acquisitionMode,
    String replicateFrom,
    Map<String, String> profileOptions,
    SourceSpecifier inlineSource) {

  public CogJob {
    Objects.requireNonNull(jobId, "jobId must not be null");
    Objects.requireNonNull(bucket, "bucket must not be null");
    Objects.requireNonNull(sourceKey, "sourceKey must not be null");
    Objects.requireNonNull(classification, "classification must not be null");
    Objects.requireNonNull(acquisitionMode, "acquisitionMode must not be null");
    profileOptions = profileOptions == null ? Map.of() : checkedCopy(profileOptions);
  }

  /** True when the source has to be copied in from another bucket first. */
  public boolean needsReplication() {
    return replicateFrom != null && !replicateFrom.isBlank() && !replicateFrom.equals(bucket);
  }

  private static Map<String, String> checkedCopy(Map<String, String> options) {
    for (Map.Entry<String, String> option : options.entrySet()) {
      if (option.getKey() == null || option.getKey().isBlank()) {
        throw new IllegalArgumentException("Profile option name must not be blank");
      }
      if (option.getValue() == null) {
        throw new IllegalArgumentException(
            String.format("Profile option %s has no value", option.getKey()));
      }
    }
    return Map.copyOf(options);
  }
}
