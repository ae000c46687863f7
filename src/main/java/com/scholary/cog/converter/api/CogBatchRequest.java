package com.scholary.cog.converter.api;

import com.scholary.cog.converter.profile.RasterClassification;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import java.util.List;
import java.util.Map;

/**
 * Request for converting a batch of rasters.
 *
 * <p>Every key is converted with the same flags. {@code bucket} falls back to the configured
 * working bucket and {@code preload} to the configured acquisition mode when left out.
 */
public record CogBatchRequest(
    @NotEmpty List<@NotBlank String> sourceKeys,
    String bucket,
    String replicateFrom,
    Boolean preload,
    Boolean overwrite,
    Boolean compress,
    Boolean dem,
    Boolean smoothDem,
    Boolean webOptimized,
    Map<@NotBlank String, @NotNull String> profileOptions,
    Boolean makePublic) {

  // Provide defaults
  public CogBatchRequest {
    if (overwrite == null) {
      overwrite = false;
    }
    if (compress == null) {
      compress = false;
    }
    if (dem == null) {
      dem = false;
    }
    if (smoothDem == null) {
      smoothDem = false;
    }
    if (webOptimized == null) {
      webOptimized = false;
    }
    if (profileOptions == null) {
      profileOptions = Map.of();
    }
    if (makePublic == null) {
      makePublic = false;
    }
  }

  public RasterClassification classification() {
    return new RasterClassification(dem, compress, smoothDem, webOptimized);
  }
}
