package com.scholary.cog.converter.profile;

import com.scholary.cog.converter.acquisition.DatasetHandle;
import java.util.Locale;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Chooses the encoding profile for a raster.
 *
 * <p>Decision order:
 *
 * <ol>
 *   <li>Elevation data always stays lossless ({@code deflate}). The predictor follows the sample
 *       type: 3 (floating point) when every band is floating point, 2 (horizontal differencing)
 *       otherwise. Overviews use bilinear resampling, or cubic when smoothing is requested;
 *       nearest neighbour is never used because it grids the terrain.
 *   <li>Otherwise, if lossy compression is acceptable, {@code jpeg} at quality 85.
 *   <li>Otherwise the lossless baseline.
 * </ol>
 *
 * <p>Elevation wins over compression when both flags are set. WebP is never chosen here: with
 * alpha or mask bands the encoder has been seen to hang, so it is only available as an explicit
 * profile.
 *
 * <p>The selector holds no state. Every call returns a profile built from a freshly allocated
 * option map.
 */
@Component
public class ProfileSelector {

  private static final Logger LOGGER = LoggerFactory.getLogger(ProfileSelector.class);

  static final String JPEG_QUALITY = "85";

  /**
   * The profile identifier for a classification.
   *
   * <p>The identifier does not depend on the dataset, so the destination key can be derived before
   * anything is downloaded.
   */
  public String profileIdFor(RasterClassification classification) {
    if (classification.dem()) {
      return CogProfiles.DEFLATE;
    }
    if (classification.compress()) {
      return CogProfiles.JPEG;
    }
    return CogProfiles.DEFLATE;
  }

  public EncodingProfile select(RasterClassification classification, DatasetHandle dataset) {
    return select(classification, dataset, Map.of());
  }

  /**
   * Build the encoding profile for a dataset.
   *
   * @param classification how the raster should be treated
   * @param dataset the opened dataset
   * @param extraOptions caller-supplied creation options, applied last
   * @return a new profile
   */
  public EncodingProfile select(
      RasterClassification classification,
      DatasetHandle dataset,
      Map<String, String> extraOptions) {
    String profileId = profileIdFor(classification);
    Map<String, String> options = CogProfiles.baselineOptions(profileId);

    if (classification.dem()) {
      String predictor = dataset.allFloatingPoint() ? "3" : "2";
      options.put(CogProfiles.PREDICTOR, predictor);
      options.put(CogProfiles.RESAMPLING, classification.smoothDem() ? "CUBIC" : "BILINEAR");
      LOGGER.debug(
          "Elevation profile: dtypes={}, predictor={}, resampling={}",
          dataset.sampleDtypes(),
          predictor,
          options.get(CogProfiles.RESAMPLING));
    } else if (classification.compress()) {
      options.put(CogProfiles.QUALITY, JPEG_QUALITY);
    }

    if (classification.webOptimized()) {
      options.put(CogProfiles.TILING_SCHEME, "GoogleMapsCompatible");
    }

    if (extraOptions != null) {
      extraOptions.forEach((name, value) -> options.put(name.toUpperCase(Locale.ROOT), value));
    }

    LOGGER.debug("Selected profile {} with options {}", profileId, options);
    return new EncodingProfile(profileId, options);
  }
}
