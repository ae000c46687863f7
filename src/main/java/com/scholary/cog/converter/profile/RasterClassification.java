package com.scholary.cog.converter.profile;

/**
 * How a raster should be treated when picking its encoding.
 *
 * @param dem the raster is a digital elevation model
 * @param compress lossy compression is acceptable (ignored for elevation data)
 * @param smoothDem build elevation overviews with cubic instead of bilinear resampling
 * @param webOptimized align tiles to the Web Mercator tile grid
 */
public record RasterClassification(
    boolean dem, boolean compress, boolean smoothDem, boolean webOptimized) {

  public static RasterClassification lossless() {
    return new RasterClassification(false, false, false, false);
  }
}
