package com.scholary.cog.converter.service;

/**
 * Derives where a converted raster is stored.
 *
 * <p>The COG sits next to its source: {@code a/b.tif} converted with profile {@code jpeg} becomes
 * {@code a/b_COG_jpeg.tif}. A key without an extension keeps none.
 */
public final class DestinationKeys {

  private DestinationKeys() {}

  public static String derive(String sourceKey, String profileId) {
    if (sourceKey == null || sourceKey.isBlank() || sourceKey.endsWith("/")) {
      throw new IllegalArgumentException("Source key must name an object: '" + sourceKey + "'");
    }
    int slash = sourceKey.lastIndexOf('/');
    String directory = sourceKey.substring(0, slash + 1);
    String fileName = sourceKey.substring(slash + 1);

    // A leading dot marks a hidden file, not an extension
    int dot = fileName.lastIndexOf('.');
    String stem = dot > 0 ? fileName.substring(0, dot) : fileName;
    String extension = dot > 0 ? fileName.substring(dot) : "";

    return directory + stem + "_COG_" + profileId + extension;
  }
}
