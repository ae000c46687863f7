package com.scholary.cog.converter.transcode;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.ArrayList;
import java.util.List;

/**
 * Structural checks on the {@code gdalinfo -json} description of a COG.
 *
 * <p>Errors:
 *
 * <ul>
 *   <li>the IFD layout is not flagged as COG (header ghost area and ordered directories)
 *   <li>a band is not tiled with square tiles that are a multiple of 16 px
 *   <li>overviews are not strictly decreasing in size, or bands disagree on their count
 * </ul>
 *
 * <p>A raster larger than 512 px on a side without overviews only produces a warning, since the
 * file is still valid and readable, just slow to zoom out of.
 */
public final class CogStructureValidator {

  static final int OVERVIEW_THRESHOLD = 512;

  private CogStructureValidator() {}

  public static ValidationReport validate(JsonNode info) {
    List<String> errors = new ArrayList<>();
    List<String> warnings = new ArrayList<>();

    String layout = info.path("metadata").path("IMAGE_STRUCTURE").path("LAYOUT").asText("");
    if (!"COG".equalsIgnoreCase(layout)) {
      String shown = layout.isEmpty() ? "<missing>" : layout;
      errors.add("IFD layout is not COG (LAYOUT=" + shown + ")");
    }

    int width = info.path("size").path(0).asInt(0);
    int height = info.path("size").path(1).asInt(0);
    JsonNode bands = info.path("bands");
    if (!bands.isArray() || bands.isEmpty()) {
      errors.add("Dataset has no bands");
      return new ValidationReport(errors, warnings);
    }

    int expectedOverviews = -1;
    for (JsonNode band : bands) {
      int bandNumber = band.path("band").asInt();
      int blockX = band.path("block").path(0).asInt(0);
      int blockY = band.path("block").path(1).asInt(0);
      if (blockX != blockY || blockX == 0 || blockX % 16 != 0) {
        errors.add(
            String.format("Band %d is not tiled (block %dx%d)", bandNumber, blockX, blockY));
      }

      JsonNode overviews = band.path("overviews");
      int overviewCount = overviews.isArray() ? overviews.size() : 0;
      if (expectedOverviews < 0) {
        expectedOverviews = overviewCount;
      } else if (overviewCount != expectedOverviews) {
        errors.add(
            String.format(
                "Band %d has %d overviews, band 1 has %d",
                bandNumber, overviewCount, expectedOverviews));
      }

      int previousWidth = width;
      int previousHeight = height;
      for (int i = 0; i < overviewCount; i++) {
        int overviewWidth = overviews.path(i).path("size").path(0).asInt(0);
        int overviewHeight = overviews.path(i).path("size").path(1).asInt(0);
        boolean shrinks =
            overviewWidth <= previousWidth
                && overviewHeight <= previousHeight
                && (overviewWidth < previousWidth || overviewHeight < previousHeight);
        if (!shrinks) {
          errors.add(
              String.format(
                  "Band %d overview %d (%dx%d) is not smaller than the previous level (%dx%d)",
                  bandNumber, i, overviewWidth, overviewHeight, previousWidth, previousHeight));
        }
        previousWidth = overviewWidth;
        previousHeight = overviewHeight;
      }
    }

    if ((width > OVERVIEW_THRESHOLD || height > OVERVIEW_THRESHOLD) && expectedOverviews == 0) {
      warnings.add(
          String.format(
              "Raster is %dx%d but has no internal overviews", width, height));
    }

    return new ValidationReport(errors, warnings);
  }
}
