package com.scholary.cog.converter.acquisition;

import java.util.List;
import java.util.Objects;

/**
 * An opened raster dataset, reduced to what encoding decisions need.
 *
 * @param location what the transcode engine should read: a local path or a GDAL virtual file
 *     system path such as {@code /vsicurl/https://...}
 * @param bandCount number of bands
 * @param sampleDtypes per-band sample types, in band order, as lower-case tags ({@code uint8},
 *     {@code int16}, {@code float32}, ...)
 */
public record DatasetHandle(String location, int bandCount, List<String> sampleDtypes) {

  public DatasetHandle {
    Objects.requireNonNull(location, "location must not be null");
    sampleDtypes = List.copyOf(sampleDtypes);
    if (bandCount != sampleDtypes.size()) {
      throw new IllegalArgumentException(
          String.format(
              "Band count %d does not match %d sample types", bandCount, sampleDtypes.size()));
    }
  }

  /** True when the dataset has at least one band and every band holds floating point samples. */
  public boolean allFloatingPoint() {
    return !sampleDtypes.isEmpty() && sampleDtypes.stream().allMatch(t -> t.startsWith("float"));
  }
}
