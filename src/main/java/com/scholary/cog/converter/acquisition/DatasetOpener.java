package com.scholary.cog.converter.acquisition;

/** Opens a raster and reports its band layout. */
public interface DatasetOpener {

  /**
   * Open a dataset.
   *
   * @param location a local path or a GDAL virtual file system path
   * @return the opened dataset
   * @throws InvalidSourceException if the location cannot be read as a raster
   * @throws com.scholary.cog.converter.objectstore.ObjectAccessDeniedException if a remote
   *     location refuses the read
   */
  DatasetHandle open(String location);
}
