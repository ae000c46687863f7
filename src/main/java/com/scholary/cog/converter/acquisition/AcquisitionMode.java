package com.scholary.cog.converter.acquisition;

/**
 * How a job reads its source from object storage. Always chosen explicitly, never by size.
 */
public enum AcquisitionMode {
  /**
   * Download the whole object into a scratch file and open it locally.
   *
   * <p>Best when local random access matters or the file is modest in size (roughly under 4-8
   * GB).
   */
  PRELOAD,

  /**
   * Open the object through a URL and let the engine issue range reads.
   *
   * <p>Avoids the full download for very large rasters. The object must be reachable through a
   * public or presigned URL.
   */
  STREAM
}
