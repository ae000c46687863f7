package com.scholary.cog.converter.acquisition;

import com.scholary.cog.converter.scratch.JobScratch;

/**
 * Strategy for obtaining a readable source from object storage.
 *
 * <p>Implementations:
 *
 * <ul>
 *   <li>{@link PreloadAcquisition}: full download into a scratch file
 *   <li>{@link StreamAcquisition}: remote range reads through a presigned URL
 * </ul>
 */
public interface AcquisitionStrategy {

  /**
   * Make the object readable for the job.
   *
   * @param bucket the bucket holding the source
   * @param key the source key
   * @param scratch the job's scratch scope, for any local storage the strategy needs
   * @return a source the {@link SourceResolver} can open
   * @throws com.scholary.cog.converter.objectstore.ObjectNotFoundException if the object is absent
   * @throws com.scholary.cog.converter.objectstore.ObjectAccessDeniedException if it may not be
   *     read
   */
  SourceSpecifier acquire(String bucket, String key, JobScratch scratch);

  AcquisitionMode mode();
}
