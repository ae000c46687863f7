package com.scholary.cog.converter.objectstore;

import java.net.URL;
import java.nio.file.Path;
import java.time.Duration;

/**
 * Abstraction for object storage operations.
 *
 * <p>This interface decouples the conversion pipeline from the storage implementation (S3, MinIO,
 * etc.). It exposes only what the pipeline needs: existence checks, server-side copies, whole
 * object downloads, uploads from local files, presigned URLs for remote range reads and bucket
 * publication.
 *
 * <p>Failures are reported as {@link ObjectStoreException} or one of its subclasses:
 * {@link ObjectNotFoundException} when the object is absent and {@link
 * ObjectAccessDeniedException} when the caller may not read it.
 */
public interface ObjectStoreClient {

  /**
   * Check whether an object exists.
   *
   * @param bucket the bucket name
   * @param key the object key
   * @return true if the object exists
   * @throws ObjectStoreException if the store cannot be queried
   */
  boolean exists(String bucket, String key);

  /**
   * Get object metadata without downloading the content.
   *
   * @param bucket the bucket name
   * @param key the object key
   * @return object metadata
   * @throws ObjectNotFoundException if the object doesn't exist
   * @throws ObjectAccessDeniedException if access is denied
   */
  ObjectMetadata getObjectMetadata(String bucket, String key);

  /**
   * Server-side copy of an object between buckets.
   *
   * <p>Returns only once the copy is visible at the destination.
   *
   * @param sourceBucket the bucket to copy from
   * @param sourceKey the key to copy
   * @param destinationBucket the bucket to copy into
   * @param destinationKey the key to write
   * @throws ObjectStoreException if the copy fails or never becomes visible
   */
  void copyObject(
      String sourceBucket, String sourceKey, String destinationBucket, String destinationKey);

  /**
   * Download a whole object into a local file, replacing the file's content.
   *
   * @param bucket the bucket name
   * @param key the object key
   * @param target the local file to write
   * @throws ObjectStoreException if the download fails
   */
  void downloadToFile(String bucket, String key, Path target);

  /**
   * Upload a local file as an object.
   *
   * @param bucket the bucket name
   * @param key the object key
   * @param source the local file to upload
   * @param contentType the MIME type of the object
   * @throws ObjectStoreException if the upload fails
   */
  void uploadFile(String bucket, String key, Path source, String contentType);

  /**
   * Generate a presigned URL for temporary read access to an object.
   *
   * <p>The URL supports HTTP range requests, which is what remote dataset opening relies on.
   *
   * @param bucket the bucket name
   * @param key the object key
   * @param ttl time-to-live for the URL
   * @return a presigned URL
   */
  URL presignGet(String bucket, String key, Duration ttl);

  /**
   * Apply a bucket policy that allows anonymous read access to every object.
   *
   * @param bucket the bucket name
   */
  void setPublicReadPolicy(String bucket);

  /** Object metadata returned by getObjectMetadata. */
  record ObjectMetadata(long contentLength, String contentType) {}
}
