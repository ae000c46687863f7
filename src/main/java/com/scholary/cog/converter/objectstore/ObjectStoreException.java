package com.scholary.cog.converter.objectstore;

/**
 * Exception thrown when object storage operations fail.
 *
 * <p>This is a runtime exception because storage failures are scoped to the job that hit them.
 * The job processor records them as the job's outcome and moves on to the next job.
 */
public class ObjectStoreException extends RuntimeException {

  public ObjectStoreException(String message) {
    super(message);
  }

  public ObjectStoreException(String message, Throwable cause) {
    super(message, cause);
  }
}
