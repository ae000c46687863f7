package com.scholary.cog.converter.acquisition;

/**
 * Exception thrown when a job's source reference is malformed or unreadable.
 *
 * <p>Raised before any scratch resource is allocated for the source.
 */
public class InvalidSourceException extends RuntimeException {

  public InvalidSourceException(String message) {
    super(message);
  }

  public InvalidSourceException(String message, Throwable cause) {
    super(message, cause);
  }
}
