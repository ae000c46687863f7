package com.scholary.cog.converter.transcode;

/**
 * Exception thrown when the transcode engine fails or its output does not pass validation.
 *
 * <p>Whatever the engine produced is discarded before this is thrown.
 */
public class TranscodeException extends RuntimeException {

  public TranscodeException(String message) {
    super(message);
  }

  public TranscodeException(String message, Throwable cause) {
    super(message, cause);
  }
}
