package com.scholary.cog.converter.objectstore;

/** The caller is not allowed to read or write the object. */
public class ObjectAccessDeniedException extends ObjectStoreException {

  public ObjectAccessDeniedException(String message) {
    super(message);
  }

  public ObjectAccessDeniedException(String message, Throwable cause) {
    super(message, cause);
  }
}
