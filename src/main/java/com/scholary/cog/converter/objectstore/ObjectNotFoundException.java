package com.scholary.cog.converter.objectstore;

/** The requested object does not exist. */
public class ObjectNotFoundException extends ObjectStoreException {

  public ObjectNotFoundException(String message) {
    super(message);
  }

  public ObjectNotFoundException(String message, Throwable cause) {
    super(message, cause);
  }
}
