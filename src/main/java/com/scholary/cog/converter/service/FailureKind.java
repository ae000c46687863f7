package com.scholary.cog.converter.service;

import com.scholary.cog.converter.acquisition.InvalidSourceException;
import com.scholary.cog.converter.objectstore.ObjectAccessDeniedException;
import com.scholary.cog.converter.objectstore.ObjectNotFoundException;
import com.scholary.cog.converter.objectstore.ObjectStoreException;
import com.scholary.cog.converter.transcode.TranscodeException;

/** Why a job failed. Every kind is fatal for its job only. */
public enum FailureKind {
  /** The source object does not exist. */
  NOT_FOUND,
  /** The store refused access to the source or destination. */
  ACCESS_DENIED,
  /** Existence check, copy, download or upload failed. */
  STORAGE_IO_FAILURE,
  /** The engine failed or its output did not validate. */
  TRANSCODE_FAILURE,
  /** The source reference is malformed or unreadable. */
  INVALID_INPUT,
  /** Anything else. */
  UNEXPECTED;

  public static FailureKind classify(Throwable error) {
    if (error instanceof ObjectNotFoundException) {
      return NOT_FOUND;
    }
    if (error instanceof ObjectAccessDeniedException) {
      return ACCESS_DENIED;
    }
    if (error instanceof ObjectStoreException) {
      return STORAGE_IO_FAILURE;
    }
    if (error instanceof TranscodeException) {
      return TRANSCODE_FAILURE;
    }
    if (error instanceof InvalidSourceException || error instanceof IllegalArgumentException) {
      return INVALID_INPUT;
    }
    return UNEXPECTED;
  }
}
