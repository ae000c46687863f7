package com.scholary.cog.converter.service;

import com.scholary.cog.converter.objectstore.ObjectStoreClient;
import org.springframework.stereotype.Component;

/**
 * Decides whether a job still has work to do.
 *
 * <p>Checked once before anything is acquired and again right before the upload, which narrows
 * the window in which two runs could both convert the same source.
 */
@Component
public class IdempotencyGate {

  private final ObjectStoreClient objectStoreClient;

  public IdempotencyGate(ObjectStoreClient objectStoreClient) {
    this.objectStoreClient = objectStoreClient;
  }

  /**
   * @return true if the job should run; false if the destination exists and overwriting is off
   * @throws com.scholary.cog.converter.objectstore.ObjectStoreException if the store cannot be
   *     queried
   */
  public boolean shouldProceed(String bucket, String destinationKey, boolean overwrite) {
    if (overwrite) {
      return true;
    }
    return !objectStoreClient.exists(bucket, destinationKey);
  }
}
