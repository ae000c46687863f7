package com.scholary.cog.converter.service;

import com.scholary.cog.converter.objectstore.ObjectStoreClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Copies a job's source into the working bucket when it lives somewhere else.
 *
 * <p>After this step every later stage reads from one bucket. The copy is server side and the
 * store client only returns once it is visible. A failed copy fails the job; it is not retried
 * beyond the client's transport retries, and the next run simply copies again.
 */
@Component
public class ReplicationStep {

  private static final Logger LOGGER = LoggerFactory.getLogger(ReplicationStep.class);

  private final ObjectStoreClient objectStoreClient;

  public ReplicationStep(ObjectStoreClient objectStoreClient) {
    this.objectStoreClient = objectStoreClient;
  }

  public void replicateIfNeeded(CogJob job) {
    if (!job.needsReplication()) {
      return;
    }
    LOGGER.info(
        "Replicating source: {}/{} -> {}/{}",
        job.replicateFrom(),
        job.sourceKey(),
        job.bucket(),
        job.sourceKey());
    objectStoreClient.copyObject(
        job.replicateFrom(), job.sourceKey(), job.bucket(), job.sourceKey());
  }
}
