package com.scholary.cog.converter.job;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import java.time.Duration;
import java.util.Optional;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Repository;

/**
 * In-memory repository for async batches.
 *
 * <p>Uses Caffeine cache for automatic eviction of old jobs, so completed batches do not
 * accumulate forever. Status is lost on restart; the idempotency gate makes re-submitting a batch
 * cheap.
 */
@Repository
public class JobRepository {

  private final Cache<String, BatchJob> cache;

  public JobRepository(
      @Value("${jobstore.maxSize}") int maxSize,
      @Value("${jobstore.expireAfterMinutes}") int expireAfterMinutes) {

    this.cache =
        Caffeine.newBuilder()
            .maximumSize(maxSize)
            .expireAfterWrite(Duration.ofMinutes(expireAfterMinutes))
            .build();
  }

  public void save(BatchJob job) {
    cache.put(job.getJobId(), job);
  }

  public Optional<BatchJob> findById(String jobId) {
    return Optional.ofNullable(cache.getIfPresent(jobId));
  }

}
