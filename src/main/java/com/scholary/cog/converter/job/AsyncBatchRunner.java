package com.scholary.cog.converter.job;

import com.scholary.cog.converter.api.JobStatusResponse.Status;
import com.scholary.cog.converter.service.BatchReport;
import com.scholary.cog.converter.service.CogBatchService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Service;

/**
 * Runs queued batches on the task executor.
 *
 * <p>Kept apart from the controller so calls go through the async proxy.
 */
@Service
public class AsyncBatchRunner {

  private static final Logger LOGGER = LoggerFactory.getLogger(AsyncBatchRunner.class);

  private final CogBatchService batchService;
  private final JobRepository jobRepository;

  public AsyncBatchRunner(CogBatchService batchService, JobRepository jobRepository) {
    this.batchService = batchService;
    this.jobRepository = jobRepository;
  }

  @Async("taskExecutor")
  public void run(BatchJob job) {
    LOGGER.info("Starting async processing for batch: {}", job.getJobId());

    try {
      job.setStatus(Status.PROCESSING);
      jobRepository.save(job);

      BatchReport report = batchService.process(job.getJobId(), job.getRequest());

      job.setReport(report);
      job.setStatus(Status.COMPLETED);
      jobRepository.save(job);

      LOGGER.info("Completed async processing for batch: {}", job.getJobId());

    } catch (RuntimeException e) {
      LOGGER.error("Async processing failed for batch: {}", job.getJobId(), e);
      job.setStatus(Status.FAILED);
      job.setError(e.getMessage());
      jobRepository.save(job);
    }
  }
}
