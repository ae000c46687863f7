package com.scholary.cog.converter.job;

import com.scholary.cog.converter.api.CogBatchRequest;
import com.scholary.cog.converter.api.JobStatusResponse.Status;
import com.scholary.cog.converter.service.BatchReport;
import java.time.Instant;

/**
 * Represents an async batch.
 *
 * <p>Tracks the batch's state and report. Stored in memory using Caffeine cache.
 */
public class BatchJob {

  private final String jobId;
  private final CogBatchRequest request;
  private final Instant createdAt;

  private volatile Status status;
  private volatile BatchReport report;
  private volatile String error;

  public BatchJob(String jobId, CogBatchRequest request) {
    this.jobId = jobId;
    this.request = request;
    this.createdAt = Instant.now();
    this.status = Status.PENDING;
  }

  public String getJobId() {
    return jobId;
  }

  public CogBatchRequest getRequest() {
    return request;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }

  public Status getStatus() {
    return status;
  }

  public void setStatus(Status status) {
    this.status = status;
  }

  public BatchReport getReport() {
    return report;
  }

  public void setReport(BatchReport report) {
    this.report = report;
  }

  public String getError() {
    return error;
  }

  public void setError(String error) {
    this.error = error;
  }
}
