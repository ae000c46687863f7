package com.scholary.cog.converter.api;

import com.scholary.cog.converter.service.BatchReport;

/**
 * Response for job status query.
 *
 * <p>Shows the current state of an async batch and includes the report once it has completed.
 */
public record JobStatusResponse(String jobId, Status status, BatchReport report, String error) {

  public enum Status {
    PENDING,
    PROCESSING,
    COMPLETED,
    FAILED
  }
}
