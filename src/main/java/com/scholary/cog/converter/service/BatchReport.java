package com.scholary.cog.converter.service;

import com.scholary.cog.converter.service.JobOutcome.Status;
import java.util.List;

/**
 * Result of a batch: one outcome per source key, in input order, plus the counts.
 *
 * @param publicReadApplied whether the bucket was made public afterwards; null if not requested
 */
public record BatchReport(
    String batchId,
    List<JobOutcome> outcomes,
    int skipped,
    int succeeded,
    int failed,
    Boolean publicReadApplied) {

  public BatchReport {
    outcomes = List.copyOf(outcomes);
  }

  public static BatchReport of(
      String batchId, List<JobOutcome> outcomes, Boolean publicReadApplied) {
    return new BatchReport(
        batchId,
        outcomes,
        count(outcomes, Status.SKIPPED),
        count(outcomes, Status.SUCCEEDED),
        count(outcomes, Status.FAILED),
        publicReadApplied);
  }

  private static int count(List<JobOutcome> outcomes, Status status) {
    return (int) outcomes.stream().filter(o -> o.status() == status).count();
  }
}
