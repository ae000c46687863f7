package com.scholary.cog.converter.logging;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.stereotype.Component;

/**
 * Utility for structured logging with MDC (Mapped Diagnostic Context).
 *
 * <p>Provides methods to log pipeline events with structured fields that can be queried in a log
 * index. Injected into the pipeline as a bean so the event vocabulary lives in one place.
 */
@Component
public class StructuredLogger {

  private final Logger logger;

  public StructuredLogger() {
    this(LoggerFactory.getLogger("cog.events"));
  }

  public StructuredLogger(Logger logger) {
    this.logger = logger;
  }

  /** Log job started event. */
  public void logJobStarted(String sourceKey, String destinationKey, String profile) {
    try {
      MDC.put("event_type", "job_started");
      MDC.put("destinationKey", destinationKey);
      MDC.put("profile", profile);

      logger.info(
          "Job started: source={}, destination={}, profile={}", sourceKey, destinationKey, profile);
    } finally {
      clearEventFields();
    }
  }

  /** Log job skipped event. */
  public void logJobSkipped(String sourceKey, String destinationKey, String reason) {
    try {
      MDC.put("event_type", "job_skipped");
      MDC.put("destinationKey", destinationKey);

      logger.info(
          "Job skipped: source={}, destination={}, reason={}", sourceKey, destinationKey, reason);
    } finally {
      clearEventFields();
    }
  }

  /** Log job succeeded event. */
  public void logJobSucceeded(
      String sourceKey, String destinationKey, String profile, long durationMs) {
    try {
      MDC.put("event_type", "job_succeeded");
      MDC.put("destinationKey", destinationKey);
      MDC.put("profile", profile);
      MDC.put("durationMs", String.valueOf(durationMs));

      logger.info(
          "Job succeeded: source={}, destination={}, profile={}, duration={}ms",
          sourceKey,
          destinationKey,
          profile,
          durationMs);
    } finally {
      clearEventFields();
    }
  }

  /** Log job failed event. */
  public void logJobFailed(
      String sourceKey, String destinationKey, String failureKind, String message) {
    try {
      MDC.put("event_type", "job_failed");
      MDC.put("destinationKey", destinationKey);
      MDC.put("failureKind", failureKind);

      logger.error(
          "Job failed: source={}, destination={}, failure={}, message={}",
          sourceKey,
          destinationKey,
          failureKind,
          message);
    } finally {
      clearEventFields();
    }
  }

  /** Log batch summary event. */
  public void logBatchSummary(String batchId, int total, int skipped, int succeeded, int failed) {
    try {
      MDC.put("event_type", "batch_summary");
      MDC.put("batchId", batchId);
      MDC.put("skipped", String.valueOf(skipped));
      MDC.put("succeeded", String.valueOf(succeeded));
      MDC.put("failed", String.valueOf(failed));

      logger.info(
          "Batch finished: batchId={}, jobs={}, skipped={}, succeeded={}, failed={}",
          batchId,
          total,
          skipped,
          succeeded,
          failed);
    } finally {
      clearEventFields();
    }
  }

  /** Set job context in MDC. */
  public static void setJobContext(String jobId, String bucket, String sourceKey) {
    MDC.put("jobId", jobId);
    MDC.put("bucket", bucket);
    MDC.put("sourceKey", sourceKey);
  }

  /** Clear job context from MDC. */
  public static void clearJobContext() {
    MDC.remove("jobId");
    MDC.remove("bucket");
    MDC.remove("sourceKey");
  }

  /** Clear event-specific fields from MDC. */
  private void clearEventFields() {
    MDC.remove("event_type");
    MDC.remove("destinationKey");
    MDC.remove("profile");
    MDC.remove("durationMs");
    MDC.remove("failureKind");
    MDC.remove("batchId");
    MDC.remove("skipped");
    MDC.remove("succeeded");
    MDC.remove("failed");
  }
}
