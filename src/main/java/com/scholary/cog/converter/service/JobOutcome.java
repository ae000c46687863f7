package com.scholary.cog.converter.service;

/**
 * The terminal result of one job.
 *
 * @param sourceKey the source object key
 * @param destinationKey the derived destination key, null if it could not be derived
 * @param profileId the encoding profile, null if none was chosen
 * @param status how the job ended
 * @param failureKind why it failed, null unless status is FAILED
 * @param message skip reason or failure message, null on success
 */
public record JobOutcome(
    String sourceKey,
    String destinationKey,
    String profileId,
    Status status,
    FailureKind failureKind,
    String message) {

  public enum Status {
    SKIPPED,
    SUCCEEDED,
    FAILED
  }

  public static JobOutcome skipped(CogJob job, String reason) {
    return new JobOutcome(
        job.sourceKey(), job.destinationKey(), job.profileId(), Status.SKIPPED, null, reason);
  }

  public static JobOutcome succeeded(CogJob job) {
    return new JobOutcome(
        job.sourceKey(), job.destinationKey(), job.profileId(), Status.SUCCEEDED, null, null);
  }

  public static JobOutcome failed(CogJob job, FailureKind kind, String message) {
    return new JobOutcome(
        job.sourceKey(), job.destinationKey(), job.profileId(), Status.FAILED, kind, message);
  }

  public static JobOutcome failed(String sourceKey, FailureKind kind, String message) {
    return new JobOutcome(sourceKey, null, null, Status.FAILED, kind, message);
  }
}
