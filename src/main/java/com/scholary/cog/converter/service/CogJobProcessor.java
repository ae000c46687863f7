package com.scholary.cog.converter.service;

import com.scholary.cog.converter.acquisition.AcquisitionMode;
import com.scholary.cog.converter.acquisition.AcquisitionStrategy;
import com.scholary.cog.converter.acquisition.DatasetHandle;
import com.scholary.cog.converter.acquisition.PreloadAcquisition;
import com.scholary.cog.converter.acquisition.SourceResolver;
import com.scholary.cog.converter.acquisition.SourceSpecifier;
import com.scholary.cog.converter.acquisition.StreamAcquisition;
import com.scholary.cog.converter.logging.StructuredLogger;
import com.scholary.cog.converter.objectstore.ObjectStoreClient;
import com.scholary.cog.converter.profile.EncodingProfile;
import com.scholary.cog.converter.profile.ProfileSelector;
import com.scholary.cog.converter.scratch.JobScratch;
import com.scholary.cog.converter.scratch.ScratchManager;
import com.scholary.cog.converter.scratch.ScratchResource;
import com.scholary.cog.converter.transcode.TranscodeInvoker;
import java.nio.file.Path;
import java.util.EnumMap;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Runs one job through the pipeline.
 *
 * <p>Stages: idempotency gate, replication, acquisition, profile selection, transcode and
 * validation, second gate check, upload. Every scratch file the job allocates is released when
 * the job ends, on success and on every failure path.
 *
 * <p>{@link #process} never throws. Failures are classified and returned as the job's outcome so
 * the caller can carry on with the next job.
 */
@Service
public class CogJobProcessor {

  private static final Logger LOGGER = LoggerFactory.getLogger(CogJobProcessor.class);

  static final String COG_CONTENT_TYPE = "image/tiff";

  private final ObjectStoreClient objectStoreClient;
  private final IdempotencyGate idempotencyGate;
  private final ReplicationStep replicationStep;
  private final SourceResolver sourceResolver;
  private final ProfileSelector profileSelector;
  private final TranscodeInvoker transcodeInvoker;
  private final ScratchManager scratchManager;
  private final StructuredLogger structuredLogger;

  private final Map<AcquisitionMode, AcquisitionStrategy> acquisitionStrategies;

  public CogJobProcessor(
      ObjectStoreClient objectStoreClient,
      IdempotencyGate idempotencyGate,
      ReplicationStep replicationStep,
      PreloadAcquisition preloadAcquisition,
      StreamAcquisition streamAcquisition,
      SourceResolver sourceResolver,
      ProfileSelector profileSelector,
      TranscodeInvoker transcodeInvoker,
      ScratchManager scratchManager,
      StructuredLogger structuredLogger) {
    this.objectStoreClient = objectStoreClient;
    this.idempotencyGate = idempotencyGate;
    this.replicationStep = replicationStep;
    this.sourceResolver = sourceResolver;
    this.profileSelector = profileSelector;
    this.transcodeInvoker = transcodeInvoker;
    this.scratchManager = scratchManager;
    this.structuredLogger = structuredLogger;

    this.acquisitionStrategies = new EnumMap<>(AcquisitionMode.class);
    this.acquisitionStrategies.put(AcquisitionMode.PRELOAD, preloadAcquisition);
    this.acquisitionStrategies.put(AcquisitionMode.STREAM, streamAcquisition);
  }

  public JobOutcome process(CogJob job) {
    StructuredLogger.setJobContext(job.jobId(), job.bucket(), job.sourceKey());
    long startTime = System.currentTimeMillis();

    try {
      if (!idempotencyGate.shouldProceed(job.bucket(), job.destinationKey(), job.overwrite())) {
        structuredLogger.logJobSkipped(
            job.sourceKey(), job.destinationKey(), "destination already exists");
        return JobOutcome.skipped(job, "destination already exists");
      }

      structuredLogger.logJobStarted(job.sourceKey(), job.destinationKey(), job.profileId());

      JobOutcome outcome;
      try (JobScratch scratch = scratchManager.openScope(job.jobId())) {
        outcome = runStages(job, scratch);
      }

      if (outcome.status() == JobOutcome.Status.SUCCEEDED) {
        structuredLogger.logJobSucceeded(
            job.sourceKey(),
            job.destinationKey(),
            job.profileId(),
            System.currentTimeMillis() - startTime);
      }
      return outcome;

    } catch (RuntimeException e) {
      FailureKind kind = FailureKind.classify(e);
      structuredLogger.logJobFailed(
          job.sourceKey(), job.destinationKey(), kind.name(), e.getMessage());
      if (kind == FailureKind.UNEXPECTED) {
        LOGGER.error("Unexpected failure processing {}", job.sourceKey(), e);
      }
      return JobOutcome.failed(job, kind, e.getMessage());

    } finally {
      StructuredLogger.clearJobContext();
    }
  }

  private JobOutcome runStages(CogJob job, JobScratch scratch) {
    SourceSpecifier source = job.inlineSource();
    if (source == null) {
      replicationStep.replicateIfNeeded(job);
      AcquisitionStrategy strategy = acquisitionStrategies.get(job.acquisitionMode());
      source = strategy.acquire(job.bucket(), job.sourceKey(), scratch);
    }

    DatasetHandle dataset = sourceResolver.resolve(source, scratch);

    EncodingProfile profile =
        profileSelector.select(job.classification(), dataset, job.profileOptions());
    if (!profile.profileId().equals(job.profileId())) {
      throw new IllegalStateException(
          String.format(
              "Selected profile %s does not match destination key profile %s",
              profile.profileId(), job.profileId()));
    }

    ScratchResource output = scratch.allocate(".tif");
    Path artifact = transcodeInvoker.transcode(dataset, output.path(), profile);
    output.markInUse();

    // The destination may have appeared while we were transcoding
    if (!idempotencyGate.shouldProceed(job.bucket(), job.destinationKey(), job.overwrite())) {
      structuredLogger.logJobSkipped(
          job.sourceKey(), job.destinationKey(), "destination appeared during processing");
      return JobOutcome.skipped(job, "destination appeared during processing");
    }

    objectStoreClient.uploadFile(job.bucket(), job.destinationKey(), artifact, COG_CONTENT_TYPE);
    return JobOutcome.succeeded(job);
  }
}
