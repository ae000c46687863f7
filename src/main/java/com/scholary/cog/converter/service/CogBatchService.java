package com.scholary.cog.converter.service;

import com.scholary.cog.converter.acquisition.AcquisitionMode;
import com.scholary.cog.converter.acquisition.PreloadAcquisition;
import com.scholary.cog.converter.acquisition.SourceSpecifier;
import com.scholary.cog.converter.api.CogBatchRequest;
import com.scholary.cog.converter.config.CogProperties;
import com.scholary.cog.converter.logging.StructuredLogger;
import com.scholary.cog.converter.objectstore.ObjectStoreClient;
import com.scholary.cog.converter.objectstore.ObjectStoreException;
import com.scholary.cog.converter.objectstore.ObjectStoreProperties;
import com.scholary.cog.converter.profile.ProfileSelector;
import com.scholary.cog.converter.profile.RasterClassification;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;

/**
 * Turns a batch request into jobs and runs them.
 *
 * <p>Jobs run one after another in input order. A failing job is recorded in the report and the
 * batch moves on; nothing a single job throws aborts the batch.
 */
@Service
public class CogBatchService {

  private static final Logger LOGGER = LoggerFactory.getLogger(CogBatchService.class);

  private final CogJobProcessor jobProcessor;
  private final ProfileSelector profileSelector;
  private final ObjectStoreClient objectStoreClient;
  private final StructuredLogger structuredLogger;
  private final String defaultBucket;
  private final AcquisitionMode defaultAcquisitionMode;

  public CogBatchService(
      CogJobProcessor jobProcessor,
      ProfileSelector profileSelector,
      ObjectStoreClient objectStoreClient,
      StructuredLogger structuredLogger,
      ObjectStoreProperties objectStoreProperties,
      CogProperties cogProperties) {
    this.jobProcessor = jobProcessor;
    this.profileSelector = profileSelector;
    this.objectStoreClient = objectStoreClient;
    this.structuredLogger = structuredLogger;
    this.defaultBucket = objectStoreProperties.bucket();
    this.defaultAcquisitionMode = cogProperties.defaultAcquisitionMode();
  }

  /** Run every key of the request and report one outcome per key. */
  public BatchReport process(CogBatchRequest request) {
    return process(UUID.randomUUID().toString(), request);
  }

  /** Same as {@link #process(CogBatchRequest)} under a caller-chosen batch id. */
  public BatchReport process(String batchId, CogBatchRequest request) {
    String bucket = bucketOrDefault(request.bucket());
    AcquisitionMode mode = acquisitionMode(request.preload());
    RasterClassification classification = request.classification();
    String profileId = profileSelector.profileIdFor(classification);

    MDC.put("correlationId", batchId);
    try {
      LOGGER.info(
          "Starting batch: batchId={}, bucket={}, jobs={}, profile={}, mode={}",
          batchId,
          bucket,
          request.sourceKeys().size(),
          profileId,
          mode);

      List<JobOutcome> outcomes = new ArrayList<>(request.sourceKeys().size());
      for (String sourceKey : request.sourceKeys()) {
        CogJob job;
        try {
          job =
              new CogJob(
                  UUID.randomUUID().toString(),
                  bucket,
                  sourceKey,
                  profileId,
                  DestinationKeys.derive(sourceKey, profileId),
                  classification,
                  request.overwrite(),
                  mode,
                  request.replicateFrom(),
                  request.profileOptions(),
                  null);
        } catch (IllegalArgumentException e) {
          structuredLogger.logJobFailed(
              sourceKey, null, FailureKind.INVALID_INPUT.name(), e.getMessage());
          outcomes.add(JobOutcome.failed(sourceKey, FailureKind.INVALID_INPUT, e.getMessage()));
          continue;
        }
        outcomes.add(jobProcessor.process(job));
      }

      Boolean publicReadApplied = null;
      if (request.makePublic()) {
        publicReadApplied = makePublic(bucket);
      }

      BatchReport report = BatchReport.of(batchId, outcomes, publicReadApplied);
      structuredLogger.logBatchSummary(
          batchId, outcomes.size(), report.skipped(), report.succeeded(), report.failed());
      return report;

    } finally {
      MDC.remove("correlationId");
    }
  }

  /**
   * Convert raster bytes supplied directly by the caller.
   *
   * <p>The bytes stand in for the object at {@code sourceKey}; the COG is uploaded to the key
   * derived from it, like any other job.
   */
  public JobOutcome convert(
      byte[] data,
      String sourceKey,
      String bucket,
      RasterClassification classification,
      boolean overwrite,
      Map<String, String> profileOptions) {

    String profileId = profileSelector.profileIdFor(classification);
    CogJob job;
    try {
      job =
          new CogJob(
              UUID.randomUUID().toString(),
              bucketOrDefault(bucket),
              sourceKey,
              profileId,
              DestinationKeys.derive(sourceKey, profileId),
              classification,
              overwrite,
              defaultAcquisitionMode,
              null,
              profileOptions,
              SourceSpecifier.inMemoryBytes(data, PreloadAcquisition.suffixOf(sourceKey)));
    } catch (IllegalArgumentException e) {
      return JobOutcome.failed(sourceKey, FailureKind.INVALID_INPUT, e.getMessage());
    }
    return jobProcessor.process(job);
  }

  private boolean makePublic(String bucket) {
    try {
      objectStoreClient.setPublicReadPolicy(bucket);
      LOGGER.info("Applied public-read policy to bucket {}", bucket);
      return true;
    } catch (ObjectStoreException e) {
      LOGGER.warn("Failed to apply public-read policy to bucket {}: {}", bucket, e.getMessage());
      return false;
    }
  }

  private String bucketOrDefault(String bucket) {
    return bucket == null || bucket.isBlank() ? defaultBucket : bucket;
  }

  private AcquisitionMode acquisitionMode(Boolean preload) {
    if (preload == null) {
      return defaultAcquisitionMode;
    }
    return preload ? AcquisitionMode.PRELOAD : AcquisitionMode.STREAM;
  }
}
