package com.scholary.cog.converter.api;

import com.scholary.cog.converter.job.AsyncBatchRunner;
import com.scholary.cog.converter.job.BatchJob;
import com.scholary.cog.converter.job.JobRepository;
import com.scholary.cog.converter.profile.RasterClassification;
import com.scholary.cog.converter.service.BatchReport;
import com.scholary.cog.converter.service.CogBatchService;
import com.scholary.cog.converter.service.FailureKind;
import com.scholary.cog.converter.service.JobOutcome;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import java.io.IOException;
import java.util.Map;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

/**
 * REST API for COG conversion.
 *
 * <p>Provides endpoints for:
 *
 * <ul>
 *   <li>Synchronous batch conversion
 *   <li>Asynchronous batch conversion (returns job ID immediately)
 *   <li>Job status polling
 *   <li>Converting an uploaded raster
 * </ul>
 */
@RestController
@RequestMapping("/api/cog")
@Tag(name = "COG conversion", description = "Cloud-Optimized GeoTIFF conversion API")
public class CogController {

  private static final Logger LOGGER = LoggerFactory.getLogger(CogController.class);

  private final CogBatchService batchService;
  private final AsyncBatchRunner asyncBatchRunner;
  private final JobRepository jobRepository;

  public CogController(
      CogBatchService batchService,
      AsyncBatchRunner asyncBatchRunner,
      JobRepository jobRepository) {
    this.batchService = batchService;
    this.asyncBatchRunner = asyncBatchRunner;
    this.jobRepository = jobRepository;
  }

  @PostMapping("/batch")
  @Operation(
      summary = "Convert a batch",
      description =
          "Convert every source key to a COG and wait for the report. "
              + "Keys whose COG already exists are skipped unless overwrite is set.")
  public ResponseEntity<BatchReport> convertBatch(@Valid @RequestBody CogBatchRequest request) {
    LOGGER.info(
        "Batch request: bucket={}, keys={}", request.bucket(), request.sourceKeys().size());
    return ResponseEntity.ok(batchService.process(request));
  }

  /** Start an asynchronous batch. */
  @PostMapping("/batch/async")
  @Operation(
      summary = "Start batch conversion",
      description = "Queue a batch and return a job ID for status polling")
  public ResponseEntity<AsyncJobResponse> convertBatchAsync(
      @Valid @RequestBody CogBatchRequest request) {
    String jobId = UUID.randomUUID().toString();

    BatchJob job = new BatchJob(jobId, request);
    jobRepository.save(job);
    LOGGER.info("Created async batch job: {}", jobId);

    asyncBatchRunner.run(job);

    return ResponseEntity.accepted().body(new AsyncJobResponse(jobId));
  }

  /**
   * Get job status.
   *
   * <p>Returns the current state of an async batch. Once completed, includes the full report.
   */
  @GetMapping("/jobs/{id}")
  @Operation(summary = "Get job status", description = "Check the status of an async batch")
  public ResponseEntity<JobStatusResponse> getJobStatus(@PathVariable String id) {
    return jobRepository
        .findById(id)
        .map(
            job ->
                ResponseEntity.ok(
                    new JobStatusResponse(
                        job.getJobId(), job.getStatus(), job.getReport(), job.getError())))
        .orElse(ResponseEntity.notFound().build());
  }

  /**
   * Convert an uploaded raster.
   *
   * <p>The upload stands in for the object at {@code key}; the COG is stored under the key derived
   * from it.
   */
  @PostMapping(value = "/convert", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
  @Operation(
      summary = "Convert an uploaded raster",
      description = "Convert raster bytes sent with the request and upload the COG")
  public ResponseEntity<JobOutcome> convertUpload(
      @RequestParam("file") MultipartFile file,
      @RequestParam("key") String key,
      @RequestParam(value = "bucket", required = false) String bucket,
      @RequestParam(value = "compress", defaultValue = "false") boolean compress,
      @RequestParam(value = "dem", defaultValue = "false") boolean dem,
      @RequestParam(value = "smoothDem", defaultValue = "false") boolean smoothDem,
      @RequestParam(value = "webOptimized", defaultValue = "false") boolean webOptimized,
      @RequestParam(value = "overwrite", defaultValue = "false") boolean overwrite) {
    try {
      LOGGER.info("Convert request: key={}, size={} bytes", key, file.getSize());

      JobOutcome outcome =
          batchService.convert(
              file.getBytes(),
              key,
              bucket,
              new RasterClassification(dem, compress, smoothDem, webOptimized),
              overwrite,
              Map.of());
      return ResponseEntity.status(statusFor(outcome)).body(outcome);

    } catch (IOException e) {
      LOGGER.error("Failed to read upload", e);
      return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).build();
    }
  }

  private static HttpStatus statusFor(JobOutcome outcome) {
    if (outcome.status() != JobOutcome.Status.FAILED) {
      return HttpStatus.OK;
    }
    if (outcome.failureKind() == FailureKind.INVALID_INPUT) {
      return HttpStatus.BAD_REQUEST;
    }
    if (outcome.failureKind() == FailureKind.TRANSCODE_FAILURE) {
      return HttpStatus.UNPROCESSABLE_ENTITY;
    }
    return HttpStatus.INTERNAL_SERVER_ERROR;
  }
}
