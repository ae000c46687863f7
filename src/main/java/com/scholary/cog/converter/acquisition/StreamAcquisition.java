package com.scholary.cog.converter.acquisition;

import com.scholary.cog.converter.objectstore.ObjectStoreClient;
import com.scholary.cog.converter.scratch.JobScratch;
import java.net.URL;
import java.time.Duration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Opens the source object in place, through a presigned URL.
 *
 * <p>GDAL's {@code /vsicurl/} file system reads only the byte ranges it needs, so a 50 GB raster
 * is never downloaded in full. The presigned URL must outlive the transcode, which is why its TTL
 * is configurable.
 */
@Component
public class StreamAcquisition implements AcquisitionStrategy {

  private static final Logger LOGGER = LoggerFactory.getLogger(StreamAcquisition.class);

  static final String VSICURL_PREFIX = "/vsicurl/";

  private final ObjectStoreClient objectStoreClient;
  private final DatasetOpener datasetOpener;
  private final Duration presignTtl;

  public StreamAcquisition(
      ObjectStoreClient objectStoreClient,
      DatasetOpener datasetOpener,
      @Value("${cog.presignTtlMinutes}") long presignTtlMinutes) {
    this.objectStoreClient = objectStoreClient;
    this.datasetOpener = datasetOpener;
    this.presignTtl = Duration.ofMinutes(presignTtlMinutes);
  }

  @Override
  public SourceSpecifier acquire(String bucket, String key, JobScratch scratch) {
    // Surfaces NotFound and AccessDenied with the store's own status codes
    objectStoreClient.getObjectMetadata(bucket, key);

    URL url = objectStoreClient.presignGet(bucket, key, presignTtl);
    LOGGER.info("Streaming source: bucket={}, key={}, ttl={}", bucket, key, presignTtl);

    DatasetHandle handle = datasetOpener.open(VSICURL_PREFIX + url);
    return SourceSpecifier.remoteHandle(handle);
  }

  @Override
  public AcquisitionMode mode() {
    return AcquisitionMode.STREAM;
  }
}
