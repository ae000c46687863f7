package com.scholary.cog.converter.acquisition;

import com.scholary.cog.converter.objectstore.ObjectStoreClient;
import com.scholary.cog.converter.objectstore.ObjectStoreClient.ObjectMetadata;
import com.scholary.cog.converter.scratch.JobScratch;
import com.scholary.cog.converter.scratch.ScratchResource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Downloads the whole source object into a scratch file.
 *
 * <p>The metadata lookup happens first, so a missing or forbidden object fails the job before any
 * scratch space is allocated.
 */
@Component
public class PreloadAcquisition implements AcquisitionStrategy {

  private static final Logger LOGGER = LoggerFactory.getLogger(PreloadAcquisition.class);

  private final ObjectStoreClient objectStoreClient;

  public PreloadAcquisition(ObjectStoreClient objectStoreClient) {
    this.objectStoreClient = objectStoreClient;
  }

  @Override
  public SourceSpecifier acquire(String bucket, String key, JobScratch scratch) {
    ObjectMetadata metadata = objectStoreClient.getObjectMetadata(bucket, key);
    LOGGER.info(
        "Preloading source: bucket={}, key={}, size={} MB",
        bucket,
        key,
        metadata.contentLength() / 1024 / 1024);

    ScratchResource resource = scratch.allocate(suffixOf(key));
    objectStoreClient.downloadToFile(bucket, key, resource.path());
    resource.markInUse();

    return SourceSpecifier.localPath(resource.path());
  }

  @Override
  public AcquisitionMode mode() {
    return AcquisitionMode.PRELOAD;
  }

  public static String suffixOf(String key) {
    int slash = key.lastIndexOf('/');
    int dot = key.lastIndexOf('.');
    return dot > slash + 1 ? key.substring(dot) : ".tif";
  }
}
