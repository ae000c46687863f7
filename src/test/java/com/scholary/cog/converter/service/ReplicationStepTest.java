package com.scholary.cog.converter.service;

import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;

import com.scholary.cog.converter.acquisition.AcquisitionMode;
import com.scholary.cog.converter.objectstore.ObjectNotFoundException;
import com.scholary.cog.converter.objectstore.ObjectStoreClient;
import com.scholary.cog.converter.profile.RasterClassification;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class ReplicationStepTest {

  @Mock private ObjectStoreClient objectStoreClient;

  @InjectMocks private ReplicationStep replicationStep;

  @Test
  void replicateIfNeeded_shouldCopyFromOtherBucketUnderSameKey() {
    replicationStep.replicateIfNeeded(job("envicloud"));

    verify(objectStoreClient).copyObject("envicloud", "scenes/a.tif", "cog", "scenes/a.tif");
  }

  @Test
  void replicateIfNeeded_shouldDoNothingWithoutOtherBucket() {
    replicationStep.replicateIfNeeded(job(null));
    replicationStep.replicateIfNeeded(job("cog"));
    replicationStep.replicateIfNeeded(job(" "));

    verifyNoInteractions(objectStoreClient);
  }

  @Test
  void replicateIfNeeded_shouldPropagateCopyFailure() {
    doThrow(new ObjectNotFoundException("Object not found: bucket=envicloud"))
        .when(objectStoreClient)
        .copyObject("envicloud", "scenes/a.tif", "cog", "scenes/a.tif");

    assertThatThrownBy(() -> replicationStep.replicateIfNeeded(job("envicloud")))
        .isInstanceOf(ObjectNotFoundException.class);
  }

  private static CogJob job(String replicateFrom) {
    return new CogJob(
        "job-1",
        "cog",
        "scenes/a.tif",
        "deflate",
        "scenes/a_COG_deflate.tif",
        RasterClassification.lossless(),
        false,
        AcquisitionMode.PRELOAD,
        replicateFrom,
        null,
        null);
  }
}
