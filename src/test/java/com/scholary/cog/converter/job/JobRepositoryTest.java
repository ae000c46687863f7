package com.scholary.cog.converter.job;

import static org.assertj.core.api.Assertions.assertThat;

import com.scholary.cog.converter.api.CogBatchRequest;
import com.scholary.cog.converter.api.JobStatusResponse.Status;
import java.util.List;
import org.junit.jupiter.api.Test;

class JobRepositoryTest {

  private final JobRepository repository = new JobRepository(100, 60);

  @Test
  void save_shouldMakeJobFindableById() {
    BatchJob job = new BatchJob("job-1", request());

    repository.save(job);

    assertThat(repository.findById("job-1")).containsSame(job);
    assertThat(job.getStatus()).isEqualTo(Status.PENDING);
  }

  @Test
  void findById_shouldReturnEmptyForUnknownJob() {
    assertThat(repository.findById("never-saved")).isEmpty();
  }

  private static CogBatchRequest request() {
    return new CogBatchRequest(
        List.of("a.tif"), null, null, null, null, null, null, null, null, null, null);
  }
}
