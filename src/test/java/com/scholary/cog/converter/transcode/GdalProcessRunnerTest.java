package com.scholary.cog.converter.transcode;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assumptions.assumeTrue;

import com.scholary.cog.converter.transcode.GdalProcessRunner.ProcessResult;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ForkJoinPool;
import java.util.concurrent.Future;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class GdalProcessRunnerTest {

  private GdalProcessRunner runner;

  @BeforeEach
  void setUp() {
    assumeTrue(Files.isExecutable(Path.of("/bin/sh")), "POSIX shell not available");
    runner = new GdalProcessRunner();
  }

  @AfterEach
  void tearDown() {
    if (runner != null) {
      runner.shutdown();
    }
  }

  @Test
  void run_shouldCaptureOutputAndExitCode() throws IOException {
    ProcessResult result =
        runner.run(
            List.of("/bin/sh", "-c", "echo out; echo err 1>&2; exit 3"), Duration.ofSeconds(10));

    assertThat(result.exitCode()).isEqualTo(3);
    assertThat(result.succeeded()).isFalse();
    assertThat(result.stdout()).isEqualTo("out\n");
    assertThat(result.stderr()).isEqualTo("err\n");
  }

  @Test
  void run_shouldKillProcessAfterTimeout() {
    assertThatThrownBy(
            () -> runner.run(List.of("/bin/sh", "-c", "sleep 30"), Duration.ofMillis(200)))
        .isInstanceOf(IOException.class)
        .hasMessageContaining("timed out");
  }

  @Test
  void run_shouldFailWhenProgramIsMissing() {
    assertThatThrownBy(
            () -> runner.run(List.of("/nonexistent/gdal_translate"), Duration.ofSeconds(1)))
        .isInstanceOf(IOException.class);
  }

  @Test
  void run_shouldDrainLargeStderrWhileCommonPoolIsBusy() throws IOException {
    CountDownLatch release = new CountDownLatch(1);
    List<Future<?>> blockers = new ArrayList<>();
    ForkJoinPool commonPool = ForkJoinPool.commonPool();
    for (int i = 0; i < commonPool.getParallelism(); i++) {
      blockers.add(
          commonPool.submit(
              () -> {
                release.await();
                return null;
              }));
    }

    try {
      ProcessResult result =
          runner.run(
              List.of("/bin/sh", "-c", "head -c 200000 /dev/zero | tr '\\000' e 1>&2"),
              Duration.ofSeconds(20));

      assertThat(result.succeeded()).isTrue();
      assertThat(result.stderr()).hasSize(200000);
    } finally {
      release.countDown();
      blockers.forEach(blocker -> blocker.cancel(true));
    }
  }
}
