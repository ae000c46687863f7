package com.scholary.cog.converter.transcode;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Runs GDAL command-line tools.
 *
 * <p>stdout and stderr are drained on the runner's own reader threads, one per stream, so a tool
 * never blocks on a full pipe while other work holds a shared pool. Every run is bounded by a
 * timeout after which the process is killed.
 */
@Component
public class GdalProcessRunner {

  private static final Logger LOGGER = LoggerFactory.getLogger(GdalProcessRunner.class);

  private final AtomicInteger readerCount = new AtomicInteger();
  private final ExecutorService outputReaders =
      Executors.newCachedThreadPool(
          runnable -> {
            Thread reader =
                new Thread(runnable, "gdal-output-reader-" + readerCount.incrementAndGet());
            reader.setDaemon(true);
            return reader;
          });

  /** Exit code, stdout and stderr of a finished process. */
  public record ProcessResult(int exitCode, String stdout, String stderr) {

    public boolean succeeded() {
      return exitCode == 0;
    }
  }

  /**
   * Run a command to completion.
   *
   * @param command the program and its arguments
   * @param timeout how long to wait before killing the process
   * @return the finished process's result
   * @throws IOException if the process cannot be started, times out or is interrupted
   */
  public ProcessResult run(List<String> command, Duration timeout) throws IOException {
    LOGGER.debug("Executing: {}", String.join(" ", command));

    Process process = new ProcessBuilder(command).start();
    CompletableFuture<String> stdout =
        CompletableFuture.supplyAsync(() -> drain(process.getInputStream()), outputReaders);
    CompletableFuture<String> stderr =
        CompletableFuture.supplyAsync(() -> drain(process.getErrorStream()), outputReaders);

    try {
      if (!process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
        process.destroyForcibly();
        throw new IOException(
            String.format("%s timed out after %s", command.get(0), timeout));
      }
      ProcessResult result = new ProcessResult(process.exitValue(), stdout.get(), stderr.get());
      if (!result.succeeded()) {
        LOGGER.warn(
            "{} exited with code {}: {}", command.get(0), result.exitCode(), result.stderr());
      }
      return result;
    } catch (InterruptedException e) {
      process.destroyForcibly();
      Thread.currentThread().interrupt();
      throw new IOException(command.get(0) + " interrupted", e);
    } catch (ExecutionException e) {
      throw new IOException("Failed to read output of " + command.get(0), e.getCause());
    }
  }

  @PreDestroy
  void shutdown() {
    outputReaders.shutdownNow();
  }

  private static String drain(InputStream stream) {
    try (InputStream in = stream) {
      return new String(in.readAllBytes(), StandardCharsets.UTF_8);
    } catch (IOException e) {
      throw new UncheckedIOException(e);
    }
  }
}
