package com.scholary.cog.converter.transcode;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for the GDAL transcode engine.
 *
 * <p>The defaults follow GDAL's COG driver guidance: all CPUs, internal masks and 128 px overview
 * blocks.
 */
@ConfigurationProperties(prefix = "transcode")
@Validated
public record TranscodeProperties(
    @NotBlank String gdalTranslatePath,
    @NotBlank String gdalInfoPath,
    @NotBlank String numThreads,
    boolean internalMask,
    @Positive int overviewBlockSize,
    @Positive int timeoutMinutes) {

  public EngineTuning tuning() {
    return new EngineTuning(
        numThreads, internalMask, overviewBlockSize, Duration.ofMinutes(timeoutMinutes));
  }
}
