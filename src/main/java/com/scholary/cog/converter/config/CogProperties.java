package com.scholary.cog.converter.config;

import com.scholary.cog.converter.acquisition.AcquisitionMode;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for COG conversion.
 *
 * <p>Controls scratch space, the default acquisition mode and resource allocation for async
 * batches.
 */
@ConfigurationProperties(prefix = "cog")
@Validated
public record CogProperties(
    @NotBlank String tempDir,
    @NotNull AcquisitionMode defaultAcquisitionMode,
    @Positive long presignTtlMinutes,
    @Positive int asyncExecutorThreads,
    @Positive int asyncExecutorQueueSize) {}
