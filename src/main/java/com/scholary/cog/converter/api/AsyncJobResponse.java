package com.scholary.cog.converter.api;

/**
 * Response for an async batch request.
 *
 * <p>Returns a job ID that can be used to poll for status.
 */
public record AsyncJobResponse(String jobId) {}
