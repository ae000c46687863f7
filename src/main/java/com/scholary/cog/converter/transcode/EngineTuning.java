package com.scholary.cog.converter.transcode;

import java.time.Duration;

/**
 * Knobs for the transcode engine itself, as opposed to the encoding of the output.
 *
 * @param numThreads worker threads inside the engine ({@code ALL_CPUS} or a number)
 * @param internalMask store nodata masks inside the TIFF instead of a sidecar file
 * @param overviewBlockSize block size of the overview levels, in pixels
 * @param timeout how long one engine invocation may run
 */
public record EngineTuning(
    String numThreads, boolean internalMask, int overviewBlockSize, Duration timeout) {}
