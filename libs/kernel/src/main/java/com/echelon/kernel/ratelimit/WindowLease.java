package com.echelon.kernel.ratelimit;

import java.time.Duration;

/**
 * One increment taken on a fixed-window counter, which can be handed back if the request is
 * rejected later in the pipeline.
 *
 * @param key         store key of the bucket
 * @param windowStart window the increment was taken in
 * @param window      window length, reused as the TTL when writing back
 */
public record WindowLease(String key, long windowStart, Duration window) {
}
