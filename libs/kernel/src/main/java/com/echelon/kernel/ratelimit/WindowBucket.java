package com.echelon.kernel.ratelimit;

/**
 * Stored state of one fixed-window counter.
 *
 * @param windowStart epoch millis at which the current window opened
 * @param count       increments taken in the current window
 */
public record WindowBucket(long windowStart, long count) {
}
