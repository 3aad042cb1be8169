package com.example.callaudit_backend.service.sizing;

import java.time.Instant;

/**
 * Snapshot of one user's latency history.
 *
 * @param userId owner
 * @param ewmaSeconds smoothed per-file latency, {@code NaN} before the first observation
 * @param observations completed files folded into the average
 * @param lastChunkSize last recommendation, 0 when none was made yet
 * @param throttled a rate-limit signal arrived since the last recommendation
 * @param lastSeen last time the user touched the sizer
 */
public record LatencyEstimate(String userId,
                              double ewmaSeconds,
                              long observations,
                              int lastChunkSize,
                              boolean throttled,
                              Instant lastSeen) {
}
