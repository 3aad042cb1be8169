package com.example.callaudit_backend.service.pool;

import java.util.Map;

/**
 * Point-in-time view of the worker pool.
 *
 * @param totalCapacity configured worker slots
 * @param apiCeiling configured external-API concurrency ceiling
 * @param usedSlots worker slots currently leased
 * @param usedApiSlots remote calls currently holding an API slot
 * @param activeUsers distinct users holding or waiting for an allocation
 * @param slotsByUser leased slots per user
 * @param peakSlots highest {@code usedSlots} observed since start
 * @param peakApiSlots highest {@code usedApiSlots} observed since start
 */
public record PoolStats(int totalCapacity,
                        int apiCeiling,
                        int usedSlots,
                        int usedApiSlots,
                        int activeUsers,
                        Map<String, Integer> slotsByUser,
                        int peakSlots,
                        int peakApiSlots) {

    public int availableSlots() {
        return totalCapacity - usedSlots;
    }
}
