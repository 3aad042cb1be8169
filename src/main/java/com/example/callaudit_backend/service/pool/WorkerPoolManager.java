package com.example.callaudit_backend.service.pool;

import com.example.callaudit_backend.config.WorkerPoolProperties;
import com.example.callaudit_backend.exception.ResourceExhaustedException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Arbitrates the process-wide worker slots and the external-API concurrency ceiling between
 * concurrent users.
 *
 * <p>With {@code N} distinct users holding or waiting for an allocation, a user holds at most
 * {@code max(1, totalCapacity / N)} slots across all of their allocations. A request is granted the
 * user's remaining headroom, never more than requested or currently free; a user already at their
 * share waits until they release slots or the share grows. Outstanding allocations are not revoked
 * when users come and go; the next {@link #acquire} sees the new user count.
 *
 * <p>API slots are handed out per remote call through {@link #acquireApiSlot}. The global count of
 * in-flight permits never exceeds the ceiling and each allocation is capped at its own
 * {@link WorkerAllocation#apiSlots()}. Those per-allocation caps are fixed at grant time and their sum
 * may exceed the ceiling; the ceiling is enforced on permits, not on allocation caps.
 *
 * <p>All counters are guarded by a single lock.
 */
@Component
public class WorkerPoolManager {
    private static final Logger LOGGER = LoggerFactory.getLogger(WorkerPoolManager.class);

    private final int totalCapacity;
    private final int apiCeiling;
    private final Duration acquireTimeout;
    private final Duration apiAcquireTimeout;
    private final Clock clock;

    private final ReentrantLock lock = new ReentrantLock(true);
    private final Condition slotsFreed = lock.newCondition();
    private final Condition apiSlotsFreed = lock.newCondition();
    private final Map<String, Integer> activeUsers = new HashMap<>();
    private final Map<String, Integer> slotsByUser = new HashMap<>();
    private int usedSlots;
    private int usedApiSlots;
    private int peakSlots;
    private int peakApiSlots;
    private long nextAllocationId = 1L;

    @Autowired
    public WorkerPoolManager(WorkerPoolProperties properties, Clock clock) {
        this(properties.getTotalCapacity(), properties.getApiConcurrencyCeiling(),
                properties.getAcquireTimeout(), properties.getApiAcquireTimeout(), clock);
    }

    public WorkerPoolManager(int totalCapacity, int apiCeiling, Duration acquireTimeout, Duration apiAcquireTimeout, Clock clock) {
        if (totalCapacity < 1) {
            throw new IllegalArgumentException("totalCapacity must be >= 1 but was " + totalCapacity);
        }
        if (apiCeiling < 1) {
            throw new IllegalArgumentException("apiCeiling must be >= 1 but was " + apiCeiling);
        }
        this.totalCapacity = totalCapacity;
        this.apiCeiling = apiCeiling;
        this.acquireTimeout = acquireTimeout;
        this.apiAcquireTimeout = apiAcquireTimeout;
        this.clock = clock;
        LOGGER.info("WorkerPoolManager init capacity={} apiCeiling={} acquireTimeout={}ms", totalCapacity, apiCeiling, acquireTimeout.toMillis());
    }

    public WorkerAllocation acquire(String userId, int requestedSlots) {
        return acquire(userId, requestedSlots, acquireTimeout);
    }

    /**
     * Leases worker slots for one job, waiting up to {@code timeout} for at least one to free up.
     *
     * @param userId owner of the job
     * @param requestedSlots upper bound wanted by the caller
     * @param timeout bounded wait
     * @return allocation with {@code 1 <= slots <= requestedSlots}
     * @throws ResourceExhaustedException if no slot frees up in time or the wait is interrupted
     */
    public WorkerAllocation acquire(String userId, int requestedSlots, Duration timeout) {
        if (userId == null || userId.isBlank()) {
            throw new IllegalArgumentException("userId is required");
        }
        if (requestedSlots < 1) {
            throw new IllegalArgumentException("requestedSlots must be >= 1 but was " + requestedSlots);
        }
        long remaining = timeout.toNanos();
        lock.lock();
        try {
            activeUsers.merge(userId, 1, Integer::sum);
            boolean granted = false;
            try {
                int headroom;
                while ((headroom = headroom(userId)) < 1) {
                    if (remaining <= 0L) {
                        LOGGER.warn("POOL EXHAUSTED user={} requested={} held={} used={}/{} waited={}ms",
                                userId, requestedSlots, slotsByUser.getOrDefault(userId, 0), usedSlots,
                                totalCapacity, timeout.toMillis());
                        throw new ResourceExhaustedException("worker slots", timeout);
                    }
                    remaining = slotsFreed.awaitNanos(remaining);
                }
                int users = Math.max(activeUsers.size(), 1);
                int fairShare = fairShare();
                int slots = Math.min(requestedSlots, headroom);
                int apiSlots = Math.max(1, Math.min(slots, apiCeiling / users));

                usedSlots += slots;
                peakSlots = Math.max(peakSlots, usedSlots);
                slotsByUser.merge(userId, slots, Integer::sum);
                WorkerAllocation allocation = new WorkerAllocation(nextAllocationId++, userId, slots, apiSlots, clock.instant());
                granted = true;
                LOGGER.info("POOL ACQUIRE user={} allocation={} slots={} apiSlots={} fairShare={} users={} used={}/{}",
                        userId, allocation.id(), slots, apiSlots, fairShare, users, usedSlots, totalCapacity);
                return allocation;
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                Duration waited = Duration.ofNanos(timeout.toNanos() - Math.max(remaining, 0L));
                throw new ResourceExhaustedException("worker slots", waited, e);
            } finally {
                if (!granted) {
                    unregister(userId);
                }
            }
        } finally {
            lock.unlock();
        }
    }

    /**
     * Returns an allocation's slots to the pool. Safe to call more than once.
     */
    public void release(WorkerAllocation allocation) {
        if (allocation == null || !allocation.markReleased()) {
            return;
        }
        lock.lock();
        try {
            usedSlots -= allocation.slots();
            slotsByUser.computeIfPresent(allocation.userId(),
                    (user, held) -> held - allocation.slots() <= 0 ? null : held - allocation.slots());
            unregister(allocation.userId());
            slotsFreed.signalAll();
            apiSlotsFreed.signalAll();
            LOGGER.info("POOL RELEASE user={} allocation={} slots={} used={}/{}",
                    allocation.userId(), allocation.id(), allocation.slots(), usedSlots, totalCapacity);
        } finally {
            lock.unlock();
        }
    }

    public ApiPermit acquireApiSlot(WorkerAllocation allocation) {
        return acquireApiSlot(allocation, apiAcquireTimeout);
    }

    /**
     * Reserves one external-API slot for a single remote call made under {@code allocation}.
     *
     * @throws ResourceExhaustedException if no slot frees up within {@code timeout}
     * @throws IllegalStateException if the allocation was already released
     */
    public ApiPermit acquireApiSlot(WorkerAllocation allocation, Duration timeout) {
        long remaining = timeout.toNanos();
        lock.lock();
        try {
            while (usedApiSlots >= apiCeiling || allocation.apiInFlight >= allocation.apiSlots()) {
                if (allocation.isReleased()) {
                    throw new IllegalStateException("allocation " + allocation.id() + " already released");
                }
                if (remaining <= 0L) {
                    LOGGER.debug("POOL API WAIT TIMEOUT user={} allocation={} usedApi={}/{} inFlight={}/{}",
                            allocation.userId(), allocation.id(), usedApiSlots, apiCeiling, allocation.apiInFlight, allocation.apiSlots());
                    throw new ResourceExhaustedException("external API slots", timeout);
                }
                remaining = apiSlotsFreed.awaitNanos(remaining);
            }
            if (allocation.isReleased()) {
                throw new IllegalStateException("allocation " + allocation.id() + " already released");
            }
            usedApiSlots++;
            allocation.apiInFlight++;
            peakApiSlots = Math.max(peakApiSlots, usedApiSlots);
            return new ApiPermit(this, allocation);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ResourceExhaustedException("external API slots",
                    Duration.ofNanos(timeout.toNanos() - Math.max(remaining, 0L)), e);
        } finally {
            lock.unlock();
        }
    }

    void releaseApiSlot(WorkerAllocation allocation) {
        lock.lock();
        try {
            usedApiSlots--;
            allocation.apiInFlight--;
            apiSlotsFreed.signalAll();
        } finally {
            lock.unlock();
        }
    }

    public PoolStats stats() {
        lock.lock();
        try {
            return new PoolStats(totalCapacity, apiCeiling, usedSlots, usedApiSlots, activeUsers.size(),
                    Map.copyOf(slotsByUser), peakSlots, peakApiSlots);
        } finally {
            lock.unlock();
        }
    }

    public int getTotalCapacity() {
        return totalCapacity;
    }

    public int getApiCeiling() {
        return apiCeiling;
    }

    private int fairShare() {
        return Math.max(1, totalCapacity / Math.max(activeUsers.size(), 1));
    }

    // slots this user may still take: bounded by free slots and by what they already hold
    private int headroom(String userId) {
        int free = totalCapacity - usedSlots;
        return Math.min(free, fairShare() - slotsByUser.getOrDefault(userId, 0));
    }

    private void unregister(String userId) {
        Integer left = activeUsers.computeIfPresent(userId, (user, refs) -> refs <= 1 ? null : refs - 1);
        if (left == null) {
            // fewer users means a larger share for those still waiting
            slotsFreed.signalAll();
        }
    }
}
