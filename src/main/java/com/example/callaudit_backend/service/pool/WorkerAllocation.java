package com.example.callaudit_backend.service.pool;

import java.time.Instant;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Lease on worker slots plus a cap on concurrent external-API calls. Created and released only by
 * {@link WorkerPoolManager}.
 */
public final class WorkerAllocation {

    private final long id;
    private final String userId;
    private final int slots;
    private final int apiSlots;
    private final Instant grantedAt;
    private final AtomicBoolean released = new AtomicBoolean();

    // guarded by the pool lock
    int apiInFlight;

    WorkerAllocation(long id, String userId, int slots, int apiSlots, Instant grantedAt) {
        this.id = id;
        this.userId = userId;
        this.slots = slots;
        this.apiSlots = apiSlots;
        this.grantedAt = grantedAt;
    }

    public long id() {
        return id;
    }

    public String userId() {
        return userId;
    }

    public int slots() {
        return slots;
    }

    /**
     * Maximum number of remote calls this allocation may have in flight at once.
     */
    public int apiSlots() {
        return apiSlots;
    }

    public Instant grantedAt() {
        return grantedAt;
    }

    public boolean isReleased() {
        return released.get();
    }

    boolean markReleased() {
        return released.compareAndSet(false, true);
    }

    @Override
    public String toString() {
        return "WorkerAllocation{id=" + id + ", user=" + userId + ", slots=" + slots + ", apiSlots=" + apiSlots + "}";
    }
}
