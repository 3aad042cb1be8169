package com.example.callaudit_backend.service.pool;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * One external-API slot held for the duration of a single remote call. Closing is idempotent.
 */
public final class ApiPermit implements AutoCloseable {

    private final WorkerPoolManager pool;
    private final WorkerAllocation allocation;
    private final AtomicBoolean closed = new AtomicBoolean();

    ApiPermit(WorkerPoolManager pool, WorkerAllocation allocation) {
        this.pool = pool;
        this.allocation = allocation;
    }

    public WorkerAllocation allocation() {
        return allocation;
    }

    @Override
    public void close() {
        if (closed.compareAndSet(false, true)) {
            pool.releaseApiSlot(allocation);
        }
    }
}
