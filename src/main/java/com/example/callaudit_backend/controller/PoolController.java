package com.example.callaudit_backend.controller;

import com.example.callaudit_backend.service.pool.PoolStats;
import com.example.callaudit_backend.service.pool.WorkerPoolManager;
import io.swagger.v3.oas.annotations.Operation;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Read-only view of worker pool usage.
 */
@RestController
@RequestMapping("/v1/pool")
public class PoolController {
    private final WorkerPoolManager pool;

    public PoolController(WorkerPoolManager pool) {
        this.pool = pool;
    }

    @Operation(summary = "Current slot and API slot usage per user")
    @GetMapping("/stats")
    public PoolStats stats() {
        return pool.stats();
    }
}
