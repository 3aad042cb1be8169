package com.example.callaudit_backend.controller;

import com.example.callaudit_backend.service.UsageService;
import com.example.callaudit_backend.service.quota.QuotaEnforcer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Exposes remote-detector quota usage per operator.
 */
@RestController
@RequestMapping("/v1/users")
public class UsageController {
    private static final Logger LOGGER = LoggerFactory.getLogger(UsageController.class);
    private final UsageService usageService;
    private final QuotaEnforcer quotaEnforcer;

    public UsageController(UsageService usageService, QuotaEnforcer quotaEnforcer) {
        this.usageService = usageService;
        this.quotaEnforcer = quotaEnforcer;
    }

    /**
     * Returns today's usage for the requested operator.
     *
     * @param userId operator id
     * @return usage DTO
     */
    @GetMapping("/{userId}/usage")
    public UsageResponse usage(@PathVariable String userId) {
        UsageService.UsageSnapshot snapshot = usageService.getUsage(userId, quotaEnforcer.today());
        LOGGER.info("UsageController usage user={} used={} limit={}", userId, snapshot.used(), snapshot.limit());
        return new UsageResponse(snapshot.userId(), snapshot.used(), snapshot.limit(), snapshot.remaining(), snapshot.dateKey().toString());
    }

    /**
     * DTO for usage payload.
     *
     * @param userId operator id
     * @param used files sent to the remote detector today
     * @param limit daily limit
     * @param remaining files still allowed today
     * @param dateKey quota day as ISO date
     */
    public record UsageResponse(String userId, int used, int limit, int remaining, String dateKey) { }
}
