package com.example.callaudit_backend.service;

import com.example.callaudit_backend.config.QuotaProperties;
import com.example.callaudit_backend.model.DailyUsage;
import com.example.callaudit_backend.model.UserQuota;
import com.example.callaudit_backend.repository.DailyUsageRepository;
import com.example.callaudit_backend.repository.UserQuotaRepository;
import com.example.callaudit_backend.service.quota.QuotaStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDate;

/**
 * Tracks remote-detector usage per user and day on top of JPA.
 */
@Service
public class UsageService implements QuotaStore {
    private static final Logger LOGGER = LoggerFactory.getLogger(UsageService.class);
    private final DailyUsageRepository dailyUsageRepository;
    private final UserQuotaRepository userQuotaRepository;
    private final QuotaProperties quotaProperties;

    public UsageService(DailyUsageRepository dailyUsageRepository, UserQuotaRepository userQuotaRepository, QuotaProperties quotaProperties) {
        this.dailyUsageRepository = dailyUsageRepository;
        this.userQuotaRepository = userQuotaRepository;
        this.quotaProperties = quotaProperties;
    }

    @Override
    @Transactional(readOnly = true)
    public int getDailyUsage(String userId, LocalDate dateKey) {
        return dailyUsageRepository.findByUserIdAndDateKey(userId, dateKey)
                .map(DailyUsage::getUsed)
                .orElse(0);
    }

    @Override
    @Transactional
    public int incrementDailyUsage(String userId, LocalDate dateKey, int delta) {
        ensureCounter(userId, dateKey);
        dailyUsageRepository.increment(userId, dateKey, delta);
        int used = getDailyUsage(userId, dateKey);
        LOGGER.info("UsageService increment user={} day={} delta={} used={}", userId, dateKey, delta, used);
        return used;
    }

    @Override
    @Transactional(readOnly = true)
    public int getUserDailyLimit(String userId) {
        return userQuotaRepository.findById(userId)
                .map(UserQuota::getDailyLimit)
                .orElse(quotaProperties.getDefaultDailyLimit());
    }

    @Override
    @Transactional
    public boolean tryIncrement(String userId, LocalDate dateKey, int delta, int limit) {
        ensureCounter(userId, dateKey);
        boolean applied = dailyUsageRepository.incrementWithinLimit(userId, dateKey, delta, limit) == 1;
        LOGGER.debug("UsageService tryIncrement user={} day={} delta={} limit={} applied={}", userId, dateKey, delta, limit, applied);
        return applied;
    }

    /**
     * Returns the usage snapshot for the given user and day.
     *
     * @param userId operator
     * @param dateKey quota day
     * @return immutable snapshot
     */
    @Transactional(readOnly = true)
    public UsageSnapshot getUsage(String userId, LocalDate dateKey) {
        int used = getDailyUsage(userId, dateKey);
        int limit = getUserDailyLimit(userId);
        return new UsageSnapshot(userId, used, limit, Math.max(0, limit - used), dateKey);
    }

    private void ensureCounter(String userId, LocalDate dateKey) {
        if (dailyUsageRepository.findByUserIdAndDateKey(userId, dateKey).isEmpty()) {
            dailyUsageRepository.saveAndFlush(new DailyUsage(userId, dateKey));
        }
    }

    /**
     * Snapshot DTO for current usage.
     *
     * @param userId operator
     * @param used files sent to the remote detector on {@code dateKey}
     * @param limit daily limit in effect
     * @param remaining files still allowed today
     * @param dateKey quota day
     */
    public record UsageSnapshot(String userId, int used, int limit, int remaining, LocalDate dateKey) {
    }
}
