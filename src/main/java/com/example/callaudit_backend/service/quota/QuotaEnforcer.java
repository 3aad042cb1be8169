package com.example.callaudit_backend.service.quota;

import com.example.callaudit_backend.config.QuotaProperties;
import com.example.callaudit_backend.exception.QuotaExceededException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDate;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Admits files to the remote detector against the user's daily limit. One unit is consumed per
 * file before its first remote call; retries of that file are free.
 *
 * <p>The store's conditional increment is the source of truth. Calls for the same user are also
 * serialized in-process so that concurrent files never race on creating the day's counter. A
 * user's lock lives only while some call holds or waits for it.
 */
@Component
public class QuotaEnforcer {
    private static final Logger LOGGER = LoggerFactory.getLogger(QuotaEnforcer.class);

    private final QuotaStore store;
    private final QuotaProperties properties;
    private final Clock clock;
    private final Map<String, UserLock> userLocks = new ConcurrentHashMap<>();

    public QuotaEnforcer(QuotaStore store, QuotaProperties properties, Clock clock) {
        this.store = store;
        this.properties = properties;
        this.clock = clock;
    }

    /**
     * Consumes one unit of today's allowance.
     *
     * @throws QuotaExceededException when the limit is already reached
     */
    public void consume(String userId) {
        LocalDate today = today();
        UserLock userLock = userLocks.compute(userId, (id, held) -> {
            UserLock entry = held == null ? new UserLock() : held;
            entry.holders++;
            return entry;
        });
        userLock.lock.lock();
        try {
            int limit = store.getUserDailyLimit(userId);
            if (!store.tryIncrement(userId, today, 1, limit)) {
                LOGGER.info("QUOTA EXCEEDED user={} day={} limit={}", userId, today, limit);
                throw new QuotaExceededException(userId, today, limit);
            }
        } finally {
            userLock.lock.unlock();
            userLocks.computeIfPresent(userId, (id, held) -> --held.holders == 0 ? null : held);
        }
    }

    public int remaining(String userId) {
        LocalDate today = today();
        return Math.max(0, store.getUserDailyLimit(userId) - store.getDailyUsage(userId, today));
    }

    public LocalDate today() {
        return LocalDate.now(clock.withZone(properties.getZone()));
    }

    int lockedUsers() {
        return userLocks.size();
    }

    // holders is only touched inside ConcurrentHashMap.compute for the user's key
    private static final class UserLock {
        private final ReentrantLock lock = new ReentrantLock();
        private int holders;
    }
}
