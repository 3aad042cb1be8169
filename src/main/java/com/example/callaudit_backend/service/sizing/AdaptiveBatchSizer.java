package com.example.callaudit_backend.service.sizing;

import com.example.callaudit_backend.config.BatchSizerProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Per-user chunk size controller.
 *
 * <p>Each user has an EWMA of per-file latency. When a recommendation is requested the current
 * EWMA is compared with the value seen at the previous recommendation:
 * <ul>
 *   <li>rate-limited since last time, or latency rose beyond the tolerance or above the ceiling:
 *   multiplicative decrease</li>
 *   <li>latency rose within the tolerance: hold</li>
 *   <li>otherwise: additive increase</li>
 * </ul>
 * The result is always clamped to {@code [1, allocatedSlots]}. State is keyed per user and never
 * shared, so one user's slow files do not shrink another user's chunks.
 */
@Component
public class AdaptiveBatchSizer {
    private static final Logger LOGGER = LoggerFactory.getLogger(AdaptiveBatchSizer.class);

    private final BatchSizerProperties properties;
    private final Clock clock;
    private final Map<String, UserState> states = new ConcurrentHashMap<>();

    public AdaptiveBatchSizer(BatchSizerProperties properties, Clock clock) {
        if (properties.getEwmaAlpha() <= 0 || properties.getEwmaAlpha() > 1) {
            throw new IllegalArgumentException("ewmaAlpha must be in (0, 1] but was " + properties.getEwmaAlpha());
        }
        if (properties.getDecreaseFactor() <= 0 || properties.getDecreaseFactor() >= 1) {
            throw new IllegalArgumentException("decreaseFactor must be in (0, 1) but was " + properties.getDecreaseFactor());
        }
        this.properties = properties;
        this.clock = clock;
    }

    /**
     * Marks the start of a job for {@code userId}; users with an open job are never evicted.
     */
    public void openSession(String userId) {
        UserState state = stateFor(userId);
        synchronized (state) {
            state.openJobs++;
            state.lastSeen = clock.instant();
        }
    }

    public void closeSession(String userId) {
        UserState state = states.get(userId);
        if (state == null) {
            return;
        }
        synchronized (state) {
            state.openJobs = Math.max(0, state.openJobs - 1);
            state.lastSeen = clock.instant();
        }
    }

    /**
     * Folds one completed file's processing time into the user's average.
     */
    public void recordObservation(String userId, double elapsedSeconds) {
        if (Double.isNaN(elapsedSeconds) || elapsedSeconds < 0) {
            throw new IllegalArgumentException("elapsedSeconds must be >= 0 but was " + elapsedSeconds);
        }
        UserState state = stateFor(userId);
        synchronized (state) {
            if (state.observations == 0) {
                state.ewma = elapsedSeconds;
            } else {
                double alpha = properties.getEwmaAlpha();
                state.ewma = alpha * elapsedSeconds + (1 - alpha) * state.ewma;
            }
            state.observations++;
            state.lastSeen = clock.instant();
        }
    }

    /**
     * Registers a rate-limit signal from the remote detector; the next recommendation shrinks.
     */
    public void recordThrottle(String userId) {
        UserState state = stateFor(userId);
        synchronized (state) {
            state.throttled = true;
            state.lastSeen = clock.instant();
        }
        LOGGER.debug("SIZER THROTTLE user={}", userId);
    }

    /**
     * @param userId owner of the batch
     * @param allocatedSlots worker slots currently leased by the job
     * @return chunk size in {@code [1, allocatedSlots]}
     */
    public int recommendChunkSize(String userId, int allocatedSlots) {
        if (allocatedSlots < 1) {
            throw new IllegalArgumentException("allocatedSlots must be >= 1 but was " + allocatedSlots);
        }
        UserState state = stateFor(userId);
        synchronized (state) {
            int previous = state.lastChunk;
            int next;
            String rule;
            if (previous == 0) {
                next = properties.getInitialChunkSize();
                rule = "initial";
            } else if (state.throttled) {
                next = decrease(previous);
                rule = "throttled";
            } else if (state.observations == 0) {
                next = previous;
                rule = "no-data";
            } else if (risingBeyondTolerance(state) || state.ewma > properties.getLatencyCeiling().toMillis() / 1000.0) {
                next = decrease(previous);
                rule = "decrease";
            } else if (state.ewma > state.windowEwma) {
                next = previous;
                rule = "hold";
            } else {
                next = previous + properties.getAdditiveIncrease();
                rule = "increase";
            }
            next = Math.max(1, Math.min(next, allocatedSlots));

            state.throttled = false;
            state.windowEwma = state.ewma;
            state.lastChunk = next;
            state.lastSeen = clock.instant();
            LOGGER.debug("SIZER RECOMMEND user={} rule={} previous={} next={} allocated={} ewma={}s",
                    userId, rule, previous, next, allocatedSlots, state.ewma);
            return next;
        }
    }

    public Optional<LatencyEstimate> estimate(String userId) {
        UserState state = states.get(userId);
        if (state == null) {
            return Optional.empty();
        }
        synchronized (state) {
            return Optional.of(new LatencyEstimate(userId, state.ewma, state.observations, state.lastChunk, state.throttled, state.lastSeen));
        }
    }

    @Scheduled(fixedDelayString = "${batch.sizer.eviction-interval-ms:60000}")
    public void evictIdle() {
        int evicted = evictIdleBefore(clock.instant().minus(properties.getIdleEviction()));
        if (evicted > 0) {
            LOGGER.info("SIZER EVICT count={} remaining={}", evicted, states.size());
        }
    }

    /**
     * Drops state of users without an open job whose last activity is before {@code cutoff}.
     *
     * @return number of users evicted
     */
    public int evictIdleBefore(Instant cutoff) {
        int evicted = 0;
        for (Map.Entry<String, UserState> entry : states.entrySet()) {
            UserState state = entry.getValue();
            boolean idle;
            synchronized (state) {
                idle = state.openJobs == 0 && state.lastSeen.isBefore(cutoff);
            }
            if (idle && states.remove(entry.getKey(), state)) {
                evicted++;
            }
        }
        return evicted;
    }

    public int trackedUsers() {
        return states.size();
    }

    private boolean risingBeyondTolerance(UserState state) {
        if (Double.isNaN(state.windowEwma)) {
            return false;
        }
        return state.ewma > state.windowEwma * (1 + properties.getRiseTolerance());
    }

    private int decrease(int previous) {
        return Math.max(1, (int) Math.floor(previous * properties.getDecreaseFactor()));
    }

    private UserState stateFor(String userId) {
        return states.computeIfAbsent(userId, id -> new UserState(clock.instant()));
    }

    private static final class UserState {
        double ewma = Double.NaN;
        double windowEwma = Double.NaN;
        long observations;
        int lastChunk;
        boolean throttled;
        int openJobs;
        Instant lastSeen;

        UserState(Instant now) {
            this.lastSeen = now;
        }
    }
}
