package com.example.callaudit_backend.service.quota;

import com.example.callaudit_backend.config.QuotaProperties;
import com.example.callaudit_backend.exception.QuotaExceededException;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class QuotaEnforcerTest {

    private static final Instant NOON = Instant.parse("2024-05-01T12:00:00Z");

    @Test
    void consumesUntilLimitThenRejects() {
        InMemoryQuotaStore store = new InMemoryQuotaStore(3);
        QuotaEnforcer enforcer = new QuotaEnforcer(store, new QuotaProperties(), Clock.fixed(NOON, ZoneOffset.UTC));

        enforcer.consume("alice");
        enforcer.consume("alice");
        enforcer.consume("alice");

        assertThatThrownBy(() -> enforcer.consume("alice"))
                .isInstanceOf(QuotaExceededException.class)
                .satisfies(e -> {
                    QuotaExceededException q = (QuotaExceededException) e;
                    assertThat(q.getLimit()).isEqualTo(3);
                    assertThat(q.getDateKey()).isEqualTo(LocalDate.of(2024, 5, 1));
                });
        assertThat(store.getDailyUsage("alice", LocalDate.of(2024, 5, 1))).isEqualTo(3);
        assertThat(enforcer.remaining("alice")).isZero();
        assertThat(enforcer.remaining("bob")).isEqualTo(3);
        assertThat(enforcer.lockedUsers()).isZero();
    }

    @Test
    void perUserLimitOverridesDefault() {
        InMemoryQuotaStore store = new InMemoryQuotaStore(100);
        store.setLimit("trial", 1);
        QuotaEnforcer enforcer = new QuotaEnforcer(store, new QuotaProperties(), Clock.fixed(NOON, ZoneOffset.UTC));

        enforcer.consume("trial");

        assertThatThrownBy(() -> enforcer.consume("trial")).isInstanceOf(QuotaExceededException.class);
        enforcer.consume("regular");
    }

    @Test
    void counterResetsOnNextDayInConfiguredZone() {
        InMemoryQuotaStore store = new InMemoryQuotaStore(1);
        QuotaProperties properties = new QuotaProperties();
        properties.setZone(ZoneId.of("Europe/Amsterdam"));
        // 23:30 UTC is already the next day in Amsterdam
        Instant lateEvening = Instant.parse("2024-05-01T21:30:00Z");
        Instant afterMidnightLocal = Instant.parse("2024-05-01T23:30:00Z");

        QuotaEnforcer evening = new QuotaEnforcer(store, properties, Clock.fixed(lateEvening, ZoneOffset.UTC));
        QuotaEnforcer night = new QuotaEnforcer(store, properties, Clock.fixed(afterMidnightLocal, ZoneOffset.UTC));

        evening.consume("alice");
        assertThatThrownBy(() -> evening.consume("alice")).isInstanceOf(QuotaExceededException.class);
        night.consume("alice");

        assertThat(evening.today()).isEqualTo(LocalDate.of(2024, 5, 1));
        assertThat(night.today()).isEqualTo(LocalDate.of(2024, 5, 2));
    }

    @Test
    void concurrentConsumersNeverExceedLimit() throws Exception {
        InMemoryQuotaStore store = new InMemoryQuotaStore(50);
        QuotaEnforcer enforcer = new QuotaEnforcer(store, new QuotaProperties(), Clock.fixed(NOON, ZoneOffset.UTC));
        AtomicInteger admitted = new AtomicInteger();
        AtomicInteger rejected = new AtomicInteger();
        ExecutorService executor = Executors.newFixedThreadPool(16);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<?>> futures = new ArrayList<>();
        try {
            for (int i = 0; i < 200; i++) {
                futures.add(executor.submit(() -> {
                    start.await();
                    try {
                        enforcer.consume("alice");
                        admitted.incrementAndGet();
                    } catch (QuotaExceededException e) {
                        rejected.incrementAndGet();
                    }
                    return null;
                }));
            }
            start.countDown();
            for (Future<?> future : futures) {
                future.get(10, TimeUnit.SECONDS);
            }
        } finally {
            executor.shutdownNow();
        }

        assertThat(admitted.get()).isEqualTo(50);
        assertThat(rejected.get()).isEqualTo(150);
        assertThat(store.getDailyUsage("alice", LocalDate.of(2024, 5, 1))).isEqualTo(50);
        assertThat(enforcer.lockedUsers()).isZero();
    }
}
