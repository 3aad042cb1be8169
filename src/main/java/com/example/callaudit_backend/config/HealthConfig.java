package com.example.callaudit_backend.config;

import com.example.callaudit_backend.service.pool.PoolStats;
import com.example.callaudit_backend.service.pool.WorkerPoolManager;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.function.client.WebClient;

import java.io.IOException;
import java.io.OutputStream;
import java.time.Duration;
import java.util.concurrent.TimeUnit;

@Configuration
public class HealthConfig {

    @Bean
    public HealthIndicator ffmpegHealth(DetectorProperties properties) {
        return () -> {
            String binary = properties.getFfmpegBinary();
            try {
                var p = new ProcessBuilder(binary, "-version").redirectErrorStream(true).start();
                p.getInputStream().transferTo(OutputStream.nullOutputStream());
                if (p.waitFor(5, TimeUnit.SECONDS) && p.exitValue() == 0) {
                    return Health.up().withDetail("ffmpeg", binary).build();
                }
                p.destroyForcibly();
                return Health.down().withDetail("ffmpeg", binary).withDetail("reason", "non-zero exit or timeout").build();
            } catch (IOException e) {
                return Health.down(e).withDetail("ffmpeg", "missing").build();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return Health.unknown().withDetail("ffmpeg", "interrupted").build();
            }
        };
    }

    @Bean
    public HealthIndicator workerPoolHealth(WorkerPoolManager pool) {
        return () -> {
            PoolStats stats = pool.stats();
            Health.Builder builder = stats.availableSlots() > 0 ? Health.up() : Health.status("SATURATED");
            return builder
                    .withDetail("totalCapacity", stats.totalCapacity())
                    .withDetail("usedSlots", stats.usedSlots())
                    .withDetail("apiCeiling", stats.apiCeiling())
                    .withDetail("usedApiSlots", stats.usedApiSlots())
                    .withDetail("activeUsers", stats.activeUsers())
                    .build();
        };
    }

    @Bean
    public HealthIndicator remoteAnalyzerHealth(@Qualifier("analyzerWebClient") WebClient analyzer) {
        return () -> {
            try {
                // light check: HEAD / answers at all
                analyzer.head().uri("/")
                        .retrieve()
                        .toBodilessEntity()
                        .block(Duration.ofSeconds(2));
                return Health.up().withDetail("remoteAnalyzer", "ok").build();
            } catch (RuntimeException e) {
                return Health.down(e).withDetail("remoteAnalyzer", "unreachable").build();
            }
        };
    }
}
