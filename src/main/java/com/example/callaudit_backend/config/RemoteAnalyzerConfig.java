package com.example.callaudit_backend.config;

import io.netty.channel.ChannelOption;
import io.netty.handler.timeout.ReadTimeoutHandler;
import io.netty.handler.timeout.WriteTimeoutHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.netty.http.HttpProtocol;
import reactor.netty.http.client.HttpClient;
import reactor.netty.resources.ConnectionProvider;

import java.time.Duration;
import java.util.concurrent.TimeUnit;


@Configuration
@EnableConfigurationProperties(RemoteAnalyzerProperties.class)
public class RemoteAnalyzerConfig {
    private static final Logger LOGGER = LoggerFactory.getLogger(RemoteAnalyzerConfig.class);
    private static final int CONNECT_TIMEOUT_MILLIS = 10_000;
    private static final Duration PENDING_ACQUIRE_TIMEOUT = Duration.ofSeconds(30);
    private static final Duration MAX_IDLE_TIME = Duration.ofSeconds(20);
    private static final Duration MAX_LIFE_TIME = Duration.ofMinutes(5);

    @Bean("analyzerWebClient")
    WebClient analyzerWebClient(RemoteAnalyzerProperties props) {
        Duration ioTimeout = Duration.ofSeconds(Math.max(1, props.getTimeoutSeconds()));
        ConnectionProvider provider = ConnectionProvider.builder("remote-analyzer")
                .maxConnections(Math.max(1, props.getMaxConnections()))
                .pendingAcquireTimeout(PENDING_ACQUIRE_TIMEOUT)
                .maxIdleTime(MAX_IDLE_TIME)
                .maxLifeTime(MAX_LIFE_TIME)
                .build();

        HttpClient httpClient = HttpClient.create(provider)
                .protocol(HttpProtocol.HTTP11)
                .responseTimeout(ioTimeout)
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, CONNECT_TIMEOUT_MILLIS)
                .doOnConnected(conn -> conn
                        .addHandlerLast(new ReadTimeoutHandler(ioTimeout.toSeconds(), TimeUnit.SECONDS))
                        .addHandlerLast(new WriteTimeoutHandler(ioTimeout.toSeconds(), TimeUnit.SECONDS))
                );

        LOGGER.info("Configuring analyzer WebClient baseUrl={} connect={}ms io={}s maxConn={}",
                props.getBaseUrl(), CONNECT_TIMEOUT_MILLIS, ioTimeout.toSeconds(), props.getMaxConnections());

        WebClient.Builder builder = WebClient.builder()
                .baseUrl(props.getBaseUrl())
                .clientConnector(new ReactorClientHttpConnector(httpClient))
                .defaultHeader("Accept", "application/json")
                .codecs(c -> c.defaultCodecs().maxInMemorySize(16 * 1024 * 1024));
        if (props.getApiKey() != null && !props.getApiKey().isBlank()) {
            builder.defaultHeader("Authorization", "Bearer " + props.getApiKey().trim());
        }
        return builder.build();
    }
}
