package com.example.chatsync.config;

import com.example.chatsync.client.*;
import com.example.chatsync.kv.InMemoryKvClient;
import com.example.chatsync.kv.RedisKvClient;
import com.example.chatsync.protocol.EnvelopeCodec;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.web.reactive.socket.client.ReactorNettyWebSocketClient;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

import java.net.URI;

/**
 * Embedded sync client, switched on with {@code app.client.enabled=true}.
 * Caches messages in Redis and falls back to process memory when Redis is full.
 */
@Configuration
@ConditionalOnProperty(prefix = "app.client", name = "enabled", havingValue = "true")
@EnableConfigurationProperties(SyncClientProperties.class)
public class SyncClientConfig {

    private static final Logger logger = LoggerFactory.getLogger(SyncClientConfig.class);

    @Bean(destroyMethod = "dispose")
    public Scheduler syncClientScheduler() {
        return Schedulers.newSingle("chat-sync-client");
    }

    @Bean(destroyMethod = "close")
    public LocalCache localCache(StringRedisTemplate redis, ObjectMapper objectMapper,
                                 Scheduler syncClientScheduler, SyncClientProperties props) {
        return new LocalCache(new RedisKvClient(redis), new InMemoryKvClient(), objectMapper,
                syncClientScheduler, props);
    }

    @Bean
    public SyncTransport syncTransport(SyncClientProperties props) {
        return new ReactorNettyWebSocketTransport(new ReactorNettyWebSocketClient(),
                URI.create(props.getServerUrl()), props.getGatewayPath());
    }

    @Bean(destroyMethod = "close")
    public ConnectionManager connectionManager(SyncTransport syncTransport, LocalCache localCache,
                                               EnvelopeCodec codec, Scheduler syncClientScheduler,
                                               SyncClientProperties props) {
        if (props.getSessionId() == null || props.getSessionId().isBlank()) {
            throw new IllegalStateException("app.client.session-id must be set when the sync client is enabled");
        }
        return new ConnectionManager(props.getSessionId(), syncTransport, localCache, codec,
                BackoffPolicy.from(props), syncClientScheduler, props);
    }

    @Bean
    public ApplicationRunner syncClientStarter(ConnectionManager connectionManager) {
        return args -> {
            logger.info("Starting sync client for session {}", connectionManager.getSessionId());
            connectionManager.connect();
        };
    }
}
