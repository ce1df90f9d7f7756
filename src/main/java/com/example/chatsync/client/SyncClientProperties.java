package com.example.chatsync.client;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Settings of the embedded sync client, bound from {@code app.client.*}.
 */
@Data
@ConfigurationProperties(prefix = "app.client")
public class SyncClientProperties {

    private boolean enabled = false;

    private String serverUrl = "ws://localhost:8080";
    private String gatewayPath = "/ws";
    private String sessionId;

    // reconnect
    private int maxAttempts = 10;
    private long initialDelayMs = 1000;
    private long maxDelayMs = 30000;
    private double jitterRatio = 0.3;

    // liveness
    private long heartbeatIntervalMs = 30000;
    private long heartbeatTimeoutMs = 5000;
    private int maxMissedHeartbeats = 3;

    // local cache
    private int cacheCapacity = 200;
    private long writeDebounceMs = 300;
    private int historyLimit = 50;
    private int evictionBatch = 3;
    private String storagePrefix = "chat_sync:cache:";
}
