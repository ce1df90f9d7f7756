package com.example.chatsync.ws;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

@Service
public class ChannelLivenessSweeper {

    private static final Logger logger = LoggerFactory.getLogger(ChannelLivenessSweeper.class);

    private final ChannelRegistry registry;

    @Value("${app.gateway.idle-timeout-ms:95000}")
    private long idleTimeoutMs = 95000;

    public ChannelLivenessSweeper(ChannelRegistry registry) {
        this.registry = registry;
    }

    @Scheduled(fixedDelayString = "${app.gateway.sweep-interval-ms:10000}",
               initialDelayString = "${app.gateway.sweep-interval-ms:10000}")
    public void run() {
        int closed = registry.closeIdle(System.currentTimeMillis(), idleTimeoutMs);
        if (closed > 0) {
            logger.info("Closed {} idle sync channels", closed);
        }
    }
}
