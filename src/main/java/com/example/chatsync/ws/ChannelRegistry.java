package com.example.chatsync.ws;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Open sync channels, indexed by session so a persisted message can reach
 * every device attached to that session.
 */
@Component
public class ChannelRegistry {

    private static final Logger logger = LoggerFactory.getLogger(ChannelRegistry.class);

    private final Map<String, SyncChannel> channels = new ConcurrentHashMap<>();

    public void register(SyncChannel channel) {
        channels.put(channel.getChannelId(), channel);
        logger.info("Channel {} opened for session {} ({} open)",
                channel.getChannelId(), channel.getSessionId(), channels.size());
    }

    public void unregister(SyncChannel channel) {
        if (channels.remove(channel.getChannelId()) != null) {
            logger.info("Channel {} closed for session {} ({} open)",
                    channel.getChannelId(), channel.getSessionId(), channels.size());
        }
    }

    public List<SyncChannel> channelsFor(String sessionId) {
        List<SyncChannel> result = new ArrayList<>();
        for (SyncChannel channel : channels.values()) {
            if (channel.getSessionId().equals(sessionId)) result.add(channel);
        }
        return result;
    }

    /**
     * Sends a frame to every channel of the session except the origin.
     */
    public int broadcast(String sessionId, String originChannelId, String frame) {
        int delivered = 0;
        for (SyncChannel channel : channelsFor(sessionId)) {
            if (channel.getChannelId().equals(originChannelId)) continue;
            if (channel.emit(frame)) delivered++;
        }
        return delivered;
    }

    public int closeIdle(long now, long idleTimeoutMs) {
        int closed = 0;
        for (SyncChannel channel : new ArrayList<>(channels.values())) {
            if (channel.isIdle(now, idleTimeoutMs)) {
                logger.warn("Channel {} for session {} silent for over {}ms, closing",
                        channel.getChannelId(), channel.getSessionId(), idleTimeoutMs);
                unregister(channel);
                channel.close();
                closed++;
            }
        }
        return closed;
    }

    public int size() {
        return channels.size();
    }
}
