package com.example.chatsync.ws;

import reactor.core.publisher.Flux;
import reactor.core.publisher.Sinks;

import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Server side of one duplex connection. Bound to a single session id for its
 * whole lifetime.
 */
public class SyncChannel {

    private final String channelId;
    private final String sessionId;
    private final Sinks.Many<String> outbound = Sinks.many().unicast().onBackpressureBuffer();
    private final Runnable closeAction;
    private final AtomicLong lastInboundAt;
    private final AtomicBoolean closed = new AtomicBoolean(false);

    public SyncChannel(String channelId, String sessionId, long openedAt, Runnable closeAction) {
        this.channelId = channelId;
        this.sessionId = sessionId;
        this.closeAction = closeAction;
        this.lastInboundAt = new AtomicLong(openedAt);
    }

    public String getChannelId() {
        return channelId;
    }

    public String getSessionId() {
        return sessionId;
    }

    public Flux<String> outbound() {
        return outbound.asFlux();
    }

    /**
     * Queues a frame for the client. Emissions come from several threads
     * (own requests, broadcasts from sibling channels) and are serialized here.
     */
    public synchronized boolean emit(String frame) {
        if (closed.get()) return false;
        return outbound.tryEmitNext(frame).isSuccess();
    }

    /** Resets the liveness counter. */
    public void touch(long now) {
        lastInboundAt.set(now);
    }

    public long getLastInboundAt() {
        return lastInboundAt.get();
    }

    public boolean isIdle(long now, long idleTimeoutMs) {
        return now - lastInboundAt.get() > idleTimeoutMs;
    }

    public boolean isClosed() {
        return closed.get();
    }

    public void close() {
        if (closed.compareAndSet(false, true)) {
            synchronized (this) {
                outbound.tryEmitComplete();
            }
            closeAction.run();
        }
    }
}
