package com.example.chatsync.ws;

import com.example.chatsync.model.ChatMessage;
import com.example.chatsync.protocol.Envelope;
import com.example.chatsync.protocol.EnvelopeCodec;
import com.example.chatsync.protocol.ProtocolException;
import com.example.chatsync.protocol.WireMessage;
import com.example.chatsync.store.NewMessage;
import com.example.chatsync.store.SessionStore;
import com.example.chatsync.store.StorageUnavailableException;
import com.example.chatsync.store.ValidationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Dispatches inbound envelopes of one channel. Never lets an error escape:
 * a failed request must not tear down the connection.
 */
@Service
public class SyncProtocolHandler {

    private static final Logger logger = LoggerFactory.getLogger(SyncProtocolHandler.class);

    private final SessionStore store;
    private final ChannelRegistry registry;
    private final EnvelopeCodec codec;
    private final Scheduler storeScheduler;

    @Value("${app.gateway.default-history-limit:50}")
    private int defaultHistoryLimit = 50;

    @Autowired
    public SyncProtocolHandler(SessionStore store, ChannelRegistry registry, EnvelopeCodec codec) {
        this(store, registry, codec, Schedulers.boundedElastic());
    }

    public SyncProtocolHandler(SessionStore store, ChannelRegistry registry, EnvelopeCodec codec,
                               Scheduler storeScheduler) {
        this.store = store;
        this.registry = registry;
        this.codec = codec;
        this.storeScheduler = storeScheduler;
    }

    public Mono<Void> handle(SyncChannel channel, String frame) {
        channel.touch(System.currentTimeMillis());

        Envelope envelope;
        try {
            envelope = codec.decode(frame);
        } catch (ProtocolException e) {
            logger.warn("Ignoring frame on channel {} (session {}): {}",
                    channel.getChannelId(), channel.getSessionId(), e.getMessage());
            return Mono.empty();
        }

        logger.debug("Channel {} received {}", channel.getChannelId(), envelope.getType());
        switch (envelope.resolvedType()) {
            case MESSAGE:
                return onMessage(channel, envelope);
            case HISTORY_REQUEST:
                return onHistoryRequest(channel, envelope);
            case SYNC_REQUEST:
                return onSyncRequest(channel, envelope);
            case HEARTBEAT:
                channel.emit(codec.encode(Envelope.heartbeat()));
                return Mono.empty();
            default:
                logger.warn("Ignoring server-only envelope {} on channel {}",
                        envelope.getType(), channel.getChannelId());
                return Mono.empty();
        }
    }

    private Mono<Void> onMessage(SyncChannel channel, Envelope envelope) {
        String sessionId = channel.getSessionId();
        NewMessage message = new NewMessage(envelope.getRole(), envelope.getContent(),
                envelope.getAgentName(), envelope.getUserId(), envelope.getMetadata());

        Mono<Void> work = Mono.fromCallable(() -> store.appendMessage(sessionId, message))
                .subscribeOn(storeScheduler)
                .doOnNext(saved -> {
                    String confirmation = codec.encode(Envelope.confirmation(saved.toWire()));
                    channel.emit(confirmation);
                    int others = registry.broadcast(sessionId, channel.getChannelId(), confirmation);
                    logger.debug("Message {} confirmed on channel {}, broadcast to {} other channels",
                            saved.getId(), channel.getChannelId(), others);
                })
                .onErrorResume(ValidationException.class, e -> {
                    logger.warn("Rejected message on channel {} (session {}): {}",
                            channel.getChannelId(), sessionId, e.getMessage());
                    channel.emit(codec.encode(Envelope.error("validation", e.getMessage())));
                    return Mono.empty();
                })
                .then();
        return guard(work, channel, "message");
    }

    private Mono<Void> onHistoryRequest(SyncChannel channel, Envelope envelope) {
        int limit = envelope.getLimit() != null && envelope.getLimit() > 0 ? envelope.getLimit() : defaultHistoryLimit;
        Mono<Void> work = Mono.fromCallable(() -> store.listRecentMessages(channel.getSessionId(), limit))
                .subscribeOn(storeScheduler)
                .doOnNext(messages -> channel.emit(codec.encode(Envelope.history(toWire(messages)))))
                .then();
        return guard(work, channel, "history_request");
    }

    private Mono<Void> onSyncRequest(SyncChannel channel, Envelope envelope) {
        String sessionId = channel.getSessionId();
        String lastMessageId = envelope.getLastMessageId();
        Mono<Void> work = Mono.fromCallable(() -> store.listMessagesAfter(sessionId, lastMessageId)
                        .orElseGet(() -> {
                            logger.info("Sync anchor {} not found in session {}, falling back to recent history",
                                    lastMessageId, sessionId);
                            return store.listRecentMessages(sessionId, defaultHistoryLimit);
                        }))
                .subscribeOn(storeScheduler)
                .doOnNext(messages -> channel.emit(codec.encode(Envelope.syncResponse(toWire(messages)))))
                .then();
        return guard(work, channel, "sync_request");
    }

    private Mono<Void> guard(Mono<Void> work, SyncChannel channel, String operation) {
        return work
                .onErrorResume(StorageUnavailableException.class, e -> {
                    logger.warn("Storage unavailable for {} on channel {} (session {}), no response sent",
                            operation, channel.getChannelId(), channel.getSessionId());
                    return Mono.empty();
                })
                .onErrorResume(e -> {
                    logger.error("Unexpected failure handling {} on channel {}", operation, channel.getChannelId(), e);
                    return Mono.empty();
                });
    }

    private static List<WireMessage> toWire(List<ChatMessage> messages) {
        return messages.stream().map(ChatMessage::toWire).collect(Collectors.toList());
    }
}
