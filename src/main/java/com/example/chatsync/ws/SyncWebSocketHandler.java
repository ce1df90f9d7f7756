package com.example.chatsync.ws;

import com.example.chatsync.service.ChatHistoryService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.socket.CloseStatus;
import org.springframework.web.reactive.socket.WebSocketHandler;
import org.springframework.web.reactive.socket.WebSocketMessage;
import org.springframework.web.reactive.socket.WebSocketSession;
import reactor.core.publisher.Mono;

/**
 * Serves {@code /ws/{sessionId}}. Inbound frames are handled strictly in
 * arrival order; outbound frames come from the channel's queue.
 */
@Component
public class SyncWebSocketHandler implements WebSocketHandler {

    private static final Logger logger = LoggerFactory.getLogger(SyncWebSocketHandler.class);

    private final ChannelRegistry registry;
    private final SyncProtocolHandler protocolHandler;

    public SyncWebSocketHandler(ChannelRegistry registry, SyncProtocolHandler protocolHandler) {
        this.registry = registry;
        this.protocolHandler = protocolHandler;
    }

    @Override
    public Mono<Void> handle(WebSocketSession session) {
        String sessionId = sessionIdFromPath(session.getHandshakeInfo().getUri().getPath());
        if (!ChatHistoryService.isValidSessionId(sessionId)) {
            logger.warn("Rejecting sync connection with malformed session id '{}'", sessionId);
            return session.close(CloseStatus.POLICY_VIOLATION);
        }

        SyncChannel channel = new SyncChannel(session.getId(), sessionId, System.currentTimeMillis(),
                () -> session.close(CloseStatus.GOING_AWAY).subscribe());
        registry.register(channel);

        Mono<Void> input = session.receive()
                .map(WebSocketMessage::getPayloadAsText)
                .concatMap(frame -> protocolHandler.handle(channel, frame))
                .then();
        Mono<Void> output = session.send(channel.outbound().map(session::textMessage));

        return Mono.firstWithSignal(input, output)
                .doOnError(e -> logger.warn("Channel {} for session {} failed: {}",
                        channel.getChannelId(), sessionId, e.toString()))
                .doFinally(signal -> {
                    registry.unregister(channel);
                    channel.close();
                });
    }

    static String sessionIdFromPath(String path) {
        if (path == null) return null;
        String trimmed = path.endsWith("/") ? path.substring(0, path.length() - 1) : path;
        int slash = trimmed.lastIndexOf('/');
        return slash >= 0 ? trimmed.substring(slash + 1) : trimmed;
    }
}
