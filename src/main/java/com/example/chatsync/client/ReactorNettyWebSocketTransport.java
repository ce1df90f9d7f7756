package com.example.chatsync.client;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.reactive.socket.WebSocketMessage;
import org.springframework.web.reactive.socket.client.WebSocketClient;
import reactor.core.Disposable;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;

import java.net.URI;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * WebSocket transport on top of the WebFlux client. Frames are text; the
 * channel for a session lives at {@code {serverUrl}{gatewayPath}/{sessionId}}.
 */
public class ReactorNettyWebSocketTransport implements SyncTransport {

    private static final Logger logger = LoggerFactory.getLogger(ReactorNettyWebSocketTransport.class);

    private final WebSocketClient client;
    private final URI serverUri;
    private final String gatewayPath;

    public ReactorNettyWebSocketTransport(WebSocketClient client, URI serverUri, String gatewayPath) {
        this.client = client;
        this.serverUri = serverUri;
        this.gatewayPath = gatewayPath;
    }

    URI channelUri(String sessionId) {
        return serverUri.resolve(gatewayPath + "/" + sessionId);
    }

    @Override
    public TransportHandle open(String sessionId, TransportListener listener) {
        URI uri = channelUri(sessionId);
        Sinks.Many<String> outbound = Sinks.many().unicast().onBackpressureBuffer();
        AtomicBoolean closedByUs = new AtomicBoolean();

        logger.debug("Connecting to {}", uri);
        Disposable connection = client.execute(uri, session -> {
                    listener.onOpen();
                    Mono<Void> input = session.receive()
                            .map(WebSocketMessage::getPayloadAsText)
                            .doOnNext(listener::onFrame)
                            .then();
                    Mono<Void> output = session.send(outbound.asFlux().map(session::textMessage));
                    return Mono.firstWithSignal(input, output);
                })
                .subscribe(
                        ignored -> { },
                        error -> {
                            if (!closedByUs.get()) listener.onClosed(error);
                        },
                        () -> {
                            if (!closedByUs.get()) listener.onClosed(null);
                        });

        return new Handle(outbound, connection, closedByUs);
    }

    private static final class Handle implements TransportHandle {
        private final Sinks.Many<String> outbound;
        private final Disposable connection;
        private final AtomicBoolean closedByUs;

        private Handle(Sinks.Many<String> outbound, Disposable connection, AtomicBoolean closedByUs) {
            this.outbound = outbound;
            this.connection = connection;
            this.closedByUs = closedByUs;
        }

        @Override
        public synchronized boolean send(String frame) {
            if (closedByUs.get()) return false;
            return outbound.tryEmitNext(frame).isSuccess();
        }

        @Override
        public synchronized void close() {
            if (closedByUs.getAndSet(true)) return;
            outbound.tryEmitComplete();
            connection.dispose();
        }
    }
}
