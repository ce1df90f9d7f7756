package com.example.chatsync.client;

import com.example.chatsync.model.MessageRole;
import com.example.chatsync.protocol.Envelope;
import com.example.chatsync.protocol.EnvelopeCodec;
import com.example.chatsync.protocol.EnvelopeType;
import com.example.chatsync.protocol.ProtocolException;
import com.example.chatsync.store.ValidationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.Disposable;
import reactor.core.scheduler.Scheduler;

import java.util.*;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;

/**
 * Keeps one sync channel to the gateway alive for a session.
 * <p>
 * All transitions go through {@link #handleEvent}. Transport callbacks and
 * timers are handed to the scheduler first, so the state machine sees one
 * event at a time. Each connection attempt gets a new generation number and
 * events from older generations are discarded.
 */
public class ConnectionManager implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(ConnectionManager.class);

    private final String sessionId;
    private final SyncTransport transport;
    private final LocalCache cache;
    private final EnvelopeCodec codec;
    private final BackoffPolicy backoff;
    private final Scheduler scheduler;
    private final SyncClientProperties props;

    private final List<ConnectionListener> listeners = new CopyOnWriteArrayList<>();
    private final Deque<Envelope> outboundQueue = new ArrayDeque<>();

    private ConnectionState state = ConnectionState.DISCONNECTED;
    private int attempt;
    private long generation;
    private TransportHandle handle;
    private LivenessMonitor liveness;
    private Disposable reconnectTimer;
    private boolean awaitingReconciliation;

    public ConnectionManager(String sessionId, SyncTransport transport, LocalCache cache, EnvelopeCodec codec,
                             BackoffPolicy backoff, Scheduler scheduler, SyncClientProperties props) {
        this.sessionId = sessionId;
        this.transport = transport;
        this.cache = cache;
        this.codec = codec;
        this.backoff = backoff;
        this.scheduler = scheduler;
        this.props = props;
    }

    public void addListener(ConnectionListener listener) {
        listeners.add(listener);
    }

    public void connect() {
        dispatch(ConnectionEvent.connectRequested());
    }

    @Override
    public void close() {
        handleEvent(ConnectionEvent.closeRequested());
    }

    public synchronized ConnectionState getState() {
        return state;
    }

    public synchronized int getAttempt() {
        return attempt;
    }

    public synchronized int getQueuedCount() {
        return outboundQueue.size();
    }

    public String getSessionId() {
        return sessionId;
    }

    public List<CachedMessage> getMessages() {
        return cache.getMessages(sessionId);
    }

    /**
     * Caches the message as pending and sends it, or queues it until the channel is up.
     */
    public synchronized CachedMessage sendMessage(String role, String content, String agentName,
                                                  Map<String, Object> metadata) {
        MessageRole messageRole = MessageRole.fromValue(role);
        if (content == null) {
            throw new ValidationException("Message content must be text");
        }
        if (state.isTerminal()) {
            throw new IllegalStateException("Connection for session " + sessionId + " is " + state);
        }

        String clientId = UUID.randomUUID().toString();
        long now = scheduler.now(TimeUnit.MILLISECONDS);
        Map<String, Object> meta = metadata == null ? new LinkedHashMap<>() : new LinkedHashMap<>(metadata);
        meta.put(Envelope.CLIENT_ID_KEY, clientId);
        meta.put(Envelope.CLIENT_TIMESTAMP_KEY, now);

        CachedMessage pending = CachedMessage.builder()
                .id(clientId)
                .sessionId(sessionId)
                .role(messageRole.getValue())
                .content(content)
                .agentName(agentName)
                .timestamp(now)
                .metadata(meta)
                .syncState(SyncState.PENDING)
                .build();
        notifyMessages(cache.append(sessionId, pending));
        sendOrQueue(toEnvelope(pending));
        return pending;
    }

    /**
     * Re-sends every cached pending message that is not already queued.
     *
     * @return number of messages sent or queued
     */
    public synchronized int retryPending() {
        Set<String> queued = new HashSet<>();
        for (Envelope envelope : outboundQueue) {
            Object clientId = envelope.getMetadata() == null ? null : envelope.getMetadata().get(Envelope.CLIENT_ID_KEY);
            if (clientId != null) queued.add(clientId.toString());
        }
        int retried = 0;
        for (CachedMessage message : cache.pending(sessionId)) {
            if (message.getClientId() != null && queued.contains(message.getClientId())) continue;
            sendOrQueue(toEnvelope(message));
            retried++;
        }
        logger.info("Retried {} pending messages of session {}", retried, sessionId);
        return retried;
    }

    /**
     * Forgets everything cached or queued for the session. Server history is not touched.
     */
    public synchronized void resetSession() {
        outboundQueue.clear();
        cache.reset(sessionId);
        notifyMessages(List.of());
    }

    public synchronized void handleEvent(ConnectionEvent event) {
        if (event.generation() != ConnectionEvent.ANY_GENERATION && event.generation() != generation) {
            logger.debug("Discarding {} from connection #{} (current #{})", event.type(), event.generation(), generation);
            return;
        }
        switch (state) {
            case DISCONNECTED:
                whenDisconnected(event);
                break;
            case CONNECTING:
                whenConnecting(event);
                break;
            case CONNECTED:
                whenConnected(event);
                break;
            case RECONNECT_WAIT:
                whenWaiting(event);
                break;
            default:
                logger.debug("Ignoring {} in state {}", event.type(), state);
        }
    }

    private void whenDisconnected(ConnectionEvent event) {
        switch (event.type()) {
            case CONNECT_REQUESTED:
                openChannel();
                break;
            case CLOSE_REQUESTED:
                shutdown();
                break;
            default:
                logger.debug("Ignoring {} while disconnected", event.type());
        }
    }

    private void whenConnecting(ConnectionEvent event) {
        switch (event.type()) {
            case TRANSPORT_OPENED:
                channelOpened();
                break;
            case TRANSPORT_CLOSED:
                channelLost(event.error());
                break;
            case CLOSE_REQUESTED:
                shutdown();
                break;
            default:
                logger.debug("Ignoring {} while connecting", event.type());
        }
    }

    private void whenConnected(ConnectionEvent event) {
        switch (event.type()) {
            case FRAME_RECEIVED:
                onFrame(event.frame());
                break;
            case TRANSPORT_CLOSED:
                channelLost(event.error());
                break;
            case LIVENESS_LOST:
                logger.warn("Sync channel for session {} stopped answering heartbeats", sessionId);
                channelLost(null);
                break;
            case CLOSE_REQUESTED:
                shutdown();
                break;
            default:
                logger.debug("Ignoring {} while connected", event.type());
        }
    }

    private void whenWaiting(ConnectionEvent event) {
        switch (event.type()) {
            case RECONNECT_DUE:
                openChannel();
                break;
            case CLOSE_REQUESTED:
                shutdown();
                break;
            default:
                logger.debug("Ignoring {} while waiting to reconnect", event.type());
        }
    }

    private void openChannel() {
        cancelReconnectTimer();
        transition(ConnectionState.CONNECTING);
        long gen = ++generation;
        logger.info("Opening sync channel for session {} (connection #{}, attempt {})", sessionId, gen, attempt);
        try {
            handle = transport.open(sessionId, new ChannelListener(gen));
        } catch (RuntimeException e) {
            logger.warn("Failed to open sync channel for session {}: {}", sessionId, e.toString());
            handle = null;
            channelLost(e);
        }
    }

    private void channelOpened() {
        cancelReconnectTimer();
        attempt = 0;
        transition(ConnectionState.CONNECTED);

        long gen = generation;
        liveness = new LivenessMonitor(scheduler, props.getHeartbeatIntervalMs(), props.getHeartbeatTimeoutMs(),
                props.getMaxMissedHeartbeats(), this::sendHeartbeat,
                () -> dispatch(ConnectionEvent.livenessLost(gen)));
        liveness.start();

        flushQueue();
        reconcile();
    }

    private void reconcile() {
        Envelope request = cache.latestConfirmed(sessionId)
                .map(last -> Envelope.syncRequest(last.getId(), last.getTimestamp()))
                .orElseGet(() -> Envelope.historyRequest(props.getHistoryLimit()));
        awaitingReconciliation = sendNow(request);
        logger.debug("Requested {} for session {}", request.getType(), sessionId);
    }

    private void onFrame(String frame) {
        if (liveness != null) liveness.recordInbound();

        Envelope envelope;
        try {
            envelope = codec.decode(frame);
        } catch (ProtocolException e) {
            logger.warn("Ignoring bad frame on session {}: {}", sessionId, e.getMessage());
            return;
        }

        EnvelopeType type = envelope.resolvedType();
        switch (type) {
            case MESSAGE:
                notifyMessages(cache.mergeRemote(sessionId, List.of(CachedMessage.confirmed(envelope, sessionId))));
                break;
            case HISTORY:
            case SYNC_RESPONSE:
                if (!awaitingReconciliation) {
                    logger.debug("Discarding unsolicited {} on session {}", envelope.getType(), sessionId);
                    break;
                }
                awaitingReconciliation = false;
                List<CachedMessage> remote = new ArrayList<>();
                if (envelope.getMessages() != null) {
                    envelope.getMessages().forEach(m -> remote.add(CachedMessage.confirmed(m, sessionId)));
                }
                List<CachedMessage> merged = cache.mergeRemote(sessionId, remote);
                logger.info("Session {} reconciled: {} from server, {} cached", sessionId, remote.size(), merged.size());
                notifyMessages(merged);
                break;
            case ERROR:
                logger.warn("Server rejected a request on session {}: {} {}",
                        sessionId, envelope.getCode(), envelope.getReason());
                break;
            case HEARTBEAT:
                break;
            default:
                logger.debug("Ignoring {} on session {}", envelope.getType(), sessionId);
        }
    }

    private void channelLost(Throwable cause) {
        stopLiveness();
        awaitingReconciliation = false;
        closeHandle();

        if (attempt >= props.getMaxAttempts()) {
            logger.error("Giving up on session {} after {} reconnect attempts", sessionId, attempt);
            transition(ConnectionState.FAILED);
            return;
        }

        long delay = backoff.delayMs(attempt);
        attempt++;
        transition(ConnectionState.RECONNECT_WAIT);
        long gen = generation;
        logger.warn("Sync channel for session {} lost ({}), reconnecting in {}ms (attempt {}/{})",
                sessionId, cause == null ? "closed" : cause.toString(), delay, attempt, props.getMaxAttempts());
        reconnectTimer = scheduler.schedule(() -> handleEvent(ConnectionEvent.reconnectDue(gen)),
                delay, TimeUnit.MILLISECONDS);
    }

    private void shutdown() {
        cancelReconnectTimer();
        stopLiveness();
        awaitingReconciliation = false;
        closeHandle();
        transition(ConnectionState.CLOSED);
        cache.flush();
    }

    private synchronized void sendHeartbeat() {
        if (state == ConnectionState.CONNECTED) sendNow(Envelope.heartbeat());
    }

    private void sendOrQueue(Envelope envelope) {
        if (state == ConnectionState.CONNECTED && outboundQueue.isEmpty() && sendNow(envelope)) {
            return;
        }
        outboundQueue.addLast(envelope);
        logger.debug("Queued message for session {} ({} waiting)", sessionId, outboundQueue.size());
    }

    private void flushQueue() {
        int sent = 0;
        while (!outboundQueue.isEmpty()) {
            if (!sendNow(outboundQueue.peekFirst())) break;
            outboundQueue.pollFirst();
            sent++;
        }
        if (sent > 0) logger.info("Sent {} queued messages for session {}", sent, sessionId);
    }

    private boolean sendNow(Envelope envelope) {
        return handle != null && handle.send(codec.encode(envelope));
    }

    private Envelope toEnvelope(CachedMessage message) {
        return Envelope.builder()
                .type(EnvelopeType.MESSAGE.wireName())
                .role(message.getRole())
                .content(message.getContent())
                .agentName(message.getAgentName())
                .userId(message.getUserId())
                .metadata(message.getMetadata())
                .build();
    }

    private void transition(ConnectionState next) {
        ConnectionState previous = state;
        if (previous == next) return;
        state = next;
        logger.info("Session {} connection {} -> {}", sessionId, previous, next);
        for (ConnectionListener listener : listeners) {
            try {
                listener.onStateChanged(previous, next);
            } catch (RuntimeException e) {
                logger.warn("Connection listener failed on state change", e);
            }
        }
    }

    private void notifyMessages(List<CachedMessage> messages) {
        for (ConnectionListener listener : listeners) {
            try {
                listener.onMessagesChanged(sessionId, messages);
            } catch (RuntimeException e) {
                logger.warn("Connection listener failed on message update", e);
            }
        }
    }

    private void stopLiveness() {
        if (liveness != null) {
            liveness.stop();
            liveness = null;
        }
    }

    private void closeHandle() {
        if (handle != null) {
            handle.close();
            handle = null;
        }
    }

    private void cancelReconnectTimer() {
        if (reconnectTimer != null) {
            reconnectTimer.dispose();
            reconnectTimer = null;
        }
    }

    private void dispatch(ConnectionEvent event) {
        try {
            scheduler.schedule(() -> handleEvent(event));
        } catch (RejectedExecutionException e) {
            logger.debug("Scheduler stopped, dropping {}", event.type());
        }
    }

    private final class ChannelListener implements TransportListener {
        private final long gen;

        private ChannelListener(long gen) {
            this.gen = gen;
        }

        @Override
        public void onOpen() {
            dispatch(ConnectionEvent.opened(gen));
        }

        @Override
        public void onFrame(String frame) {
            dispatch(ConnectionEvent.frame(gen, frame));
        }

        @Override
        public void onClosed(Throwable error) {
            dispatch(ConnectionEvent.closed(gen, error));
        }
    }
}
