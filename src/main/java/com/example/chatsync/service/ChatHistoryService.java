package com.example.chatsync.service;

import com.example.chatsync.model.ChatMessage;
import com.example.chatsync.model.ChatSession;
import com.example.chatsync.model.MessageRole;
import com.example.chatsync.protocol.Envelope;
import com.example.chatsync.repo.ChatMessageRepo;
import com.example.chatsync.repo.ChatSessionRepo;
import com.example.chatsync.store.BatchAppendResult;
import com.example.chatsync.store.NewMessage;
import com.example.chatsync.store.SessionStore;
import com.example.chatsync.store.StorageUnavailableException;
import com.example.chatsync.store.ValidationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.*;
import java.util.function.Supplier;
import java.util.regex.Pattern;

@Service
public class ChatHistoryService implements SessionStore {

    private static final Logger logger = LoggerFactory.getLogger(ChatHistoryService.class);

    private static final Pattern SESSION_ID = Pattern.compile("^[A-Za-z0-9][A-Za-z0-9_-]{0,127}$");

    private final ChatMessageRepo messageRepo;
    private final ChatSessionRepo sessionRepo;
    private final SessionLockRegistry locks;
    private final Clock clock;

    @Value("${app.store.max-message-page:500}")
    private int maxMessagePage = 500;

    @Value("${app.store.default-message-page:200}")
    private int defaultMessagePage = 200;

    @Value("${app.store.max-session-page:100}")
    private int maxSessionPage = 100;

    @Value("${app.store.default-session-page:20}")
    private int defaultSessionPage = 20;

    @Autowired
    public ChatHistoryService(ChatMessageRepo messageRepo, ChatSessionRepo sessionRepo, SessionLockRegistry locks) {
        this(messageRepo, sessionRepo, locks, Clock.systemUTC());
    }

    public ChatHistoryService(ChatMessageRepo messageRepo, ChatSessionRepo sessionRepo,
                              SessionLockRegistry locks, Clock clock) {
        this.messageRepo = messageRepo;
        this.sessionRepo = sessionRepo;
        this.locks = locks;
        this.clock = clock;
    }

    @Override
    public ChatSession createOrUpdateSession(String sessionId, String name, String userId) {
        requireSessionId(sessionId);
        return locks.withLock(sessionId, () -> storage("update session " + sessionId, () -> {
            ChatSession session = sessionRepo.findById(sessionId)
                    .orElseGet(() -> ChatSession.create(sessionId, name, userId, clock.instant()));
            if (name != null) session.setName(name);
            if (userId != null) session.setUserId(userId);
            session.setActive(true);
            ChatSession saved = sessionRepo.save(session);
            logger.debug("Session {} upserted", sessionId);
            return saved;
        }));
    }

    @Override
    public Optional<ChatSession> getSession(String sessionId) {
        requireSessionId(sessionId);
        return storage("read session " + sessionId, () -> sessionRepo.findById(sessionId));
    }

    @Override
    public ChatMessage appendMessage(String sessionId, NewMessage message) {
        requireSessionId(sessionId);
        MessageRole role = MessageRole.fromValue(message.role());
        if (message.content() == null) {
            throw new ValidationException("Message content must be text");
        }
        return locks.withLock(sessionId, () -> doAppend(sessionId, role, message));
    }

    private ChatMessage doAppend(String sessionId, MessageRole role, NewMessage message) {
        String clientId = clientIdOf(message.metadata());

        ChatSession session;
        ChatMessage inserted;
        try {
            if (clientId != null) {
                Optional<ChatMessage> existing = messageRepo.findByClientId(sessionId, clientId);
                if (existing.isPresent()) {
                    logger.info("Duplicate append for session {} clientId {}, returning message {}",
                            sessionId, clientId, existing.get().getId());
                    return existing.get();
                }
            }

            Instant now = clock.instant();
            session = sessionRepo.findById(sessionId)
                    .orElseGet(() -> ChatSession.create(sessionId, null, message.userId(), now));

            Optional<ChatMessage> latest = messageRepo.findLatest(sessionId);
            Instant timestamp = latest.map(ChatMessage::getTimestamp)
                    .filter(last -> last.isAfter(now))
                    .orElse(now);
            long seq = latest.map(m -> m.getSeq() + 1).orElse(1L);

            ChatMessage candidate = ChatMessage.builder()
                    .id(UUID.randomUUID().toString())
                    .sessionId(sessionId)
                    .role(role)
                    .content(message.content())
                    .agentName(message.agentName())
                    .userId(message.userId())
                    .timestamp(timestamp)
                    .seq(seq)
                    .clientId(clientId)
                    .metadata(message.metadata() == null ? null : new LinkedHashMap<>(message.metadata()))
                    .build();
            inserted = messageRepo.insert(candidate);
        } catch (DataAccessException e) {
            logger.error("Failed to persist message for session {}", sessionId, e);
            throw new StorageUnavailableException("Message store unavailable", e);
        }

        try {
            session.recordMessage(inserted);
            sessionRepo.save(session);
        } catch (RuntimeException e) {
            logger.error("Session metadata update failed for {}, rolling back message {}",
                    sessionId, inserted.getId(), e);
            rollback(inserted);
            throw new StorageUnavailableException("Session metadata update failed", e);
        }

        logger.debug("Appended {} message {} (seq {}) to session {}",
                role.getValue(), inserted.getId(), inserted.getSeq(), sessionId);
        return inserted;
    }

    private void rollback(ChatMessage inserted) {
        try {
            messageRepo.deleteById(inserted.getId());
        } catch (RuntimeException e) {
            logger.error("Rollback of message {} failed; it is orphaned in session {}",
                    inserted.getId(), inserted.getSessionId(), e);
        }
    }

    @Override
    public BatchAppendResult appendMessages(String sessionId, List<NewMessage> messages) {
        requireSessionId(sessionId);
        if (messages == null || messages.isEmpty()) {
            throw new ValidationException("Batch must contain at least one message");
        }

        List<String> ids = new ArrayList<>();
        Map<Integer, String> failures = new LinkedHashMap<>();
        RuntimeException lastError = null;
        boolean onlyValidationErrors = true;

        for (int i = 0; i < messages.size(); i++) {
            try {
                ids.add(appendMessage(sessionId, messages.get(i)).getId());
            } catch (ValidationException e) {
                failures.put(i, e.getMessage());
                lastError = e;
            } catch (StorageUnavailableException e) {
                failures.put(i, e.getMessage());
                lastError = e;
                onlyValidationErrors = false;
            }
        }

        if (ids.isEmpty()) {
            logger.warn("Batch append for session {} persisted nothing ({} failures)", sessionId, failures.size());
            if (onlyValidationErrors) {
                throw new ValidationException("No message in batch could be persisted: " + lastError.getMessage());
            }
            throw new StorageUnavailableException("No message in batch could be persisted", lastError);
        }
        if (!failures.isEmpty()) {
            logger.warn("Batch append for session {} partially failed: {}", sessionId, failures);
        }
        return new BatchAppendResult(ids, failures);
    }

    @Override
    public List<ChatMessage> listMessages(String sessionId, Integer limit, Integer offset) {
        requireSessionId(sessionId);
        int lim = clamp(limit, defaultMessagePage, maxMessagePage);
        int off = requireOffset(offset);
        return locks.withLock(sessionId,
                () -> storage("list messages of " + sessionId, () -> messageRepo.findPage(sessionId, off, lim)));
    }

    @Override
    public List<ChatMessage> listRecentMessages(String sessionId, Integer limit) {
        requireSessionId(sessionId);
        int lim = clamp(limit, defaultMessagePage, maxMessagePage);
        return locks.withLock(sessionId,
                () -> storage("list recent messages of " + sessionId, () -> messageRepo.findRecent(sessionId, lim)));
    }

    @Override
    public Optional<List<ChatMessage>> listMessagesAfter(String sessionId, String messageId) {
        requireSessionId(sessionId);
        if (messageId == null || messageId.isBlank()) {
            return Optional.empty();
        }
        // reads share the append lock so a rolled-back insert is never observed
        return locks.withLock(sessionId, () -> storage("list messages after " + messageId,
                () -> messageRepo.findById(messageId)
                        .filter(anchor -> sessionId.equals(anchor.getSessionId()))
                        .map(anchor -> messageRepo.findAfter(sessionId, anchor.getSeq()))));
    }

    @Override
    public List<ChatSession> listSessions(String userId, Integer limit, Integer offset) {
        int lim = clamp(limit, defaultSessionPage, maxSessionPage);
        int off = requireOffset(offset);
        return storage("list sessions", () -> sessionRepo.findActive(userId, off, lim));
    }

    @Override
    public long getMessageCount(String sessionId) {
        requireSessionId(sessionId);
        return locks.withLock(sessionId,
                () -> storage("count messages of " + sessionId, () -> messageRepo.countBySessionId(sessionId)));
    }

    @Override
    public boolean softDeleteSession(String sessionId) {
        requireSessionId(sessionId);
        return locks.withLock(sessionId, () -> storage("delete session " + sessionId, () -> {
            Optional<ChatSession> session = sessionRepo.findById(sessionId);
            session.ifPresent(s -> {
                s.setActive(false);
                sessionRepo.save(s);
                logger.info("Session {} soft-deleted", sessionId);
            });
            return session.isPresent();
        }));
    }

    @Override
    public long resetSessionMessages(String sessionId) {
        requireSessionId(sessionId);
        return locks.withLock(sessionId, () -> storage("reset session " + sessionId, () -> {
            long removed = messageRepo.deleteBySessionId(sessionId);
            sessionRepo.findById(sessionId).ifPresent(s -> {
                s.resetPreview();
                sessionRepo.save(s);
            });
            logger.info("Session {} reset, {} messages purged", sessionId, removed);
            return removed;
        }));
    }

    public static boolean isValidSessionId(String sessionId) {
        return sessionId != null && SESSION_ID.matcher(sessionId).matches();
    }

    private static void requireSessionId(String sessionId) {
        if (!isValidSessionId(sessionId)) {
            throw new ValidationException("Malformed session id: " + sessionId);
        }
    }

    private static int requireOffset(Integer offset) {
        if (offset == null) return 0;
        if (offset < 0) throw new ValidationException("Offset must be >= 0, got " + offset);
        return offset;
    }

    private static int clamp(Integer requested, int defaultValue, int max) {
        if (requested == null || requested <= 0) return defaultValue;
        return Math.min(requested, max);
    }

    private static String clientIdOf(Map<String, Object> metadata) {
        if (metadata == null) return null;
        Object value = metadata.get(Envelope.CLIENT_ID_KEY);
        return value == null ? null : value.toString();
    }

    private static <T> T storage(String operation, Supplier<T> call) {
        try {
            return call.get();
        } catch (DataAccessException e) {
            logger.error("Storage failure during {}", operation, e);
            throw new StorageUnavailableException("Storage unavailable during " + operation, e);
        }
    }
}
