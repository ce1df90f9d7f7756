package com.example.chatsync.store;

import com.example.chatsync.model.ChatMessage;
import com.example.chatsync.model.ChatSession;

import java.util.List;
import java.util.Optional;

/**
 * The authoritative message log and session table.
 * <p>
 * Every method throws {@link ValidationException} for malformed input and
 * {@link StorageUnavailableException} when the backend fails.
 */
public interface SessionStore {

    /**
     * Upserts a session. Non-null arguments overwrite stored values and the
     * session is always reactivated.
     */
    ChatSession createOrUpdateSession(String sessionId, String name, String userId);

    Optional<ChatSession> getSession(String sessionId);

    /**
     * Persists one message and, in the same unit, moves the session's
     * last-message time and preview. Either both happen or neither does.
     */
    ChatMessage appendMessage(String sessionId, NewMessage message);

    /**
     * Appends in order. Fails as a whole only when no item could be persisted.
     */
    BatchAppendResult appendMessages(String sessionId, List<NewMessage> messages);

    List<ChatMessage> listMessages(String sessionId, Integer limit, Integer offset);

    /**
     * The most recent {@code limit} messages, ascending.
     */
    List<ChatMessage> listRecentMessages(String sessionId, Integer limit);

    /**
     * Messages strictly after {@code messageId}; empty when the id is not part
     * of the session's persisted sequence.
     */
    Optional<List<ChatMessage>> listMessagesAfter(String sessionId, String messageId);

    List<ChatSession> listSessions(String userId, Integer limit, Integer offset);

    long getMessageCount(String sessionId);

    boolean softDeleteSession(String sessionId);

    long resetSessionMessages(String sessionId);
}
