package com.example.chatsync.repo;

import com.example.chatsync.model.ChatMessage;

import java.util.List;
import java.util.Optional;

/**
 * Append-only message log. All listings are ascending by (timestamp, seq).
 */
public interface ChatMessageRepo {
    ChatMessage insert(ChatMessage message);
    Optional<ChatMessage> findById(String id);
    Optional<ChatMessage> findLatest(String sessionId);
    Optional<ChatMessage> findByClientId(String sessionId, String clientId);
    List<ChatMessage> findPage(String sessionId, int offset, int limit);
    List<ChatMessage> findRecent(String sessionId, int limit);
    List<ChatMessage> findAfter(String sessionId, long seq);
    long countBySessionId(String sessionId);
    void deleteById(String id);
    long deleteBySessionId(String sessionId);
}
