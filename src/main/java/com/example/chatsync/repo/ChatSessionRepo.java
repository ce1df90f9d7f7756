package com.example.chatsync.repo;

import com.example.chatsync.model.ChatSession;

import java.util.List;
import java.util.Optional;

public interface ChatSessionRepo {
    Optional<ChatSession> findById(String sessionId);
    ChatSession save(ChatSession session);
    // active sessions only, newest activity first
    List<ChatSession> findActive(String userId, int offset, int limit);
}
