package com.example.chatsync.client;

import java.util.List;

public interface ConnectionListener {
    default void onStateChanged(ConnectionState previous, ConnectionState current) {
    }

    default void onMessagesChanged(String sessionId, List<CachedMessage> messages) {
    }
}
