package com.example.chatsync.client;

public enum ConnectionState {
    DISCONNECTED,
    CONNECTING,
    CONNECTED,
    RECONNECT_WAIT,
    /** Reconnect attempts exhausted. */
    FAILED,
    /** Closed by the user. */
    CLOSED;

    public boolean isTerminal() {
        return this == FAILED || this == CLOSED;
    }
}
