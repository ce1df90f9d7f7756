package com.example.chatsync.client;

public enum SyncState {
    /** Created locally, no server id yet. */
    PENDING,
    /** Carries a server-assigned id. */
    CONFIRMED
}
