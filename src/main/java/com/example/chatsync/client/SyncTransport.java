package com.example.chatsync.client;

/**
 * Opens sync channels to the gateway. One call, one channel.
 */
public interface SyncTransport {
    TransportHandle open(String sessionId, TransportListener listener);
}
