package com.example.chatsync.client;

public interface TransportListener {
    void onOpen();

    void onFrame(String frame);

    /**
     * Channel ended without {@link TransportHandle#close()} being called.
     *
     * @param error the failure, or null on a clean close by the server
     */
    void onClosed(Throwable error);
}
