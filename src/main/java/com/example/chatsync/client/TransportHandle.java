package com.example.chatsync.client;

public interface TransportHandle {
    /**
     * @return false if the frame could not be queued on the channel
     */
    boolean send(String frame);

    /**
     * Closes the channel. The listener receives no further callbacks.
     */
    void close();
}
