package com.example.chatsync.client;

import java.util.*;

/**
 * Reconciles the local cache with a server snapshot.
 * <p>
 * Local entries go in first, then remote ones; a remote entry replaces any
 * local entry with the same id, and also the pending entry whose provisional
 * id it carries as {@code metadata.client_id}. Entries without an id are kept
 * as they are. The result is sorted by timestamp, stable on ties.
 */
public final class MessageMerger {

    private MessageMerger() {
    }

    public static List<CachedMessage> merge(List<CachedMessage> local, List<CachedMessage> remote) {
        Map<Object, CachedMessage> byId = new LinkedHashMap<>();

        for (CachedMessage message : local) {
            byId.put(keyOf(message), message);
        }
        for (CachedMessage message : remote) {
            String clientId = message.getClientId();
            if (message.getId() != null && clientId != null && !clientId.equals(message.getId())) {
                CachedMessage provisional = byId.get(clientId);
                if (provisional != null && !provisional.isConfirmed()) {
                    byId.remove(clientId);
                }
            }
            byId.put(keyOf(message), message);
        }

        List<CachedMessage> merged = new ArrayList<>(byId.values());
        merged.sort(Comparator.comparingLong(MessageMerger::timestampOf));
        return merged;
    }

    private static Object keyOf(CachedMessage message) {
        // id-less entries are unique by identity
        return message.getId() != null ? message.getId() : new Object();
    }

    private static long timestampOf(CachedMessage message) {
        return message.getTimestamp() == null ? 0L : message.getTimestamp();
    }
}
