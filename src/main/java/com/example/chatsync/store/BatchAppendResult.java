package com.example.chatsync.store;

import java.util.List;
import java.util.Map;

/**
 * Outcome of a batch append. {@code messageIds} holds the ids of the items that
 * were persisted, in input order; {@code failures} maps input index to reason.
 */
public record BatchAppendResult(List<String> messageIds, Map<Integer, String> failures) {

    public int count() {
        return messageIds.size();
    }
}
