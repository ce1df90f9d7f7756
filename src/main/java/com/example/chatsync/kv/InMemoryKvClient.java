package com.example.chatsync.kv;

import java.util.*;

/**
 * Process-lifetime tier: the fallback when the durable tier is full. An optional
 * capacity (total characters of stored values) makes it reject writes like a
 * full durable store would.
 */
public class InMemoryKvClient implements KvClient {

    private final Map<String, String> entries = new LinkedHashMap<>();
    private final long capacityChars;
    private long usedChars;

    public InMemoryKvClient() {
        this(Long.MAX_VALUE);
    }

    public InMemoryKvClient(long capacityChars) {
        this.capacityChars = capacityChars;
    }

    @Override
    public synchronized Optional<String> get(String key) {
        return Optional.ofNullable(entries.get(key));
    }

    @Override
    public synchronized Map<String, String> mget(List<String> keys) {
        Map<String, String> result = new LinkedHashMap<>();
        for (String key : keys) {
            result.put(key, entries.get(key));
        }
        return result;
    }

    @Override
    public synchronized void set(String key, String value) {
        String previous = entries.get(key);
        long projected = usedChars - (previous == null ? 0 : previous.length()) + value.length();
        if (projected > capacityChars) {
            throw new QuotaExceededException("In-memory store full: " + projected + " > " + capacityChars);
        }
        entries.put(key, value);
        usedChars = projected;
    }

    @Override
    public synchronized void del(String key) {
        String removed = entries.remove(key);
        if (removed != null) usedChars -= removed.length();
    }

    @Override
    public synchronized List<String> scan(String prefix, int limit) {
        List<String> keys = new ArrayList<>();
        for (String key : entries.keySet()) {
            if (keys.size() >= limit) break;
            if (key.startsWith(prefix)) keys.add(key);
        }
        return keys;
    }

    public synchronized long usedChars() {
        return usedChars;
    }
}
