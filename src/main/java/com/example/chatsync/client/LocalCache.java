package com.example.chatsync.client;

import com.example.chatsync.kv.KvClient;
import com.example.chatsync.kv.QuotaExceededException;
import com.example.chatsync.model.MessageRole;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.Disposable;
import reactor.core.scheduler.Scheduler;

import java.util.*;
import java.util.concurrent.TimeUnit;

/**
 * Bounded per-session message cache with debounced write-behind.
 * <p>
 * Every session keeps at most {@code cacheCapacity} messages in memory, oldest
 * dropped first. Changes are written to the durable tier once per debounce
 * window. When the durable tier is full the largest cached sessions are evicted
 * and the write retried once; if it still fails the cache switches to the
 * fallback tier for the rest of the process lifetime.
 */
public class LocalCache implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(LocalCache.class);

    private static final TypeReference<List<Object>> RECORDS = new TypeReference<>() {};
    private static final int SCAN_LIMIT = 1000;

    private final KvClient durable;
    private final KvClient fallback;
    private final ObjectMapper objectMapper;
    private final Scheduler scheduler;

    private final int capacity;
    private final long debounceMs;
    private final int evictionBatch;
    private final String prefix;

    private final Map<String, List<CachedMessage>> sessions = new HashMap<>();
    private final Set<String> dirty = new LinkedHashSet<>();
    private Disposable scheduledFlush;
    private boolean downgraded;
    private boolean closed;

    public LocalCache(KvClient durable, KvClient fallback, ObjectMapper objectMapper,
                      Scheduler scheduler, SyncClientProperties props) {
        this.durable = durable;
        this.fallback = fallback;
        this.objectMapper = objectMapper;
        this.scheduler = scheduler;
        this.capacity = props.getCacheCapacity();
        this.debounceMs = props.getWriteDebounceMs();
        this.evictionBatch = props.getEvictionBatch();
        this.prefix = props.getStoragePrefix();
    }

    public synchronized List<CachedMessage> getMessages(String sessionId) {
        return List.copyOf(load(sessionId));
    }

    public synchronized List<CachedMessage> append(String sessionId, CachedMessage message) {
        List<CachedMessage> messages = new ArrayList<>(load(sessionId));
        messages.add(message);
        return store(sessionId, messages);
    }

    /**
     * Merges server messages into the session and replaces the cached list in one step.
     */
    public synchronized List<CachedMessage> mergeRemote(String sessionId, List<CachedMessage> remote) {
        return store(sessionId, MessageMerger.merge(load(sessionId), remote));
    }

    public synchronized List<CachedMessage> replaceAll(String sessionId, List<CachedMessage> messages) {
        return store(sessionId, new ArrayList<>(messages));
    }

    public synchronized Optional<CachedMessage> latestConfirmed(String sessionId) {
        List<CachedMessage> messages = load(sessionId);
        for (int i = messages.size() - 1; i >= 0; i--) {
            CachedMessage message = messages.get(i);
            if (message.isConfirmed() && message.getId() != null) {
                return Optional.of(message);
            }
        }
        return Optional.empty();
    }

    public synchronized List<CachedMessage> pending(String sessionId) {
        List<CachedMessage> result = new ArrayList<>();
        for (CachedMessage message : load(sessionId)) {
            if (!message.isConfirmed()) result.add(message);
        }
        return result;
    }

    /**
     * Drops the session from memory and from whichever tier is active.
     */
    public synchronized void reset(String sessionId) {
        sessions.remove(sessionId);
        dirty.remove(sessionId);
        try {
            activeTier().del(keyOf(sessionId));
        } catch (RuntimeException e) {
            logger.warn("Failed to clear cached session {}: {}", sessionId, e.toString());
        }
        logger.info("Local cache for session {} reset", sessionId);
    }

    public synchronized void flush() {
        if (scheduledFlush != null) {
            scheduledFlush.dispose();
            scheduledFlush = null;
        }
        for (String sessionId : dirty) {
            write(sessionId);
        }
        dirty.clear();
    }

    public synchronized boolean isDowngraded() {
        return downgraded;
    }

    @Override
    public synchronized void close() {
        flush();
        closed = true;
    }

    private List<CachedMessage> load(String sessionId) {
        List<CachedMessage> messages = sessions.get(sessionId);
        if (messages == null) {
            messages = read(sessionId);
            sessions.put(sessionId, messages);
        }
        return messages;
    }

    private List<CachedMessage> store(String sessionId, List<CachedMessage> messages) {
        if (messages.size() > capacity) {
            messages.subList(0, messages.size() - capacity).clear();
        }
        sessions.put(sessionId, messages);
        markDirty(sessionId);
        return List.copyOf(messages);
    }

    private void markDirty(String sessionId) {
        dirty.add(sessionId);
        if (closed) {
            flush();
            return;
        }
        if (scheduledFlush == null) {
            scheduledFlush = scheduler.schedule(this::flush, debounceMs, TimeUnit.MILLISECONDS);
        }
    }

    private List<CachedMessage> read(String sessionId) {
        Optional<String> raw;
        try {
            raw = activeTier().get(keyOf(sessionId));
        } catch (RuntimeException e) {
            logger.warn("Cache read failed for session {}, starting empty: {}", sessionId, e.toString());
            return new ArrayList<>();
        }
        if (raw.isEmpty()) return new ArrayList<>();

        List<Object> records;
        try {
            records = objectMapper.readValue(raw.get(), RECORDS);
        } catch (JsonProcessingException e) {
            logger.warn("Discarding unreadable cache entry for session {}: {}", sessionId, e.getOriginalMessage());
            return new ArrayList<>();
        }
        if (records == null) return new ArrayList<>();

        List<CachedMessage> messages = new ArrayList<>();
        int discarded = 0;
        for (Object record : records) {
            CachedMessage message = toMessage(record);
            if (message == null) {
                discarded++;
            } else {
                messages.add(message);
            }
        }
        if (discarded > 0) {
            logger.warn("Discarded {} malformed cached messages of session {}", discarded, sessionId);
        }
        if (messages.size() > capacity) {
            messages.subList(0, messages.size() - capacity).clear();
        }
        return messages;
    }

    private CachedMessage toMessage(Object element) {
        if (!(element instanceof Map)) return null;
        Map<?, ?> record = (Map<?, ?>) element;
        Object role = record.get("role");
        if (!(role instanceof String) || !MessageRole.isValid((String) role)) return null;
        if (!(record.get("content") instanceof String)) return null;
        try {
            CachedMessage message = objectMapper.convertValue(record, CachedMessage.class);
            if (message.getSyncState() == null) {
                message.setSyncState(message.getId() != null ? SyncState.CONFIRMED : SyncState.PENDING);
            }
            return message;
        } catch (IllegalArgumentException e) {
            return null;
        }
    }

    private void write(String sessionId) {
        List<CachedMessage> messages = sessions.get(sessionId);
        if (messages == null) return;

        String json;
        try {
            json = objectMapper.writeValueAsString(messages);
        } catch (JsonProcessingException e) {
            logger.error("Failed to serialize cache of session {}", sessionId, e);
            return;
        }
        String key = keyOf(sessionId);

        if (!downgraded) {
            try {
                durable.set(key, json);
                return;
            } catch (QuotaExceededException e) {
                logger.warn("Durable cache full writing session {}, evicting {} largest sessions",
                        sessionId, evictionBatch);
            } catch (RuntimeException e) {
                logger.warn("Durable cache write failed for session {}: {}", sessionId, e.toString());
                return;
            }

            evictLargest();
            try {
                durable.set(key, json);
                return;
            } catch (QuotaExceededException e) {
                logger.warn("Durable cache still full after eviction, switching to in-memory storage");
                downgraded = true;
            } catch (RuntimeException e) {
                logger.warn("Durable cache write failed for session {}: {}", sessionId, e.toString());
                return;
            }
        }

        try {
            fallback.set(key, json);
        } catch (RuntimeException e) {
            logger.error("Fallback cache write failed for session {}", sessionId, e);
        }
    }

    // the session being written is ranked too; its in-memory copy is rewritten right after
    private void evictLargest() {
        try {
            List<String> keys = durable.scan(prefix, SCAN_LIMIT);
            Map<String, String> values = durable.mget(keys);
            List<Map.Entry<String, String>> bySize = new ArrayList<>();
            for (Map.Entry<String, String> entry : values.entrySet()) {
                if (entry.getValue() != null) bySize.add(entry);
            }
            bySize.sort((a, b) -> Integer.compare(b.getValue().length(), a.getValue().length()));
            for (Map.Entry<String, String> entry : bySize.subList(0, Math.min(evictionBatch, bySize.size()))) {
                durable.del(entry.getKey());
                logger.info("Evicted cached session {} ({} chars)", entry.getKey(), entry.getValue().length());
            }
        } catch (RuntimeException e) {
            logger.warn("Cache eviction failed: {}", e.toString());
        }
    }

    private KvClient activeTier() {
        return downgraded ? fallback : durable;
    }

    private String keyOf(String sessionId) {
        return prefix + sessionId;
    }
}
