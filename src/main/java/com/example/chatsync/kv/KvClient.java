package com.example.chatsync.kv;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * String key/value storage backing the client message cache.
 * {@link #set} throws {@link QuotaExceededException} when the store is full.
 */
public interface KvClient {
    Optional<String> get(String key);
    Map<String, String> mget(List<String> keys);
    void set(String key, String value);
    void del(String key);
    List<String> scan(String prefix, int limit);
}
