package com.example.chatsync.kv;

import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.connection.RedisConnection;
import org.springframework.data.redis.core.Cursor;
import org.springframework.data.redis.core.ScanOptions;
import org.springframework.data.redis.core.StringRedisTemplate;

import java.nio.charset.StandardCharsets;
import java.util.*;

/**
 * Durable cache tier. A Redis instance at its {@code maxmemory} limit rejects
 * writes with an OOM error, which is surfaced as {@link QuotaExceededException}.
 */
public class RedisKvClient implements KvClient {

    private final StringRedisTemplate redis;

    public RedisKvClient(StringRedisTemplate redis) {
        this.redis = redis;
    }

    @Override
    public Optional<String> get(String key) {
        return Optional.ofNullable(redis.opsForValue().get(key));
    }

    @Override
    public Map<String, String> mget(List<String> keys) {
        Map<String, String> result = new LinkedHashMap<>();
        if (keys.isEmpty()) return result;
        List<String> values = redis.opsForValue().multiGet(keys);
        int i = 0;
        for (String k : keys) {
            String v = (values != null && i < values.size()) ? values.get(i) : null;
            result.put(k, v);
            i++;
        }
        return result;
    }

    @Override
    public void set(String key, String value) {
        try {
            redis.opsForValue().set(key, value);
        } catch (DataAccessException e) {
            if (isOutOfMemory(e)) {
                throw new QuotaExceededException("Redis maxmemory reached writing " + key, e);
            }
            throw e;
        }
    }

    @Override
    public void del(String key) {
        redis.delete(key);
    }

    @Override
    public List<String> scan(String prefix, int limit) {
        ScanOptions options = ScanOptions.scanOptions()
                .match(prefix + "*")
                .count(Math.max(limit, 100)).build();
        try (RedisConnection conn = Objects.requireNonNull(redis.getConnectionFactory()).getConnection()) {
            List<String> keys = new ArrayList<>();
            try (Cursor<byte[]> cursor = conn.keyCommands().scan(options)) {
                while (cursor.hasNext() && keys.size() < limit) {
                    keys.add(new String(cursor.next(), StandardCharsets.UTF_8));
                }
            }
            return keys;
        }
    }

    static boolean isOutOfMemory(Throwable error) {
        for (Throwable t = error; t != null; t = t.getCause()) {
            String message = t.getMessage();
            if (message != null && message.contains("OOM")) return true;
        }
        return false;
    }
}
