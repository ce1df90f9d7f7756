package com.example.chatsync.client;

import com.example.chatsync.kv.InMemoryKvClient;
import com.example.chatsync.kv.KvClient;
import com.example.chatsync.kv.QuotaExceededException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import reactor.test.scheduler.VirtualTimeScheduler;

import java.time.Duration;
import java.util.*;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class LocalCacheTest {

    private static final String KEY = "chat_sync:cache:s1";

    @Mock
    private KvClient durable;

    private InMemoryKvClient fallback;
    private VirtualTimeScheduler scheduler;
    private ObjectMapper objectMapper;
    private SyncClientProperties props;

    @BeforeEach
    void setUp() {
        fallback = new InMemoryKvClient();
        scheduler = VirtualTimeScheduler.create();
        objectMapper = new ObjectMapper();
        props = new SyncClientProperties();
    }

    @AfterEach
    void tearDown() {
        scheduler.dispose();
    }

    @Test
    void testAppend_NeverExceedsCapacity() {
        // Given
        props.setCacheCapacity(3);
        LocalCache cache = new LocalCache(new InMemoryKvClient(), fallback, objectMapper, scheduler, props);

        // When
        for (int i = 0; i < 5; i++) {
            List<CachedMessage> current = cache.append("s1", message("m" + i, i));
            assertTrue(current.size() <= 3);
        }

        // Then
        assertEquals(List.of("m2", "m3", "m4"), ids(cache.getMessages("s1")));
    }

    @Test
    void testAppend_WritesAreDebounced() throws Exception {
        // Given
        LocalCache cache = new LocalCache(durable, fallback, objectMapper, scheduler, props);

        // When
        cache.append("s1", message("a", 1));
        scheduler.advanceTimeBy(Duration.ofMillis(100));
        cache.append("s1", message("b", 2));
        cache.append("s1", message("c", 3));
        scheduler.advanceTimeBy(Duration.ofMillis(199));

        // Then
        verify(durable, never()).set(anyString(), anyString());

        scheduler.advanceTimeBy(Duration.ofMillis(1));
        verify(durable, times(1)).set(eq(KEY), anyString());

        // one write carries the whole list
        verify(durable).set(eq(KEY), argThat(json -> json.contains("\"a\"") && json.contains("\"c\"")));
    }

    @Test
    void testQuotaExceeded_EvictsLargestAndRetries() {
        // Given
        props.setEvictionBatch(2);
        LocalCache cache = new LocalCache(durable, fallback, objectMapper, scheduler, props);
        doThrow(new QuotaExceededException("full")).doNothing().when(durable).set(eq(KEY), anyString());
        when(durable.scan("chat_sync:cache:", 1000))
                .thenReturn(List.of("chat_sync:cache:small", "chat_sync:cache:big", "chat_sync:cache:huge", KEY));
        Map<String, String> sizes = new LinkedHashMap<>();
        sizes.put("chat_sync:cache:small", "x");
        sizes.put("chat_sync:cache:big", "x".repeat(500));
        sizes.put("chat_sync:cache:huge", "x".repeat(5000));
        sizes.put(KEY, "x".repeat(10000));
        when(durable.mget(anyList())).thenReturn(sizes);

        // When
        cache.append("s1", message("a", 1));
        cache.flush();

        // Then
        verify(durable).del(KEY);
        verify(durable).del("chat_sync:cache:huge");
        verify(durable, never()).del("chat_sync:cache:big");
        verify(durable, never()).del("chat_sync:cache:small");
        verify(durable, times(2)).set(eq(KEY), anyString());
        assertFalse(cache.isDowngraded());
        assertEquals(List.of("a"), ids(cache.getMessages("s1")));
    }

    @Test
    void testQuotaExceeded_DowngradesToFallbackTier() {
        // Given
        LocalCache cache = new LocalCache(durable, fallback, objectMapper, scheduler, props);
        doThrow(new QuotaExceededException("full")).when(durable).set(anyString(), anyString());
        when(durable.scan(anyString(), anyInt())).thenReturn(List.of());
        when(durable.mget(anyList())).thenReturn(Map.of());

        // When
        cache.append("s1", message("a", 1));
        assertDoesNotThrow(cache::flush);
        cache.append("s1", message("b", 2));
        cache.flush();

        // Then
        assertTrue(cache.isDowngraded());
        assertTrue(fallback.get(KEY).orElseThrow().contains("\"b\""));
        verify(durable, times(2)).set(eq(KEY), anyString());
    }

    @Test
    void testRead_DiscardsMalformedRecords() {
        // Given
        InMemoryKvClient stored = new InMemoryKvClient();
        stored.set(KEY, "["
                + "{\"id\":\"ok\",\"role\":\"user\",\"content\":\"fine\",\"timestamp\":1},"
                + "{\"id\":\"bad-role\",\"role\":\"robot\",\"content\":\"x\",\"timestamp\":2},"
                + "{\"id\":\"bad-content\",\"role\":\"user\",\"content\":42,\"timestamp\":3},"
                + "{\"id\":\"no-role\",\"content\":\"x\",\"timestamp\":4}"
                + "]");
        LocalCache cache = new LocalCache(stored, fallback, objectMapper, scheduler, props);

        // When
        List<CachedMessage> messages = cache.getMessages("s1");

        // Then
        assertEquals(List.of("ok"), ids(messages));
        assertTrue(messages.get(0).isConfirmed());
    }

    @Test
    void testRead_NonObjectElementsDoNotDiscardValidRecords() {
        // Given
        InMemoryKvClient stored = new InMemoryKvClient();
        stored.set(KEY, "["
                + "{\"id\":\"ok1\",\"role\":\"user\",\"content\":\"fine\",\"timestamp\":1},"
                + "42,"
                + "\"stray\","
                + "[1,2],"
                + "null,"
                + "{\"id\":\"ok2\",\"role\":\"assistant\",\"content\":\"also fine\",\"timestamp\":2}"
                + "]");
        LocalCache cache = new LocalCache(stored, fallback, objectMapper, scheduler, props);

        // When
        List<CachedMessage> messages = cache.getMessages("s1");

        // Then
        assertEquals(List.of("ok1", "ok2"), ids(messages));
    }

    @Test
    void testRead_UnparseableEntryStartsEmpty() {
        InMemoryKvClient stored = new InMemoryKvClient();
        stored.set(KEY, "{not an array");
        LocalCache cache = new LocalCache(stored, fallback, objectMapper, scheduler, props);

        assertTrue(cache.getMessages("s1").isEmpty());
    }

    @Test
    void testClose_FlushesPendingWrite() {
        // Given
        InMemoryKvClient stored = new InMemoryKvClient();
        LocalCache cache = new LocalCache(stored, fallback, objectMapper, scheduler, props);
        cache.append("s1", message("a", 1));
        assertTrue(stored.get(KEY).isEmpty());

        // When
        cache.close();

        // Then
        assertTrue(stored.get(KEY).isPresent());
        LocalCache reopened = new LocalCache(stored, fallback, objectMapper, scheduler, props);
        assertEquals(List.of("a"), ids(reopened.getMessages("s1")));
    }

    @Test
    void testMergeRemote_ReplacesListAndTracksLatestConfirmed() {
        // Given
        LocalCache cache = new LocalCache(new InMemoryKvClient(), fallback, objectMapper, scheduler, props);
        cache.append("s1", message("1", 100));
        cache.append("s1", message("2", 200));

        // When
        List<CachedMessage> merged = cache.mergeRemote("s1", List.of(message("3", 300)));

        // Then
        assertEquals(List.of("1", "2", "3"), ids(merged));
        assertEquals("3", cache.latestConfirmed("s1").orElseThrow().getId());
    }

    @Test
    void testReset_DropsMemoryAndStoredCopy() {
        InMemoryKvClient stored = new InMemoryKvClient();
        LocalCache cache = new LocalCache(stored, fallback, objectMapper, scheduler, props);
        cache.append("s1", message("a", 1));
        cache.flush();

        cache.reset("s1");

        assertTrue(cache.getMessages("s1").isEmpty());
        assertTrue(stored.get(KEY).isEmpty());
        assertTrue(cache.latestConfirmed("s1").isEmpty());
    }

    private static CachedMessage message(String id, long ts) {
        return CachedMessage.builder().id(id).sessionId("s1").role("user").content("content " + id)
                .timestamp(ts).syncState(SyncState.CONFIRMED).build();
    }

    private static List<String> ids(List<CachedMessage> messages) {
        return messages.stream().map(CachedMessage::getId).collect(Collectors.toList());
    }
}
