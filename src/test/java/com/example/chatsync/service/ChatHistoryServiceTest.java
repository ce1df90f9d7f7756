package com.example.chatsync.service;

import com.example.chatsync.model.ChatMessage;
import com.example.chatsync.model.ChatSession;
import com.example.chatsync.model.MessageRole;
import com.example.chatsync.protocol.Envelope;
import com.example.chatsync.store.BatchAppendResult;
import com.example.chatsync.store.NewMessage;
import com.example.chatsync.store.StorageUnavailableException;
import com.example.chatsync.store.ValidationException;
import com.example.chatsync.support.InMemoryChatMessageRepo;
import com.example.chatsync.support.InMemoryChatSessionRepo;
import com.example.chatsync.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.test.util.ReflectionTestUtils;

import java.time.Duration;
import java.time.Instant;
import java.util.*;
import java.util.concurrent.*;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class ChatHistoryServiceTest {

    private static final Instant START = Instant.parse("2024-05-01T10:00:00Z");

    private InMemoryChatMessageRepo messageRepo;
    private InMemoryChatSessionRepo sessionRepo;
    private SessionLockRegistry locks;
    private MutableClock clock;
    private ChatHistoryService service;

    @BeforeEach
    void setUp() {
        messageRepo = new InMemoryChatMessageRepo();
        sessionRepo = new InMemoryChatSessionRepo();
        locks = new SessionLockRegistry();
        clock = new MutableClock(START);
        service = new ChatHistoryService(messageRepo, sessionRepo, locks, clock);
    }

    @Test
    void testAppendMessage_UpdatesCountAndPreview() {
        // Given
        service.createOrUpdateSession("s1", "Test", null);

        // When
        ChatMessage saved = service.appendMessage("s1", NewMessage.of("user", "hello"));

        // Then
        assertNotNull(saved.getId());
        assertEquals(1, service.getMessageCount("s1"));
        ChatSession session = service.getSession("s1").orElseThrow();
        assertEquals("hello", session.getPreview());
        assertEquals(START, session.getLastMessageAt());

        List<ChatMessage> messages = service.listMessages("s1", null, null);
        assertEquals(1, messages.size());
        assertEquals(MessageRole.USER, messages.get(0).getRole());
        assertEquals("hello", messages.get(0).getContent());
    }

    @Test
    void testAppendMessage_SystemMessageLeavesPreview() {
        // Given
        service.appendMessage("s1", NewMessage.of("assistant", "hi there"));
        clock.advance(Duration.ofSeconds(5));

        // When
        service.appendMessage("s1", NewMessage.of("system", "context reset"));

        // Then
        ChatSession session = service.getSession("s1").orElseThrow();
        assertEquals("hi there", session.getPreview());
        assertEquals(START, session.getLastMessageAt());
        assertEquals(2, service.getMessageCount("s1"));
    }

    @Test
    void testAppendMessage_UnknownSessionIsCreated() {
        // When
        service.appendMessage("fresh", new NewMessage("user", "first", null, "u1", null));

        // Then
        ChatSession session = service.getSession("fresh").orElseThrow();
        assertTrue(session.isActive());
        assertEquals("u1", session.getUserId());
        assertTrue(session.getName().startsWith("Session "));
    }

    @Test
    void testAppendMessage_SessionUpdateFailureRollsBackInsert() {
        // Given
        service.createOrUpdateSession("s1", null, null);
        service.appendMessage("s1", NewMessage.of("user", "kept"));
        sessionRepo.setFailingSaves(true);

        // When
        assertThrows(StorageUnavailableException.class,
                () -> service.appendMessage("s1", NewMessage.of("user", "lost")));

        // Then
        sessionRepo.setFailingSaves(false);
        List<String> contents = service.listMessages("s1", null, null).stream()
                .map(ChatMessage::getContent)
                .collect(Collectors.toList());
        assertEquals(List.of("kept"), contents);
        assertEquals("kept", service.getSession("s1").orElseThrow().getPreview());
    }

    @Test
    void testListMessagesAfter_WaitsForInFlightAppendThatRollsBack() throws Exception {
        // Given
        CountDownLatch saveEntered = new CountDownLatch(1);
        CountDownLatch releaseSave = new CountDownLatch(1);
        InMemoryChatSessionRepo stallingRepo = new InMemoryChatSessionRepo() {
            private volatile boolean armed;

            @Override
            public ChatSession save(ChatSession session) {
                if (armed) {
                    saveEntered.countDown();
                    try {
                        releaseSave.await(5, TimeUnit.SECONDS);
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                    }
                    throw new DataAccessResourceFailureException("session store down");
                }
                if (session.getPreview() != null && session.getPreview().equals("first")) {
                    armed = true;
                }
                return super.save(session);
            }
        };
        service = new ChatHistoryService(messageRepo, stallingRepo, locks, clock);
        ChatMessage first = service.appendMessage("s1", NewMessage.of("user", "first"));

        ExecutorService pool = Executors.newFixedThreadPool(2);
        try {
            Future<?> writer = pool.submit(() -> service.appendMessage("s1", NewMessage.of("user", "doomed")));
            assertTrue(saveEntered.await(5, TimeUnit.SECONDS));

            // When
            Future<Optional<List<ChatMessage>>> reader =
                    pool.submit(() -> service.listMessagesAfter("s1", first.getId()));
            Thread.sleep(100);
            assertFalse(reader.isDone());
            releaseSave.countDown();

            // Then
            ExecutionException failure = assertThrows(ExecutionException.class, () -> writer.get(5, TimeUnit.SECONDS));
            assertInstanceOf(StorageUnavailableException.class, failure.getCause());
            assertEquals(Optional.of(List.of()), reader.get(5, TimeUnit.SECONDS));
            assertEquals(List.of("first"), service.listMessages("s1", null, null).stream()
                    .map(ChatMessage::getContent)
                    .collect(Collectors.toList()));
        } finally {
            releaseSave.countDown();
            pool.shutdownNow();
        }
    }

    @Test
    void testAppendMessage_BackendDownIsStorageUnavailable() {
        // Given
        messageRepo.setFailing(true);

        // When / Then
        assertThrows(StorageUnavailableException.class,
                () -> service.appendMessage("s1", NewMessage.of("user", "x")));
        assertThrows(StorageUnavailableException.class, () -> service.listMessages("s1", null, null));
    }

    @Test
    void testAppendMessage_ValidationErrors() {
        assertThrows(ValidationException.class, () -> service.appendMessage("s1", NewMessage.of("robot", "x")));
        assertThrows(ValidationException.class, () -> service.appendMessage("bad id!", NewMessage.of("user", "x")));
        assertThrows(ValidationException.class, () -> service.appendMessage("s1", NewMessage.of("user", null)));
        assertThrows(ValidationException.class, () -> service.appendMessage(null, NewMessage.of("user", "x")));
        assertEquals(0, messageRepo.size());
    }

    @Test
    void testAppendMessage_RoleIsNormalized() {
        ChatMessage saved = service.appendMessage("s1", NewMessage.of(" Assistant ", "ok"));
        assertEquals(MessageRole.ASSISTANT, saved.getRole());
    }

    @Test
    void testAppendMessage_TimestampsNeverGoBackwards() {
        // Given
        service.appendMessage("s1", NewMessage.of("user", "one"));

        // When
        clock.set(START.minusSeconds(60));
        ChatMessage second = service.appendMessage("s1", NewMessage.of("user", "two"));

        // Then
        assertEquals(START, second.getTimestamp());
        List<String> contents = service.listMessages("s1", null, null).stream()
                .map(ChatMessage::getContent).collect(Collectors.toList());
        assertEquals(List.of("one", "two"), contents);
    }

    @Test
    void testAppendMessage_DuplicateClientIdReturnsExisting() {
        // Given
        Map<String, Object> metadata = Map.of(Envelope.CLIENT_ID_KEY, "c-1");
        ChatMessage first = service.appendMessage("s1", new NewMessage("user", "hi", null, null, metadata));

        // When
        ChatMessage retry = service.appendMessage("s1", new NewMessage("user", "hi", null, null, metadata));

        // Then
        assertEquals(first.getId(), retry.getId());
        assertEquals(1, service.getMessageCount("s1"));
        assertEquals("c-1", first.getClientId());
    }

    @Test
    void testAppendMessage_ConcurrentAppendsSerializePerSession() throws Exception {
        // Given
        int threads = 8;
        int perThread = 25;
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<?>> futures = new ArrayList<>();

        // When
        for (int t = 0; t < threads; t++) {
            int worker = t;
            futures.add(pool.submit(() -> {
                start.await();
                for (int i = 0; i < perThread; i++) {
                    service.appendMessage("busy", NewMessage.of("user", worker + "-" + i));
                }
                return null;
            }));
        }
        start.countDown();
        for (Future<?> f : futures) {
            f.get(30, TimeUnit.SECONDS);
        }
        pool.shutdown();

        // Then
        List<ChatMessage> all = service.listMessages("busy", 500, 0);
        assertEquals(threads * perThread, all.size());
        Set<Long> seqs = all.stream().map(ChatMessage::getSeq).collect(Collectors.toSet());
        assertEquals(threads * perThread, seqs.size());
        for (int i = 1; i < all.size(); i++) {
            assertTrue(all.get(i).getSeq() > all.get(i - 1).getSeq());
        }
        assertEquals(0, locks.size());
    }

    @Test
    void testListMessages_LimitIsClampedAndOffsetApplied() {
        // Given
        ReflectionTestUtils.setField(service, "maxMessagePage", 3);
        for (int i = 0; i < 5; i++) {
            service.appendMessage("s1", NewMessage.of("user", "m" + i));
            clock.advance(Duration.ofSeconds(1));
        }

        // When
        List<ChatMessage> clamped = service.listMessages("s1", 1000, 0);
        List<ChatMessage> page = service.listMessages("s1", 2, 3);

        // Then
        assertEquals(3, clamped.size());
        assertEquals(List.of("m3", "m4"), page.stream().map(ChatMessage::getContent).collect(Collectors.toList()));
        assertThrows(ValidationException.class, () -> service.listMessages("s1", 10, -1));
    }

    @Test
    void testListRecentMessages_ReturnsNewestAscending() {
        for (int i = 0; i < 5; i++) {
            service.appendMessage("s1", NewMessage.of("user", "m" + i));
        }

        List<ChatMessage> recent = service.listRecentMessages("s1", 2);

        assertEquals(List.of("m3", "m4"), recent.stream().map(ChatMessage::getContent).collect(Collectors.toList()));
    }

    @Test
    void testListMessagesAfter_KnownAndUnknownAnchors() {
        // Given
        ChatMessage first = service.appendMessage("s1", NewMessage.of("user", "a"));
        service.appendMessage("s1", NewMessage.of("assistant", "b"));
        ChatMessage other = service.appendMessage("s2", NewMessage.of("user", "elsewhere"));

        // When
        Optional<List<ChatMessage>> after = service.listMessagesAfter("s1", first.getId());

        // Then
        assertTrue(after.isPresent());
        assertEquals(List.of("b"), after.get().stream().map(ChatMessage::getContent).collect(Collectors.toList()));
        assertTrue(service.listMessagesAfter("s1", "nope").isEmpty());
        assertTrue(service.listMessagesAfter("s1", other.getId()).isEmpty());
    }

    @Test
    void testListSessions_MostRecentActivityFirst() {
        // Given
        service.appendMessage("older", NewMessage.of("user", "x"));
        clock.advance(Duration.ofMinutes(1));
        service.appendMessage("newer", NewMessage.of("user", "y"));
        clock.advance(Duration.ofMinutes(1));
        service.appendMessage("older", NewMessage.of("user", "z"));

        // When
        List<ChatSession> sessions = service.listSessions(null, null, null);

        // Then
        assertEquals(List.of("older", "newer"),
                sessions.stream().map(ChatSession::getSessionId).collect(Collectors.toList()));
    }

    @Test
    void testSoftDeleteSession_KeepsMessagesAndHidesSession() {
        // Given
        service.appendMessage("s1", NewMessage.of("user", "x"));

        // When
        boolean deleted = service.softDeleteSession("s1");

        // Then
        assertTrue(deleted);
        assertFalse(service.getSession("s1").orElseThrow().isActive());
        assertEquals(1, service.getMessageCount("s1"));
        assertTrue(service.listSessions(null, null, null).isEmpty());
        assertFalse(service.softDeleteSession("missing"));
    }

    @Test
    void testCreateOrUpdateSession_OverwritesNonNullFieldsAndReactivates() {
        // Given
        service.createOrUpdateSession("s1", "first", "u1");
        service.softDeleteSession("s1");

        // When
        ChatSession updated = service.createOrUpdateSession("s1", "renamed", null);

        // Then
        assertEquals("renamed", updated.getName());
        assertEquals("u1", updated.getUserId());
        assertTrue(service.getSession("s1").orElseThrow().isActive());
    }

    @Test
    void testResetSessionMessages_PurgesMessagesAndPreview() {
        // Given
        service.appendMessage("s1", NewMessage.of("user", "x"));
        service.appendMessage("s1", NewMessage.of("assistant", "y"));

        // When
        long removed = service.resetSessionMessages("s1");

        // Then
        assertEquals(2, removed);
        assertEquals(0, service.getMessageCount("s1"));
        assertNull(service.getSession("s1").orElseThrow().getPreview());
    }

    @Test
    void testAppendMessages_PartialFailureKeepsSuccesses() {
        // When
        BatchAppendResult result = service.appendMessages("s1", List.of(
                NewMessage.of("user", "a"),
                NewMessage.of("wizard", "b"),
                NewMessage.of("assistant", "c")));

        // Then
        assertEquals(2, result.count());
        assertEquals(Set.of(1), result.failures().keySet());
        assertEquals(2, service.getMessageCount("s1"));
    }

    @Test
    void testAppendMessages_AllInvalidFailsAsWhole() {
        assertThrows(ValidationException.class, () -> service.appendMessages("s1",
                List.of(NewMessage.of("wizard", "a"), NewMessage.of("user", null))));
        assertThrows(ValidationException.class, () -> service.appendMessages("s1", List.of()));
    }

    @Test
    void testAppendMessages_AllStorageFailuresAreStorageUnavailable() {
        messageRepo.setFailing(true);

        assertThrows(StorageUnavailableException.class, () -> service.appendMessages("s1",
                List.of(NewMessage.of("user", "a"))));
    }
}
