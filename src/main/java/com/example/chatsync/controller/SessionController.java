package com.example.chatsync.controller;

import com.example.chatsync.controller.dto.BatchMessageRequest;
import com.example.chatsync.controller.dto.MessageRequest;
import com.example.chatsync.controller.dto.SessionRequest;
import com.example.chatsync.model.ChatMessage;
import com.example.chatsync.model.ChatSession;
import com.example.chatsync.protocol.WireMessage;
import com.example.chatsync.store.BatchAppendResult;
import com.example.chatsync.store.NewMessage;
import com.example.chatsync.store.SessionStore;
import com.example.chatsync.store.ValidationException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.*;
import java.util.concurrent.Callable;

/**
 * REST access to the session store. Store calls block, so each one runs on
 * the bounded-elastic scheduler.
 */
@RestController
@RequestMapping("/api")
public class SessionController {

    private final SessionStore store;

    public SessionController(SessionStore store) {
        this.store = store;
    }

    @PostMapping("/sessions")
    public Mono<ResponseEntity<Map<String, Object>>> createSession(@RequestBody(required = false) SessionRequest request) {
        SessionRequest body = request != null ? request : new SessionRequest();
        String sessionId = body.getSessionId() != null ? body.getSessionId() : UUID.randomUUID().toString();
        return blocking(() -> store.createOrUpdateSession(sessionId, body.getName(), body.getUserId()))
                .map(session -> ResponseEntity.status(HttpStatus.CREATED).body(session.toMap()));
    }

    @PutMapping("/sessions/{sessionId}")
    public Mono<Map<String, Object>> updateSession(@PathVariable String sessionId, @RequestBody SessionRequest request) {
        return blocking(() -> store.createOrUpdateSession(sessionId, request.getName(), request.getUserId()))
                .map(ChatSession::toMap);
    }

    @GetMapping("/sessions/{sessionId}")
    public Mono<ResponseEntity<Map<String, Object>>> getSession(@PathVariable String sessionId) {
        return blocking(() -> store.getSession(sessionId))
                .map(session -> session
                        .map(s -> ResponseEntity.ok(s.toMap()))
                        .orElseGet(SessionController::notFound));
    }

    @GetMapping("/sessions")
    public Mono<Map<String, Object>> listSessions(@RequestParam(name = "user_id", required = false) String userId,
                                                  @RequestParam(required = false) Integer limit,
                                                  @RequestParam(required = false) Integer offset) {
        return blocking(() -> store.listSessions(userId, limit, offset))
                .map(sessions -> {
                    List<Map<String, Object>> items = new ArrayList<>();
                    sessions.forEach(s -> items.add(s.toMap()));
                    Map<String, Object> body = new LinkedHashMap<>();
                    body.put("sessions", items);
                    body.put("count", items.size());
                    return body;
                });
    }

    @DeleteMapping("/sessions/{sessionId}")
    public Mono<ResponseEntity<Map<String, Object>>> deleteSession(@PathVariable String sessionId) {
        return blocking(() -> store.softDeleteSession(sessionId))
                .map(found -> found
                        ? ResponseEntity.ok(Map.<String, Object>of("ok", true, "session_id", sessionId))
                        : SessionController.<Map<String, Object>>notFound());
    }

    @PostMapping("/sessions/{sessionId}/reset")
    public Mono<Map<String, Object>> resetSession(@PathVariable String sessionId) {
        return blocking(() -> store.resetSessionMessages(sessionId))
                .map(removed -> Map.of("ok", true, "session_id", sessionId, "removed", removed));
    }

    @PostMapping("/messages/{sessionId}")
    public Mono<ResponseEntity<WireMessage>> appendMessage(@PathVariable String sessionId,
                                                           @RequestBody MessageRequest request) {
        return blocking(() -> store.appendMessage(sessionId, request.toNewMessage()))
                .map(message -> ResponseEntity.status(HttpStatus.CREATED).body(message.toWire()));
    }

    @PostMapping("/messages/{sessionId}/batch")
    public Mono<ResponseEntity<Map<String, Object>>> appendBatch(@PathVariable String sessionId,
                                                                 @RequestBody BatchMessageRequest request) {
        if (request.getMessages() == null) {
            return Mono.error(new ValidationException("Batch must contain a messages array"));
        }
        List<NewMessage> messages = new ArrayList<>();
        request.getMessages().forEach(m -> messages.add(m.toNewMessage()));
        return blocking(() -> store.appendMessages(sessionId, messages))
                .map(result -> ResponseEntity.status(HttpStatus.CREATED).body(batchBody(sessionId, result)));
    }

    @GetMapping("/messages/{sessionId}")
    public Mono<Map<String, Object>> listMessages(@PathVariable String sessionId,
                                                  @RequestParam(required = false) Integer limit,
                                                  @RequestParam(required = false) Integer offset) {
        return blocking(() -> {
            List<ChatMessage> messages = store.listMessages(sessionId, limit, offset);
            long total = store.getMessageCount(sessionId);
            int start = offset == null ? 0 : offset;

            List<WireMessage> items = new ArrayList<>();
            for (ChatMessage message : messages) {
                items.add(message.toWire());
            }
            Map<String, Object> body = new LinkedHashMap<>();
            body.put("session_id", sessionId);
            body.put("messages", items);
            body.put("count", items.size());
            body.put("total", total);
            body.put("has_more", start + items.size() < total);
            return body;
        });
    }

    @GetMapping("/messages/{sessionId}/count")
    public Mono<Map<String, Object>> countMessages(@PathVariable String sessionId) {
        return blocking(() -> store.getMessageCount(sessionId))
                .map(count -> Map.of("session_id", sessionId, "count", count));
    }

    private static Map<String, Object> batchBody(String sessionId, BatchAppendResult result) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("session_id", sessionId);
        body.put("message_ids", result.messageIds());
        body.put("count", result.count());
        if (!result.failures().isEmpty()) {
            body.put("failures", result.failures());
        }
        return body;
    }

    private static <T> ResponseEntity<T> notFound() {
        return ResponseEntity.status(HttpStatus.NOT_FOUND).build();
    }

    private static <T> Mono<T> blocking(Callable<T> call) {
        return Mono.fromCallable(call).subscribeOn(Schedulers.boundedElastic());
    }
}
