package com.example.chatsync.controller;

import com.example.chatsync.ws.ChannelRegistry;
import org.bson.Document;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.HashMap;
import java.util.Map;

@RestController
public class HealthController {

    private final MongoTemplate mongoTemplate;
    private final ChannelRegistry channels;

    public HealthController(MongoTemplate mongoTemplate, ChannelRegistry channels) {
        this.mongoTemplate = mongoTemplate;
        this.channels = channels;
    }

    @GetMapping("/health")
    public Mono<ResponseEntity<Map<String, Object>>> health() {
        return Mono.fromCallable(this::check).subscribeOn(Schedulers.boundedElastic());
    }

    private ResponseEntity<Map<String, Object>> check() {
        Map<String, Object> health = new HashMap<>();
        health.put("service", "chat-session-sync");
        health.put("channels", channels.size());

        boolean up;
        try {
            mongoTemplate.executeCommand(new Document("ping", 1));
            health.put("mongodb", "UP");
            up = true;
        } catch (Exception e) {
            health.put("mongodb", "DOWN");
            health.put("mongodbError", e.getMessage());
            up = false;
        }
        health.put("status", up ? "UP" : "DOWN");
        return ResponseEntity.status(up ? HttpStatus.OK : HttpStatus.SERVICE_UNAVAILABLE).body(health);
    }
}
