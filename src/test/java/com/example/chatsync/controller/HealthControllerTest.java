package com.example.chatsync.controller;

import com.example.chatsync.ws.ChannelRegistry;
import com.example.chatsync.ws.SyncChannel;
import org.bson.Document;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.test.web.reactive.server.WebTestClient;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class HealthControllerTest {

    @Mock
    private MongoTemplate mongoTemplate;

    @Test
    void testHealth_UpWithChannelCount() {
        // Given
        ChannelRegistry registry = new ChannelRegistry();
        registry.register(new SyncChannel("c1", "s1", 0, () -> { }));
        when(mongoTemplate.executeCommand(any(Document.class))).thenReturn(new Document("ok", 1));
        WebTestClient client = WebTestClient.bindToController(new HealthController(mongoTemplate, registry)).build();

        // When / Then
        client.get().uri("/health").exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.status").isEqualTo("UP")
                .jsonPath("$.channels").isEqualTo(1);
    }

    @Test
    void testHealth_DownWhenMongoUnreachable() {
        when(mongoTemplate.executeCommand(any(Document.class)))
                .thenThrow(new DataAccessResourceFailureException("no route"));
        WebTestClient client = WebTestClient.bindToController(
                new HealthController(mongoTemplate, new ChannelRegistry())).build();

        client.get().uri("/health").exchange()
                .expectStatus().isEqualTo(503)
                .expectBody()
                .jsonPath("$.mongodb").isEqualTo("DOWN");
    }
}
