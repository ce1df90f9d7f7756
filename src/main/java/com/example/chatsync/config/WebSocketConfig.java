package com.example.chatsync.config;

import com.example.chatsync.ws.SyncWebSocketHandler;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.HandlerMapping;
import org.springframework.web.reactive.handler.SimpleUrlHandlerMapping;

import java.util.Map;

@Configuration
public class WebSocketConfig {

    @Bean
    public HandlerMapping syncHandlerMapping(SyncWebSocketHandler handler,
                                             @Value("${app.gateway.path:/ws}") String path) {
        // ahead of annotated controllers
        return new SimpleUrlHandlerMapping(Map.of(path + "/*", handler), -1);
    }
}
