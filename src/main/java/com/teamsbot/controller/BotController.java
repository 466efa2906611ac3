package com.teamsbot.controller;

import com.teamsbot.model.BotSnapshot;
import com.teamsbot.model.CreateBotRequest;
import com.teamsbot.model.WebhookEvent;
import com.teamsbot.session.SessionRegistry;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

@Slf4j
@RestController
@RequiredArgsConstructor
public class BotController {

    private final SessionRegistry registry;

    /**
     * Start a bot for a Teams meeting. Returns as soon as the bot is created; joining is asynchronous.
     */
    @PostMapping("/bots")
    public ResponseEntity<BotSnapshot> createBot(@Valid @RequestBody CreateBotRequest request) {
        log.info("Received bot request: meeting={}, webhook={}, name={}",
                request.getMeetingUrl(), request.getWebhookUrl(), request.getBotName());

        BotSnapshot bot = registry.create(request.getMeetingUrl(), request.getWebhookUrl(),
                request.getBotName(), request.getLanguage(), request.getMetadata());
        return ResponseEntity.status(HttpStatus.CREATED).body(bot);
    }

    @GetMapping("/bots/{id}")
    public BotSnapshot getBot(@PathVariable String id) {
        return registry.get(id);
    }

    @PostMapping("/bots/{id}/leave")
    public BotSnapshot leave(@PathVariable String id) {
        log.info("[{}] Leave requested via API", id);
        return registry.requestLeave(id);
    }

    /**
     * Test webhook endpoint. Point a bot's webhook_url here to see its events in the log.
     */
    @PostMapping("/test-webhook")
    public ResponseEntity<Map<String, String>> testWebhook(@RequestBody WebhookEvent event) {
        if (event.isTranscription()) {
            Map<String, Object> data = event.getData();
            log.info("=== TEST WEBHOOK [{}] {} ({}): {}", event.getBotId(),
                    data.get("speaker_name"), Boolean.TRUE.equals(data.get("is_final")) ? "final" : "partial",
                    data.get("text"));
        } else {
            log.info("=== TEST WEBHOOK [{}] {}: {}", event.getBotId(), event.getEventType(), event.getData());
        }
        return ResponseEntity.ok(Map.of("status", "received"));
    }

    /**
     * Health check endpoint
     */
    @GetMapping("/health")
    public Map<String, Object> health() {
        Map<String, Object> health = new LinkedHashMap<>();
        health.put("status", "UP");
        health.put("active_sessions", registry.activeSessionCount());
        health.put("total_sessions", registry.size());
        health.put("timestamp", Instant.now().toString());
        return health;
    }
}
