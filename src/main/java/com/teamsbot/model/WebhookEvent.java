package com.teamsbot.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;
import java.time.format.DateTimeFormatter;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * The unit of webhook delivery. The JSON shape is a contract with webhook consumers.
 */
@Value
@Builder
@Jacksonized
public class WebhookEvent {

    public static final String TRANSCRIPTION = "transcription";
    public static final String BOT_STATUS = "bot_status";

    @JsonProperty("event_type")
    String eventType;

    @JsonProperty("bot_id")
    String botId;

    // ISO-8601
    String timestamp;

    Map<String, Object> data;

    public static WebhookEvent transcription(String botId, TranscriptFragment fragment,
                                             Map<String, Object> metadata, Instant now) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("speaker_id", fragment.getSpeakerId());
        data.put("speaker_name", fragment.getSpeakerName());
        data.put("text", fragment.getText());
        data.put("timestamp_ms", fragment.getStartMs());
        data.put("duration_ms", fragment.getDurationMs());
        data.put("is_final", fragment.isFinal());
        if (metadata != null && !metadata.isEmpty()) {
            data.put("metadata", metadata);
        }
        return build(TRANSCRIPTION, botId, data, now);
    }

    public static WebhookEvent botStatus(String botId, BotState status, String message,
                                         Map<String, Object> metadata, Instant now) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("status", status.wireValue());
        data.put("message", message);
        if (metadata != null && !metadata.isEmpty()) {
            data.put("metadata", metadata);
        }
        return build(BOT_STATUS, botId, data, now);
    }

    private static WebhookEvent build(String type, String botId, Map<String, Object> data, Instant now) {
        return WebhookEvent.builder()
                .eventType(type)
                .botId(botId)
                .timestamp(DateTimeFormatter.ISO_INSTANT.format(now))
                .data(data)
                .build();
    }

    public boolean isTranscription() {
        return TRANSCRIPTION.equals(eventType);
    }

    public boolean isBotStatus() {
        return BOT_STATUS.equals(eventType);
    }
}
