package com.teamsbot.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;

/**
 * Read-only copy of a bot session, as returned by the HTTP API.
 */
@Value
@Builder
@Jacksonized
public class BotSnapshot {

    String id;

    BotState state;

    @JsonProperty("meeting_url")
    String meetingUrl;

    @JsonProperty("webhook_url")
    String webhookUrl;

    @JsonProperty("bot_name")
    String botName;

    String language;

    @JsonProperty("created_at")
    Instant createdAt;

    @JsonProperty("ended_at")
    Instant endedAt;

    @JsonProperty("error_message")
    String errorMessage;
}
