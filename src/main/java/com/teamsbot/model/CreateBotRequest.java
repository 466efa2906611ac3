package com.teamsbot.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CreateBotRequest {

    @NotBlank(message = "Meeting URL is required")
    @JsonProperty("meeting_url")
    private String meetingUrl;

    @NotBlank(message = "Webhook URL is required")
    @JsonProperty("webhook_url")
    private String webhookUrl;

    @Size(max = 100, message = "Bot name must be at most 100 characters")
    @JsonProperty("bot_name")
    private String botName;

    @Size(max = 16, message = "Language code must be at most 16 characters")
    private String language;

    // Echoed back on every webhook event for this bot
    private Map<String, Object> metadata;
}
