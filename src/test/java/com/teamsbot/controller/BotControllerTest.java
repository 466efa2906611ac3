package com.teamsbot.controller;

import com.teamsbot.exception.BotNotFoundException;
import com.teamsbot.exception.InvalidRequestException;
import com.teamsbot.exception.ServiceNotConfiguredException;
import com.teamsbot.model.BotSnapshot;
import com.teamsbot.model.BotState;
import com.teamsbot.session.SessionRegistry;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;

import static org.hamcrest.Matchers.containsString;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(controllers = BotController.class)
@AutoConfigureMockMvc(addFilters = false)
class BotControllerTest {

    private static final String MEETING_URL = "https://teams.microsoft.com/l/meetup-join/abc";
    private static final String WEBHOOK_URL = "https://hooks.example.com/teams";

    @Autowired
    private MockMvc mockMvc;

    @MockitoBean
    private SessionRegistry registry;

    private static BotSnapshot bot(String id, BotState state) {
        return BotSnapshot.builder()
                .id(id)
                .state(state)
                .meetingUrl(MEETING_URL)
                .webhookUrl(WEBHOOK_URL)
                .botName("Notetaker")
                .language("en")
                .createdAt(Instant.parse("2026-03-02T09:00:00Z"))
                .build();
    }

    @Test
    void createBotReturnsCreatedSnapshot() throws Exception {
        when(registry.create(eq(MEETING_URL), eq(WEBHOOK_URL), eq("Notetaker"), isNull(), any()))
                .thenReturn(bot("bot_00112233aabbccdd", BotState.JOINING));

        mockMvc.perform(post("/bots")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"meeting_url": "%s", "webhook_url": "%s", "bot_name": "Notetaker",
                                 "metadata": {"ticket": "OPS-12"}}
                                """.formatted(MEETING_URL, WEBHOOK_URL)))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.id").value("bot_00112233aabbccdd"))
                .andExpect(jsonPath("$.state").value("joining"))
                .andExpect(jsonPath("$.meeting_url").value(MEETING_URL))
                .andExpect(jsonPath("$.bot_name").value("Notetaker"))
                .andExpect(jsonPath("$.created_at").value("2026-03-02T09:00:00Z"));

        verify(registry).create(MEETING_URL, WEBHOOK_URL, "Notetaker", null, Map.of("ticket", "OPS-12"));
    }

    @Test
    void createBotRequiresBothUrls() throws Exception {
        mockMvc.perform(post("/bots")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"bot_name\": \"Notetaker\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("Validation failed"))
                .andExpect(jsonPath("$.detail").value(containsString("Meeting URL is required")))
                .andExpect(jsonPath("$.detail").value(containsString("Webhook URL is required")));

        verifyNoInteractions(registry);
    }

    @Test
    void createBotRejectsMalformedJson() throws Exception {
        mockMvc.perform(post("/bots")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"meeting_url\": "))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("Malformed request body"));
    }

    @Test
    void createBotReportsInvalidUrls() throws Exception {
        when(registry.create(any(), any(), any(), any(), any()))
                .thenThrow(new InvalidRequestException("Not a Microsoft Teams meeting URL: https://zoom.us/j/1"));

        mockMvc.perform(post("/bots")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"meeting_url\": \"https://zoom.us/j/1\", \"webhook_url\": \"" + WEBHOOK_URL + "\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("Invalid request"))
                .andExpect(jsonPath("$.detail").value("Not a Microsoft Teams meeting URL: https://zoom.us/j/1"));
    }

    @Test
    void createBotAtCapacityIsConflict() throws Exception {
        when(registry.create(any(), any(), any(), any(), any()))
                .thenThrow(new IllegalStateException("Maximum number of concurrent bots reached"));

        mockMvc.perform(post("/bots")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"meeting_url\": \"" + MEETING_URL + "\", \"webhook_url\": \"" + WEBHOOK_URL + "\"}"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.detail").value("Maximum number of concurrent bots reached"));
    }

    @Test
    void getBotReturnsSnapshot() throws Exception {
        BotSnapshot failed = BotSnapshot.builder()
                .id("bot_00112233aabbccdd")
                .state(BotState.ERROR)
                .meetingUrl(MEETING_URL)
                .webhookUrl(WEBHOOK_URL)
                .createdAt(Instant.parse("2026-03-02T09:00:00Z"))
                .endedAt(Instant.parse("2026-03-02T09:01:30Z"))
                .errorMessage("Admission to the meeting was denied")
                .build();
        when(registry.get("bot_00112233aabbccdd")).thenReturn(failed);

        mockMvc.perform(get("/bots/bot_00112233aabbccdd"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.state").value("error"))
                .andExpect(jsonPath("$.ended_at").value("2026-03-02T09:01:30Z"))
                .andExpect(jsonPath("$.error_message").value("Admission to the meeting was denied"));
    }

    @Test
    void unknownBotIsNotFound() throws Exception {
        when(registry.get("bot_missing")).thenThrow(new BotNotFoundException("bot_missing"));

        mockMvc.perform(get("/bots/bot_missing"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.error").value("Bot not found"));
    }

    @Test
    void leaveRequestsLeaveAndReturnsSnapshot() throws Exception {
        when(registry.requestLeave("bot_00112233aabbccdd"))
                .thenReturn(bot("bot_00112233aabbccdd", BotState.IN_MEETING));

        mockMvc.perform(post("/bots/bot_00112233aabbccdd/leave"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.id").value("bot_00112233aabbccdd"));

        verify(registry).requestLeave("bot_00112233aabbccdd");
    }

    @Test
    void leaveForUnknownBotIsNotFound() throws Exception {
        when(registry.requestLeave("bot_missing")).thenThrow(new BotNotFoundException("bot_missing"));

        mockMvc.perform(post("/bots/bot_missing/leave"))
                .andExpect(status().isNotFound());
    }

    @Test
    void healthReportsSessionCounts() throws Exception {
        when(registry.activeSessionCount()).thenReturn(2L);
        when(registry.size()).thenReturn(3);

        mockMvc.perform(get("/health"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("UP"))
                .andExpect(jsonPath("$.active_sessions").value(2))
                .andExpect(jsonPath("$.total_sessions").value(3))
                .andExpect(jsonPath("$.timestamp").exists());
    }

    @Test
    void testWebhookAcceptsEvents() throws Exception {
        mockMvc.perform(post("/test-webhook")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"event_type": "transcription", "bot_id": "bot_00112233aabbccdd",
                                 "timestamp": "2026-03-02T09:00:05Z",
                                 "data": {"speaker_id": "p1", "speaker_name": "Alice", "text": "Hello",
                                          "timestamp_ms": 1200, "duration_ms": 800, "is_final": true}}
                                """))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("received"));
    }

    @Test
    void createBotPassesNullMetadataValuesThrough() throws Exception {
        when(registry.create(any(), any(), any(), any(), any()))
                .thenReturn(bot("bot_00112233aabbccdd", BotState.JOINING));

        mockMvc.perform(post("/bots")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"meeting_url\": \"" + MEETING_URL + "\", \"webhook_url\": \"" + WEBHOOK_URL
                                + "\", \"metadata\": {\"ticket\": null}}"))
                .andExpect(status().isCreated());

        Map<String, Object> metadata = new HashMap<>();
        metadata.put("ticket", null);
        verify(registry).create(MEETING_URL, WEBHOOK_URL, null, null, metadata);
    }

    @Test
    void createBotWithoutTranscriptionKeyIsServerError() throws Exception {
        when(registry.create(any(), any(), any(), any(), any()))
                .thenThrow(new ServiceNotConfiguredException("Deepgram API key not configured"));

        mockMvc.perform(post("/bots")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"meeting_url\": \"" + MEETING_URL + "\", \"webhook_url\": \"" + WEBHOOK_URL + "\"}"))
                .andExpect(status().isInternalServerError())
                .andExpect(jsonPath("$.error").value("Service not configured"))
                .andExpect(jsonPath("$.detail").value("Deepgram API key not configured"));
    }
}
