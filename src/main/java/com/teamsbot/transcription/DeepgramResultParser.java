package com.teamsbot.transcription;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.Optional;

/**
 * Parses Deepgram live-streaming messages. Only {@code Results} messages carry transcripts;
 * {@code Metadata}, {@code SpeechStarted} and {@code UtteranceEnd} are ignored.
 */
class DeepgramResultParser {

    private final ObjectMapper objectMapper;

    DeepgramResultParser(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    Optional<BackendResult> parse(String message) throws JsonProcessingException {
        JsonNode root = objectMapper.readTree(message);
        if (!"Results".equals(root.path("type").asText())) {
            return Optional.empty();
        }

        JsonNode alternatives = root.path("channel").path("alternatives");
        if (!alternatives.isArray() || alternatives.isEmpty()) {
            return Optional.empty();
        }

        String transcript = alternatives.get(0).path("transcript").asText("");
        if (transcript.isBlank()) {
            return Optional.empty();
        }

        // the end is rounded as a whole so it lines up with the next segment's rounded start
        double start = root.path("start").asDouble(0);
        long startMs = secondsToMillis(start);
        long endMs = secondsToMillis(start + root.path("duration").asDouble(0));

        return Optional.of(BackendResult.builder()
                .text(transcript)
                .startMs(startMs)
                .durationMs(Math.max(0, endMs - startMs))
                .isFinal(root.path("is_final").asBoolean(false))
                .build());
    }

    private static long secondsToMillis(double seconds) {
        return Math.round(seconds * 1000);
    }
}
