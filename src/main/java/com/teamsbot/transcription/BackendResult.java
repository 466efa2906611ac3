package com.teamsbot.transcription;

import lombok.Builder;
import lombok.Value;

/**
 * A recognition result as reported by the backend. Offsets are relative to the start of the
 * connection that produced it.
 */
@Value
@Builder
public class BackendResult {

    String text;
    long startMs;
    long durationMs;
    boolean isFinal;
}
