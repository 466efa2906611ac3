package com.teamsbot.model;

import lombok.Builder;
import lombok.Value;

/**
 * One unit of recognized speech. Offsets are milliseconds since the bot started streaming
 * meeting audio. A partial fragment may be superseded by later fragments of the same utterance.
 */
@Value
@Builder(toBuilder = true)
public class TranscriptFragment {

    String speakerId;
    String speakerName;
    String text;
    long startMs;
    long durationMs;
    boolean isFinal;

    public long endMs() {
        return startMs + durationMs;
    }
}
