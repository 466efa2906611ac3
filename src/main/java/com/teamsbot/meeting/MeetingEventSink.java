package com.teamsbot.meeting;

import com.teamsbot.model.AudioChunk;

/**
 * Receives signals from a {@link MeetingAdapter}. Implementations must be thread-safe: adapters
 * call in from their own threads and never wait for the sink.
 */
public interface MeetingEventSink {

    void joined();

    void joinFailed(String reason);

    void audio(AudioChunk chunk);

    void participantJoined(String participantId, String displayName);

    void participantLeft(String participantId, String displayName);

    /**
     * The meeting was ended for everyone.
     */
    void ended();

    /**
     * The bot was removed from the meeting by a participant.
     */
    void removed();

    void error(String reason);

    /**
     * Acknowledges a {@link MeetingAdapter#leave()} request.
     */
    void left();
}
