package com.teamsbot.model;

import lombok.Builder;
import lombok.Value;

/**
 * Raw meeting audio (linear16, mono) as emitted by the meeting adapter, tagged with whoever
 * was speaking when it was captured. Speaker fields are null when unknown.
 */
@Value
@Builder
public class AudioChunk {

    byte[] pcm;
    String speakerId;
    String speakerName;

    public int size() {
        return pcm != null ? pcm.length : 0;
    }
}
