package com.teamsbot.model;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class AudioFormat {

    public static final String LINEAR16 = "linear16";

    @Builder.Default
    String encoding = LINEAR16;
    int sampleRate;
    @Builder.Default
    int channels = 1;

    /**
     * Milliseconds of audio held in the given number of linear16 bytes.
     */
    public long durationMs(long bytes) {
        long bytesPerSecond = (long) sampleRate * channels * 2;
        return bytesPerSecond == 0 ? 0 : bytes * 1000 / bytesPerSecond;
    }
}
