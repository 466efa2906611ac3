package com.teamsbot.config;

import com.teamsbot.exception.StreamFailureException;
import com.teamsbot.model.AudioFormat;
import com.teamsbot.retry.BackoffPolicy;
import lombok.Builder;
import lombok.Getter;

import java.time.Duration;

@Getter
@Builder
public class TranscriptionSettings {

    /**
     * What happens to audio buffered while the stream was reconnecting.
     */
    public enum ReconnectBufferPolicy {
        // stream the buffered audio on the new connection
        FLUSH,
        // drop it and resume with live audio
        DISCARD
    }

    private final String apiKey;
    private final String url;
    private final String model;
    private final String language;
    private final int sampleRate;
    private final boolean interimResults;
    private final Duration connectTimeout;
    private final Duration keepAliveInterval;
    private final int reconnectAttempts;
    private final Duration reconnectBaseDelay;
    private final Duration reconnectMaxDelay;
    private final int bufferCapacity;
    private final ReconnectBufferPolicy bufferPolicy;

    public AudioFormat audioFormat() {
        return AudioFormat.builder()
                .sampleRate(sampleRate)
                .build();
    }

    public BackoffPolicy reconnectPolicy() {
        return BackoffPolicy.builder()
                .maxAttempts(reconnectAttempts)
                .baseDelay(reconnectBaseDelay)
                .maxDelay(reconnectMaxDelay)
                .retryable(error -> error instanceof StreamFailureException)
                .build();
    }
}
