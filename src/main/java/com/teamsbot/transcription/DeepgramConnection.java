package com.teamsbot.transcription;

import com.teamsbot.exception.StreamFailureException;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Client side of one Deepgram WebSocket. Audio written here is picked up by the socket's
 * outbound flux; {@link #close()} makes the outbound send {@code CloseStream} and complete.
 */
class DeepgramConnection implements BackendConnection {

    private final Sinks.Many<byte[]> audio = Sinks.many().unicast().onBackpressureBuffer();
    private final Sinks.Empty<Void> closeRequested = Sinks.empty();
    private final AtomicBoolean closing = new AtomicBoolean();
    private final AtomicBoolean closed = new AtomicBoolean();

    @Override
    public void sendAudio(byte[] pcm) {
        if (closed.get() || closing.get()) {
            throw new StreamFailureException("Deepgram connection is closed");
        }
        Sinks.EmitResult result = audio.tryEmitNext(pcm);
        if (result.isFailure()) {
            throw new StreamFailureException("Deepgram connection refused audio: " + result);
        }
    }

    @Override
    public boolean isOpen() {
        return !closed.get() && !closing.get();
    }

    @Override
    public void close() {
        if (closing.compareAndSet(false, true)) {
            closeRequested.tryEmitEmpty();
            audio.tryEmitComplete();
        }
    }

    boolean isClosing() {
        return closing.get();
    }

    void markClosed() {
        closed.set(true);
    }

    Flux<byte[]> audio() {
        return audio.asFlux();
    }

    Mono<Void> closeRequested() {
        return closeRequested.asMono();
    }
}
