package com.teamsbot.transcription;

import com.teamsbot.config.TranscriptionSettings;
import com.teamsbot.exception.StreamFailureException;
import com.teamsbot.model.AudioChunk;
import com.teamsbot.model.AudioFormat;
import com.teamsbot.model.TranscriptFragment;
import com.teamsbot.retry.BackoffPolicy;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

/**
 * One logical transcription stream for a bot, kept alive across transport disconnects.
 *
 * <p>Audio is queued through {@link #send} into a bounded buffer and streamed by a sender task.
 * When the connection drops, the sender reconnects with exponential backoff while the meeting
 * keeps filling the buffer. If every reconnect attempt fails the fragment stream ends and
 * {@link #failure()} reports why.
 */
@Slf4j
public class TranscriptionStreamAdapter implements AutoCloseable {

    private static final long POLL_MILLIS = 200;

    private final String botId;
    private final String language;
    private final TranscriptionBackend backend;
    private final TranscriptionSettings settings;
    private final Executor executor;
    private final BackoffPolicy reconnectPolicy;

    private final AudioBuffer audioBuffer;
    private final SpeakerTimeline speakers = new SpeakerTimeline();
    private final FragmentSequencer sequencer;
    private final FragmentStream fragments = new FragmentStream();

    private final AtomicBoolean opened = new AtomicBoolean();
    private final AtomicBoolean closed = new AtomicBoolean();
    private final AtomicBoolean finished = new AtomicBoolean();
    private final AtomicReference<Throwable> failure = new AtomicReference<>();
    private final AtomicInteger generation = new AtomicInteger();
    private final AtomicLong receivedBytes = new AtomicLong();
    private final AtomicInteger reconnects = new AtomicInteger();

    private volatile AudioFormat format;
    private volatile BackendConnection connection;
    private volatile boolean disconnected;
    // meeting offset of the first chunk sent on the current connection, -1 until then
    private volatile long connectionOffsetMs = -1;

    public TranscriptionStreamAdapter(String botId, String language, TranscriptionBackend backend,
                                      TranscriptionSettings settings, Executor executor) {
        this.botId = botId;
        this.language = language;
        this.backend = backend;
        this.settings = settings;
        this.executor = executor;
        this.reconnectPolicy = settings.reconnectPolicy();
        this.audioBuffer = new AudioBuffer(settings.getBufferCapacity());
        this.sequencer = new FragmentSequencer(botId, settings.isInterimResults());
    }

    /**
     * Connects to the backend and starts streaming buffered audio.
     *
     * @return the fragments produced by this stream
     * @throws StreamFailureException if the initial handshake fails or the sender cannot be started
     */
    public FragmentStream open(AudioFormat audioFormat) {
        if (!opened.compareAndSet(false, true)) {
            throw new IllegalStateException("Transcription stream already opened for bot " + botId);
        }
        this.format = audioFormat;
        try {
            connection = connect();
        } catch (StreamFailureException e) {
            failure.compareAndSet(null, e);
            finish();
            throw e;
        }
        try {
            executor.execute(this::runSender);
        } catch (RejectedExecutionException e) {
            StreamFailureException cause = new StreamFailureException("No thread available for the transcription sender", e);
            fail(cause);
            throw cause;
        }
        log.info("[{}] Transcription stream opened (language={}, {} Hz)", botId, language, audioFormat.getSampleRate());
        return fragments;
    }

    /**
     * Queues audio for transcription. Safe to call from any thread, also while reconnecting.
     * Ignored before {@link #open} and after {@link #close}.
     */
    public void send(AudioChunk chunk) {
        AudioFormat current = format;
        if (current == null || closed.get() || chunk == null || chunk.size() == 0) {
            return;
        }
        long offsetMs = current.durationMs(receivedBytes.getAndAdd(chunk.size()));
        audioBuffer.add(new AudioBuffer.TimedChunk(offsetMs, chunk.getPcm(), chunk.getSpeakerId(), chunk.getSpeakerName()));
    }

    public FragmentStream fragments() {
        return fragments;
    }

    /**
     * Why the stream ended on its own, if it did.
     */
    public Optional<Throwable> failure() {
        return Optional.ofNullable(failure.get());
    }

    public boolean isClosed() {
        return closed.get();
    }

    public int reconnectCount() {
        return reconnects.get();
    }

    public long droppedChunkCount() {
        return audioBuffer.droppedCount();
    }

    /**
     * Ends the stream. The backend connection is torn down exactly once, whether this races a
     * failure or is called repeatedly.
     */
    @Override
    public void close() {
        if (closed.compareAndSet(false, true)) {
            log.info("[{}] Closing transcription stream", botId);
        }
        finish();
    }

    private BackendConnection connect() {
        int gen = generation.incrementAndGet();
        connectionOffsetMs = -1;
        StreamOptions options = StreamOptions.builder()
                .model(settings.getModel())
                .language(language)
                .audioFormat(format)
                .interimResults(settings.isInterimResults())
                .build();

        return backend.connect(options, new BackendListener() {
            @Override
            public void onResult(BackendResult result) {
                if (gen == generation.get()) {
                    handleResult(result);
                }
            }

            @Override
            public void onDisconnect(Throwable cause) {
                if (gen == generation.get()) {
                    handleDisconnect(cause);
                }
            }
        });
    }

    private void handleResult(BackendResult result) {
        long base = Math.max(connectionOffsetMs, 0);
        TranscriptFragment fragment = sequencer.accept(result, base, speakers);
        if (fragment != null) {
            fragments.push(fragment);
        }
    }

    private void handleDisconnect(Throwable cause) {
        if (closed.get()) {
            return;
        }
        log.warn("[{}] Transcription stream disconnected: {}", botId,
                cause != null ? cause.getMessage() : "closed by backend");
        sequencer.discardPartial();
        disconnected = true;
    }

    private void runSender() {
        try {
            while (!closed.get()) {
                if (disconnected) {
                    if (!reconnect()) {
                        return;
                    }
                    continue;
                }

                AudioBuffer.TimedChunk chunk = audioBuffer.poll(POLL_MILLIS, TimeUnit.MILLISECONDS);
                if (chunk == null) {
                    continue;
                }

                if (connectionOffsetMs < 0) {
                    connectionOffsetMs = chunk.getOffsetMs();
                }
                speakers.record(chunk.getOffsetMs(), chunk.getSpeakerId(), chunk.getSpeakerName());

                try {
                    connection.sendAudio(chunk.getPcm());
                } catch (StreamFailureException e) {
                    if (!closed.get()) {
                        audioBuffer.requeue(chunk);
                        handleDisconnect(e);
                    }
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.debug("[{}] Transcription sender interrupted", botId);
        } catch (RuntimeException e) {
            log.error("[{}] Transcription sender failed: {}", botId, e.getMessage(), e);
            fail(new StreamFailureException("Transcription sender failed: " + e.getMessage(), e));
        }
    }

    private boolean reconnect() throws InterruptedException {
        generation.incrementAndGet();
        BackendConnection dead = connection;
        if (dead != null) {
            dead.close();
        }

        StreamFailureException lastError = null;
        int maxAttempts = reconnectPolicy.getMaxAttempts();
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            Duration delay = reconnectPolicy.delayBeforeRetry(attempt);
            log.warn("[{}] Reconnecting transcription stream in {} ms (attempt {}/{}, {} chunk(s) buffered)",
                    botId, delay.toMillis(), attempt, maxAttempts, audioBuffer.size());
            if (!sleepUnlessClosed(delay)) {
                return false;
            }

            disconnected = false;
            try {
                connection = connect();
            } catch (StreamFailureException e) {
                disconnected = true;
                lastError = e;
                log.warn("[{}] Reconnect attempt {}/{} failed: {}", botId, attempt, maxAttempts, e.getMessage());
                continue;
            }

            if (settings.getBufferPolicy() == TranscriptionSettings.ReconnectBufferPolicy.DISCARD) {
                int discarded = audioBuffer.clear();
                log.info("[{}] Discarded {} audio chunk(s) buffered during reconnect", botId, discarded);
            }
            reconnects.incrementAndGet();
            log.info("[{}] Transcription stream reconnected after {} attempt(s)", botId, attempt);
            return true;
        }

        if (!closed.get()) {
            fail(new StreamFailureException(
                    "Transcription stream lost, " + maxAttempts + " reconnect attempt(s) failed", lastError));
        }
        return false;
    }

    private boolean sleepUnlessClosed(Duration delay) throws InterruptedException {
        long deadline = System.nanoTime() + delay.toNanos();
        while (!closed.get()) {
            long remainingMillis = TimeUnit.NANOSECONDS.toMillis(deadline - System.nanoTime());
            if (remainingMillis <= 0) {
                return true;
            }
            Thread.sleep(Math.min(remainingMillis, POLL_MILLIS));
        }
        return false;
    }

    private void fail(StreamFailureException cause) {
        if (failure.compareAndSet(null, cause)) {
            log.error("[{}] Transcription stream failed: {}", botId, cause.getMessage());
        }
        finish();
    }

    private void finish() {
        if (!finished.compareAndSet(false, true)) {
            return;
        }
        closed.set(true);
        // late callbacks from the old connection are ignored from here on
        generation.incrementAndGet();
        BackendConnection current = connection;
        if (current != null) {
            try {
                current.close();
            } catch (RuntimeException e) {
                log.warn("[{}] Error closing transcription connection: {}", botId, e.getMessage());
            }
        }
        fragments.end();
        log.info("[{}] Transcription stream finished ({} reconnect(s), {} audio chunk(s) dropped)",
                botId, reconnects.get(), audioBuffer.droppedCount());
    }
}
