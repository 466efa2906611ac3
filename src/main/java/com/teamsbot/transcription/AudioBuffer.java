package com.teamsbot.transcription;

import lombok.Value;
import lombok.extern.slf4j.Slf4j;

import java.util.concurrent.LinkedBlockingDeque;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Bounded audio queue between the meeting and the transcription sender. When full, the oldest
 * chunk is dropped: audio that has fallen too far behind real time is worthless.
 */
@Slf4j
class AudioBuffer {

    /**
     * A chunk stamped with its position in the meeting audio.
     */
    @Value
    static class TimedChunk {
        long offsetMs;
        byte[] pcm;
        String speakerId;
        String speakerName;
    }

    private final LinkedBlockingDeque<TimedChunk> chunks;
    private final AtomicLong dropped = new AtomicLong();

    AudioBuffer(int capacity) {
        this.chunks = new LinkedBlockingDeque<>(capacity);
    }

    synchronized void add(TimedChunk chunk) {
        while (!chunks.offerLast(chunk)) {
            if (chunks.pollFirst() != null) {
                long total = dropped.incrementAndGet();
                if (total == 1 || total % 100 == 0) {
                    log.warn("Audio buffer full, dropped {} chunk(s) so far", total);
                }
            }
        }
    }

    /**
     * Puts a chunk that could not be sent back at the head of the queue.
     */
    synchronized void requeue(TimedChunk chunk) {
        if (!chunks.offerFirst(chunk)) {
            dropped.incrementAndGet();
        }
    }

    TimedChunk poll(long timeout, TimeUnit unit) throws InterruptedException {
        return chunks.pollFirst(timeout, unit);
    }

    /**
     * @return number of chunks discarded
     */
    synchronized int clear() {
        int size = chunks.size();
        chunks.clear();
        dropped.addAndGet(size);
        return size;
    }

    int size() {
        return chunks.size();
    }

    long droppedCount() {
        return dropped.get();
    }
}
