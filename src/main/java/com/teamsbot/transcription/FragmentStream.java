package com.teamsbot.transcription;

import com.teamsbot.model.TranscriptFragment;

import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Blocking, single-pass sequence of fragments produced by a transcription stream. {@link #hasNext()}
 * waits for the next fragment and returns false once the stream has ended. Not restartable.
 */
public class FragmentStream implements Iterator<TranscriptFragment> {

    private static final Object END = new Object();

    private final BlockingQueue<Object> queue = new LinkedBlockingQueue<>();
    private final AtomicBoolean endSignalled = new AtomicBoolean();

    private TranscriptFragment next;
    private boolean ended;

    void push(TranscriptFragment fragment) {
        if (!endSignalled.get()) {
            queue.offer(fragment);
        }
    }

    void end() {
        if (endSignalled.compareAndSet(false, true)) {
            queue.offer(END);
        }
    }

    @Override
    public boolean hasNext() {
        if (next != null) {
            return true;
        }
        if (ended) {
            return false;
        }
        try {
            Object item = queue.take();
            if (item == END) {
                ended = true;
                return false;
            }
            next = (TranscriptFragment) item;
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            ended = true;
            return false;
        }
    }

    @Override
    public TranscriptFragment next() {
        if (!hasNext()) {
            throw new NoSuchElementException("Fragment stream has ended");
        }
        TranscriptFragment fragment = next;
        next = null;
        return fragment;
    }
}
