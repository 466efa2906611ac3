package com.teamsbot.webhook;

import com.teamsbot.model.WebhookEvent;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;
import reactor.util.concurrent.Queues;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Function;

/**
 * Ordered webhook pipeline for a single bot. Events are delivered strictly one after another in
 * the order they were dispatched: event N+1 is not sent until event N was delivered or dropped.
 *
 * <p>At most {@code capacity} transcription events wait in the queue; further ones are dropped
 * while the destination is behind. Status events are always queued, a bot emits only a handful,
 * so the terminal {@code left} or {@code error} status reaches the destination even then.
 *
 * <p>{@link #dispatch} must only be called from one thread at a time (the owning session task).
 */
@Slf4j
public class WebhookDispatcher {

    private final String botId;
    private final int capacity;
    private final Sinks.Many<WebhookEvent> queue;
    private final AtomicInteger queuedTranscriptions = new AtomicInteger();
    private final AtomicBoolean cancelled = new AtomicBoolean();
    private final AtomicBoolean drained = new AtomicBoolean();
    private final AtomicLong delivered = new AtomicLong();
    private final AtomicLong dropped = new AtomicLong();

    public WebhookDispatcher(String botId, int capacity, Function<WebhookEvent, Mono<DeliveryResult>> delivery) {
        this.botId = botId;
        this.capacity = capacity;
        this.queue = Sinks.many().unicast().onBackpressureBuffer(Queues.<WebhookEvent>unbounded().get());
        queue.asFlux()
                .concatMap(event -> {
                    if (event.isTranscription()) {
                        queuedTranscriptions.decrementAndGet();
                    }
                    // checked when the delivery is about to start, not when the event is prefetched
                    return cancelled.get() ? skip(event) : delivery.apply(event);
                }, 1)
                .subscribe(this::record,
                        error -> log.error("[{}] Webhook pipeline failed: {}", botId, error.getMessage(), error),
                        this::onDrained);
    }

    /**
     * Queues an event behind every event dispatched before it.
     *
     * @return false if the event was not queued (pipeline closed, or too many transcriptions waiting)
     */
    public boolean dispatch(WebhookEvent event) {
        boolean transcription = event.isTranscription();
        if (transcription && queuedTranscriptions.incrementAndGet() > capacity) {
            queuedTranscriptions.decrementAndGet();
            long total = dropped.incrementAndGet();
            if (total == 1 || total % 100 == 0) {
                log.warn("[{}] Webhook destination is behind, dropped {} transcription event(s) so far", botId, total);
            }
            return false;
        }
        Sinks.EmitResult result = queue.tryEmitNext(event);
        if (result.isFailure()) {
            if (transcription) {
                queuedTranscriptions.decrementAndGet();
            }
            dropped.incrementAndGet();
            log.error("[{}] Dropping {} event, dispatcher refused it: {}", botId, event.getEventType(), result);
            return false;
        }
        return true;
    }

    /**
     * Accepts no further events; already queued events are still delivered.
     */
    public void complete() {
        queue.tryEmitComplete();
    }

    /**
     * Stops sending queued events. A delivery already in flight is allowed to finish.
     */
    public void cancel() {
        if (cancelled.compareAndSet(false, true)) {
            log.info("[{}] Webhook dispatcher cancelled", botId);
            queue.tryEmitComplete();
        }
    }

    public boolean isDrained() {
        return drained.get();
    }

    public long deliveredCount() {
        return delivered.get();
    }

    public long droppedCount() {
        return dropped.get();
    }

    private Mono<DeliveryResult> skip(WebhookEvent event) {
        log.debug("[{}] Skipping {} event, dispatcher cancelled", botId, event.getEventType());
        return Mono.just(DeliveryResult.builder()
                .outcome(DeliveryResult.Outcome.PERMANENT_FAILURE)
                .attempts(0)
                .elapsed(Duration.ZERO)
                .error("Dispatcher cancelled")
                .build());
    }

    private void record(DeliveryResult result) {
        if (result.isDelivered()) {
            delivered.incrementAndGet();
        } else {
            dropped.incrementAndGet();
        }
    }

    private void onDrained() {
        drained.set(true);
        log.info("[{}] Webhook dispatcher drained: {} delivered, {} dropped", botId, delivered.get(), dropped.get());
    }
}
