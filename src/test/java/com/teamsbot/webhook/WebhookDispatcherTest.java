package com.teamsbot.webhook;

import com.teamsbot.model.BotState;
import com.teamsbot.model.TranscriptFragment;
import com.teamsbot.model.WebhookEvent;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.awaitility.Awaitility.await;

class WebhookDispatcherTest {

    private static final String BOT_ID = "bot_00000000000000aa";

    private static WebhookEvent fragment(int index) {
        TranscriptFragment fragment = TranscriptFragment.builder()
                .speakerId("spk1")
                .text("word " + index)
                .startMs(index * 100L)
                .durationMs(100)
                .isFinal(true)
                .build();
        return WebhookEvent.transcription(BOT_ID, fragment, Map.of(), Instant.now());
    }

    private static DeliveryResult result(DeliveryResult.Outcome outcome) {
        return DeliveryResult.builder().outcome(outcome).attempts(1).elapsed(Duration.ZERO).build();
    }

    @Test
    void deliversInDispatchOrderDespiteLatencyJitter() {
        List<String> received = new CopyOnWriteArrayList<>();
        WebhookDispatcher dispatcher = new WebhookDispatcher(BOT_ID, 256, event ->
                Mono.delay(Duration.ofMillis(ThreadLocalRandom.current().nextInt(0, 15)))
                        .map(tick -> {
                            received.add((String) event.getData().get("text"));
                            return result(DeliveryResult.Outcome.DELIVERED);
                        }));

        IntStream.range(0, 40).forEach(i -> dispatcher.dispatch(fragment(i)));
        dispatcher.complete();

        await().atMost(Duration.ofSeconds(10)).until(dispatcher::isDrained);
        assertThat(received).containsExactlyElementsOf(
                IntStream.range(0, 40).mapToObj(i -> "word " + i).collect(Collectors.toList()));
        assertThat(dispatcher.deliveredCount()).isEqualTo(40);
    }

    @Test
    void nextEventStartsOnlyAfterThePreviousOneFinished() {
        AtomicInteger inFlight = new AtomicInteger();
        AtomicInteger maxInFlight = new AtomicInteger();
        WebhookDispatcher dispatcher = new WebhookDispatcher(BOT_ID, 256, event ->
                Mono.fromRunnable(() -> maxInFlight.accumulateAndGet(inFlight.incrementAndGet(), Math::max))
                        .then(Mono.delay(Duration.ofMillis(5)))
                        .map(tick -> {
                            inFlight.decrementAndGet();
                            return result(DeliveryResult.Outcome.DELIVERED);
                        }));

        IntStream.range(0, 10).forEach(i -> dispatcher.dispatch(fragment(i)));
        dispatcher.complete();

        await().atMost(Duration.ofSeconds(5)).until(dispatcher::isDrained);
        assertThat(maxInFlight).hasValue(1);
    }

    @Test
    void droppedEventDoesNotBlockTheRest() {
        List<String> received = new CopyOnWriteArrayList<>();
        WebhookDispatcher dispatcher = new WebhookDispatcher(BOT_ID, 16, event -> {
            String text = (String) event.getData().get("text");
            if (text.equals("word 1")) {
                return Mono.just(result(DeliveryResult.Outcome.RETRIES_EXHAUSTED));
            }
            received.add(text);
            return Mono.just(result(DeliveryResult.Outcome.DELIVERED));
        });

        IntStream.range(0, 3).forEach(i -> dispatcher.dispatch(fragment(i)));
        dispatcher.complete();

        await().atMost(Duration.ofSeconds(5)).until(dispatcher::isDrained);
        assertThat(received).containsExactly("word 0", "word 2");
        assertThat(dispatcher.deliveredCount()).isEqualTo(2);
        assertThat(dispatcher.droppedCount()).isEqualTo(1);
    }

    @Test
    void cancelLetsTheInFlightDeliveryFinishButSkipsTheRest() {
        List<String> received = new CopyOnWriteArrayList<>();
        AtomicInteger started = new AtomicInteger();
        WebhookDispatcher dispatcher = new WebhookDispatcher(BOT_ID, 16, event -> {
            started.incrementAndGet();
            return Mono.delay(Duration.ofMillis(200)).map(tick -> {
                received.add((String) event.getData().get("text"));
                return result(DeliveryResult.Outcome.DELIVERED);
            });
        });

        IntStream.range(0, 3).forEach(i -> dispatcher.dispatch(fragment(i)));
        await().atMost(Duration.ofSeconds(2)).until(() -> started.get() == 1);
        dispatcher.cancel();

        await().atMost(Duration.ofSeconds(5)).until(dispatcher::isDrained);
        assertThat(received).containsExactly("word 0");
        assertThat(started).hasValue(1);
        assertThat(dispatcher.droppedCount()).isEqualTo(2);
    }

    @Test
    void refusesEventsAfterComplete() {
        WebhookDispatcher dispatcher = new WebhookDispatcher(BOT_ID, 16,
                event -> Mono.just(result(DeliveryResult.Outcome.DELIVERED)));
        dispatcher.complete();

        assertThat(dispatcher.dispatch(fragment(0))).isFalse();
        assertThat(dispatcher.droppedCount()).isEqualTo(1);
    }

    @Test
    void terminalStatusIsQueuedWhileTranscriptionsOverflow() {
        List<WebhookEvent> received = new CopyOnWriteArrayList<>();
        Sinks.Empty<Void> destinationBack = Sinks.empty();
        WebhookDispatcher dispatcher = new WebhookDispatcher(BOT_ID, 8, event -> {
            received.add(event);
            return destinationBack.asMono().then(Mono.just(result(DeliveryResult.Outcome.DELIVERED)));
        });

        long accepted = IntStream.range(0, 64).filter(i -> dispatcher.dispatch(fragment(i))).count();
        boolean leftAccepted = dispatcher.dispatch(
                WebhookEvent.botStatus(BOT_ID, BotState.LEFT, "Left meeting", Map.of(), Instant.now()));

        assertThat(accepted).isBetween(8L, 10L);
        assertThat(dispatcher.droppedCount()).isEqualTo(64 - accepted);
        assertThat(leftAccepted).isTrue();

        destinationBack.tryEmitEmpty();
        dispatcher.complete();
        await().atMost(Duration.ofSeconds(5)).until(dispatcher::isDrained);
        assertThat(received).hasSize((int) accepted + 1);
        WebhookEvent last = received.get(received.size() - 1);
        assertThat(last.isBotStatus()).isTrue();
        assertThat(last.getData()).containsEntry("status", "left");
    }

    @Test
    void transcriptionsAreAcceptedAgainOnceTheDestinationCatchesUp() {
        Sinks.Empty<Void> destinationBack = Sinks.empty();
        WebhookDispatcher dispatcher = new WebhookDispatcher(BOT_ID, 2, event ->
                destinationBack.asMono().then(Mono.just(result(DeliveryResult.Outcome.DELIVERED))));

        IntStream.range(0, 10).forEach(i -> dispatcher.dispatch(fragment(i)));
        assertThat(dispatcher.dispatch(fragment(10))).isFalse();

        destinationBack.tryEmitEmpty();
        await().atMost(Duration.ofSeconds(5)).until(() -> dispatcher.deliveredCount() + dispatcher.droppedCount() == 11);
        assertThat(dispatcher.dispatch(fragment(11))).isTrue();
    }
}
