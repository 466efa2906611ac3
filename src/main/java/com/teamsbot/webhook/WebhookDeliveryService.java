package com.teamsbot.webhook;

import com.teamsbot.config.WebhookSettings;
import com.teamsbot.exception.InvalidRequestException;
import com.teamsbot.exception.WebhookDeliveryException;
import com.teamsbot.model.WebhookEvent;
import com.teamsbot.retry.BackoffPolicy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.net.URI;
import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Posts webhook events to caller-supplied URLs with bounded, exponential retries.
 */
@Slf4j
@Service
public class WebhookDeliveryService {

    private final WebClient webClient;
    private final WebhookSettings settings;
    private final WebhookUrlPolicy urlPolicy;
    private final BackoffPolicy backoffPolicy;

    public WebhookDeliveryService(WebClient webClient, WebhookSettings settings, WebhookUrlPolicy urlPolicy) {
        this.webClient = webClient;
        this.settings = settings;
        this.urlPolicy = urlPolicy;
        this.backoffPolicy = settings.backoffPolicy();
    }

    /**
     * Delivers one event. Retryable failures (transport errors, timeouts, 5xx, 429) are retried
     * up to the configured attempt count; anything else fails after one attempt. The returned
     * Mono never errors: an undeliverable event is logged and reported as a failed result.
     */
    public Mono<DeliveryResult> deliver(WebhookEvent event, String destinationUrl) {
        String botId = event.getBotId();
        URI destination;
        try {
            destination = urlPolicy.validate(destinationUrl);
        } catch (InvalidRequestException e) {
            log.error("[{}] Dropping {} event, webhook URL rejected: {}", botId, event.getEventType(), e.getMessage());
            return Mono.just(DeliveryResult.builder()
                    .outcome(DeliveryResult.Outcome.PERMANENT_FAILURE)
                    .attempts(0)
                    .elapsed(Duration.ZERO)
                    .error(e.getMessage())
                    .build());
        }

        return Mono.defer(() -> {
            long started = System.nanoTime();
            AtomicInteger attempts = new AtomicInteger();
            return Mono.defer(() -> {
                        attempts.incrementAndGet();
                        return attempt(destination, event);
                    })
                    .retryWhen(backoffPolicy.toReactorRetry(signal ->
                            log.warn("[{}] Webhook {} attempt {}/{} failed: {}, retrying",
                                    botId, event.getEventType(), signal.totalRetries() + 1,
                                    backoffPolicy.getMaxAttempts(), signal.failure().getMessage())))
                    .map(status -> {
                        log.debug("[{}] Webhook {} delivered (HTTP {}, attempt {})",
                                botId, event.getEventType(), status, attempts.get());
                        return DeliveryResult.builder()
                                .outcome(DeliveryResult.Outcome.DELIVERED)
                                .attempts(attempts.get())
                                .elapsed(elapsedSince(started))
                                .statusCode(status)
                                .build();
                    })
                    .onErrorResume(error -> Mono.just(dropped(event, attempts.get(), started, error)));
        });
    }

    /**
     * Opens an ordered delivery pipeline for one bot.
     */
    public WebhookDispatcher openDispatcher(String botId, String destinationUrl) {
        return new WebhookDispatcher(botId, settings.getQueueCapacity(), event -> deliver(event, destinationUrl));
    }

    private Mono<Integer> attempt(URI destination, WebhookEvent event) {
        return webClient.post()
                .uri(destination)
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(event)
                .exchangeToMono(response -> {
                    int status = response.statusCode().value();
                    if (response.statusCode().is2xxSuccessful()) {
                        return response.releaseBody().thenReturn(status);
                    }
                    return response.releaseBody().then(Mono.error(WebhookDeliveryException.forStatus(status)));
                })
                .timeout(settings.getTimeout())
                .onErrorMap(error -> !(error instanceof WebhookDeliveryException), WebhookDeliveryException::transport);
    }

    private DeliveryResult dropped(WebhookEvent event, int attempts, long started, Throwable error) {
        boolean retryable = WebhookDeliveryException.isRetryable(error);
        Integer status = error instanceof WebhookDeliveryException
                ? ((WebhookDeliveryException) error).getStatusCode()
                : null;

        log.error("[{}] Dropping {} event after {} attempt(s): {}",
                event.getBotId(), event.getEventType(), attempts, error.getMessage());

        return DeliveryResult.builder()
                .outcome(retryable ? DeliveryResult.Outcome.RETRIES_EXHAUSTED : DeliveryResult.Outcome.PERMANENT_FAILURE)
                .attempts(attempts)
                .elapsed(elapsedSince(started))
                .statusCode(status)
                .error(error.getMessage())
                .build();
    }

    private static Duration elapsedSince(long startedNanos) {
        return Duration.ofNanos(System.nanoTime() - startedNanos);
    }
}
