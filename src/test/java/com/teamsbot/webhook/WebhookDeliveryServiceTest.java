package com.teamsbot.webhook;

import com.teamsbot.config.WebClientConfig;
import com.teamsbot.config.WebhookSettings;
import com.teamsbot.model.BotState;
import com.teamsbot.model.WebhookEvent;
import com.teamsbot.testutil.TestSettings;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.ClientRequest;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.io.IOException;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;

import static org.assertj.core.api.Assertions.assertThat;

class WebhookDeliveryServiceTest {

    private static final String DESTINATION = "https://hooks.example.com/teams";

    private final WebhookSettings settings = TestSettings.webhook().build();
    private final List<ClientRequest> requests = new CopyOnWriteArrayList<>();

    private final WebhookEvent event = WebhookEvent.botStatus("bot_0123456789abcdef", BotState.IN_MEETING,
            "Joined meeting", Map.of(), Instant.parse("2024-05-01T10:00:00Z"));

    private WebhookDeliveryService serviceResponding(Function<Integer, Mono<ClientResponse>> responder) {
        AtomicInteger calls = new AtomicInteger();
        WebClient.Builder builder = WebClient.builder().exchangeFunction(request -> {
            requests.add(request);
            return responder.apply(calls.incrementAndGet());
        });
        WebClient webClient = new WebClientConfig().webClient(builder, settings);
        return new WebhookDeliveryService(webClient, settings, new WebhookUrlPolicy(settings));
    }

    private static Mono<ClientResponse> status(HttpStatus status) {
        return Mono.just(ClientResponse.create(status).build());
    }

    @Test
    void deliversOnFirstSuccess() {
        WebhookDeliveryService service = serviceResponding(call -> status(HttpStatus.OK));

        DeliveryResult result = service.deliver(event, DESTINATION).block();

        assertThat(result.getOutcome()).isEqualTo(DeliveryResult.Outcome.DELIVERED);
        assertThat(result.getAttempts()).isEqualTo(1);
        assertThat(result.getStatusCode()).isEqualTo(200);
        assertThat(requests).hasSize(1);

        ClientRequest request = requests.get(0);
        assertThat(request.method()).isEqualTo(HttpMethod.POST);
        assertThat(request.url().toString()).isEqualTo(DESTINATION);
        assertThat(request.headers().getContentType()).isEqualTo(MediaType.APPLICATION_JSON);
        assertThat(request.headers().getFirst(HttpHeaders.USER_AGENT)).isEqualTo(WebClientConfig.USER_AGENT);
    }

    @Test
    void alwaysFailingDestinationGetsExactlyRetryCountAttempts() {
        WebhookDeliveryService service = serviceResponding(call -> status(HttpStatus.INTERNAL_SERVER_ERROR));

        DeliveryResult result = service.deliver(event, DESTINATION).block();

        assertThat(result.getOutcome()).isEqualTo(DeliveryResult.Outcome.RETRIES_EXHAUSTED);
        assertThat(result.getAttempts()).isEqualTo(settings.getRetryCount());
        assertThat(result.getStatusCode()).isEqualTo(500);
        assertThat(requests).hasSize(settings.getRetryCount());
    }

    @Test
    void clientErrorsAreNotRetried() {
        WebhookDeliveryService service = serviceResponding(call -> status(HttpStatus.NOT_FOUND));

        DeliveryResult result = service.deliver(event, DESTINATION).block();

        assertThat(result.getOutcome()).isEqualTo(DeliveryResult.Outcome.PERMANENT_FAILURE);
        assertThat(result.getAttempts()).isEqualTo(1);
        assertThat(result.getStatusCode()).isEqualTo(404);
        assertThat(requests).hasSize(1);
    }

    @Test
    void tooManyRequestsIsRetried() {
        WebhookDeliveryService service = serviceResponding(call ->
                call == 1 ? status(HttpStatus.TOO_MANY_REQUESTS) : status(HttpStatus.ACCEPTED));

        DeliveryResult result = service.deliver(event, DESTINATION).block();

        assertThat(result.isDelivered()).isTrue();
        assertThat(result.getAttempts()).isEqualTo(2);
        assertThat(result.getStatusCode()).isEqualTo(202);
    }

    @Test
    void transportErrorsAreRetried() {
        WebhookDeliveryService service = serviceResponding(call ->
                call < 3 ? Mono.error(new IOException("Connection refused")) : status(HttpStatus.OK));

        DeliveryResult result = service.deliver(event, DESTINATION).block();

        assertThat(result.isDelivered()).isTrue();
        assertThat(result.getAttempts()).isEqualTo(3);
    }

    @Test
    void disallowedDestinationIsNeverCalled() {
        WebhookDeliveryService service = serviceResponding(call -> status(HttpStatus.OK));

        DeliveryResult result = service.deliver(event, "http://localhost:9000/hook").block();

        assertThat(result.getOutcome()).isEqualTo(DeliveryResult.Outcome.PERMANENT_FAILURE);
        assertThat(result.getAttempts()).isZero();
        assertThat(result.getError()).contains("https");
        assertThat(requests).isEmpty();
    }
}
