package com.teamsbot.retry;

import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class BackoffPolicyTest {

    private final BackoffPolicy policy = BackoffPolicy.builder()
            .maxAttempts(3)
            .baseDelay(Duration.ofMillis(500))
            .maxDelay(Duration.ofMillis(1500))
            .retryable(error -> error instanceof IllegalStateException)
            .build();

    @Test
    void delaysGrowExponentiallyUpToTheCap() {
        assertThat(policy.delayBeforeRetry(1)).isEqualTo(Duration.ofMillis(500));
        assertThat(policy.delayBeforeRetry(2)).isEqualTo(Duration.ofMillis(1000));
        assertThat(policy.delayBeforeRetry(3)).isEqualTo(Duration.ofMillis(1500));
        assertThat(policy.delayBeforeRetry(10)).isEqualTo(Duration.ofMillis(1500));
    }

    @Test
    void maxAttemptsIncludesTheFirstAttempt() {
        IllegalStateException error = new IllegalStateException("boom");

        assertThat(policy.shouldRetry(1, error)).isTrue();
        assertThat(policy.shouldRetry(2, error)).isTrue();
        assertThat(policy.shouldRetry(3, error)).isFalse();
    }

    @Test
    void nonRetryableErrorsAreNeverRetried() {
        assertThat(policy.shouldRetry(1, new IllegalArgumentException("bad"))).isFalse();
    }

    @Test
    void rejectsZeroBasedRetryNumbers() {
        assertThatThrownBy(() -> policy.delayBeforeRetry(0)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void reactorRetryStopsAfterMaxAttemptsAndPropagatesTheLastError() {
        BackoffPolicy fast = policy.toBuilder().baseDelay(Duration.ofMillis(1)).build();
        AtomicInteger subscriptions = new AtomicInteger();
        AtomicInteger retries = new AtomicInteger();

        Mono<String> failing = Mono.defer(() -> {
            subscriptions.incrementAndGet();
            return Mono.error(new IllegalStateException("attempt " + subscriptions.get()));
        });

        assertThatThrownBy(() -> failing.retryWhen(fast.toReactorRetry(signal -> retries.incrementAndGet())).block())
                .isInstanceOf(IllegalStateException.class)
                .hasMessage("attempt 3");
        assertThat(subscriptions).hasValue(3);
        assertThat(retries).hasValue(2);
    }

    @Test
    void reactorRetryGivesUpImmediatelyOnNonRetryableError() {
        AtomicInteger subscriptions = new AtomicInteger();

        Mono<String> failing = Mono.defer(() -> {
            subscriptions.incrementAndGet();
            return Mono.error(new IllegalArgumentException("rejected"));
        });

        assertThatThrownBy(() -> failing.retryWhen(policy.toReactorRetry()).block())
                .isInstanceOf(IllegalArgumentException.class);
        assertThat(subscriptions).hasValue(1);
    }

    @Test
    void reactorRetryRecoversWhenALaterAttemptSucceeds() {
        BackoffPolicy fast = policy.toBuilder().baseDelay(Duration.ofMillis(1)).build();
        AtomicInteger subscriptions = new AtomicInteger();

        Mono<String> flaky = Mono.defer(() -> subscriptions.incrementAndGet() < 2
                ? Mono.error(new IllegalStateException("flaky"))
                : Mono.just("ok"));

        assertThat(flaky.retryWhen(fast.toReactorRetry()).block()).isEqualTo("ok");
        assertThat(subscriptions).hasValue(2);
    }
}
